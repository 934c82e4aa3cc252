package work.hostcheck.engine.member;

import work.hostcheck.engine.shared.CheckException;

/**
 * The provider threw while an attribute was read or an operation was invoked.
 */
public final class MemberInvocationException extends CheckException {
    public MemberInvocationException(String message, Throwable cause) {
        super("member_invocation_failed", message, cause);
    }
}
