package work.hostcheck.engine.member;

import work.hostcheck.engine.shared.CheckException;

/**
 * An operation was declared without a usable {@code parameter}.
 */
public final class MissingArgumentException extends CheckException {
    public MissingArgumentException(String message) {
        super("missing_argument", message);
    }
}
