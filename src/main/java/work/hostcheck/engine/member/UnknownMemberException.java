package work.hostcheck.engine.member;

import work.hostcheck.engine.shared.CheckException;

public final class UnknownMemberException extends CheckException {
    public UnknownMemberException(String typeName, String memberName) {
        super(
            "unknown_member",
            "The " + typeName + " resource does not have any attribute or operation named " + memberName
        );
    }
}
