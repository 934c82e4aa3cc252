package work.hostcheck.engine.dispatch;

import work.hostcheck.engine.shared.CheckException;

public final class InvalidExpectationTypeException extends CheckException {
    public InvalidExpectationTypeException(Object expectation) {
        super(
            "invalid_expectation_type",
            "Expected bool or mapping but received " + (expectation == null ? "null" : expectation.getClass().getSimpleName())
        );
    }
}
