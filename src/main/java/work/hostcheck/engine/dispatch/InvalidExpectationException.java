package work.hostcheck.engine.dispatch;

import work.hostcheck.engine.shared.CheckException;

/**
 * A structured expectation is missing one of its required keys.
 */
public final class InvalidExpectationException extends CheckException {
    public InvalidExpectationException(String message) {
        super("invalid_expectation", message);
    }
}
