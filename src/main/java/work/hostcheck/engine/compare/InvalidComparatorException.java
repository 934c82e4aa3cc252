package work.hostcheck.engine.compare;

import work.hostcheck.engine.shared.CheckException;

/**
 * The {@code comparison} of a structured expectation cannot be used.
 */
public class InvalidComparatorException extends CheckException {
    public InvalidComparatorException(String message) {
        super("invalid_comparator", message);
    }

    protected InvalidComparatorException(String code, String message) {
        super(code, message);
    }
}
