package work.hostcheck.engine.compare;

import work.hostcheck.engine.shared.CheckException;

/**
 * Raised by a comparator when its operands cannot be ordered, searched or tested for membership.
 */
public final class IncomparableValuesException extends CheckException {
    public IncomparableValuesException(String message) {
        super("incomparable_values", message);
    }
}
