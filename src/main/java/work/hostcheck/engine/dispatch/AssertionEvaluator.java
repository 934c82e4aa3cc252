package work.hostcheck.engine.dispatch;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostcheck.engine.compare.ComparatorRegistry;
import work.hostcheck.engine.compare.InvalidComparatorException;

/**
 * Decides whether an actual result satisfies an expectation.
 */
public final class AssertionEvaluator {
    static final String EXPECTED_KEY = "expected";
    static final String COMPARISON_KEY = "comparison";

    private static final Logger log = LoggerFactory.getLogger(AssertionEvaluator.class);

    private final ComparatorRegistry comparators;

    public AssertionEvaluator() {
        this(ComparatorRegistry.standard());
    }

    public AssertionEvaluator(ComparatorRegistry comparators) {
        this.comparators = Objects.requireNonNull(comparators, "comparators");
    }

    /**
     * A boolean expectation only matches a {@link Boolean} result of the same value; {@code 1} or
     * {@code null} never satisfy {@code true}/{@code false}. A mapping expectation applies
     * {@code comparison} to {@code (expected, actual)}.
     */
    public boolean evaluate(Object expectation, Object actual) {
        log.debug("Expected result: {}. Actual result: {}", expectation, actual);
        if (expectation instanceof Boolean expected) {
            return actual instanceof Boolean result && result.booleanValue() == expected.booleanValue();
        }
        if (expectation instanceof Map<?, ?> spec) {
            if (!spec.containsKey(COMPARISON_KEY)) {
                throw new InvalidExpectationException(
                    "The comparison mapping provided has no \"" + COMPARISON_KEY + "\" key: " + spec
                );
            }
            Object comparison = spec.get(COMPARISON_KEY);
            if (!(comparison instanceof String name)) {
                throw new InvalidComparatorException("Comparison " + comparison + " is not a valid selection.");
            }
            var comparator = comparators.resolve(name);
            if (!spec.containsKey(EXPECTED_KEY)) {
                throw new InvalidExpectationException(
                    "The comparison mapping provided has no \"" + EXPECTED_KEY + "\" key: " + spec
                );
            }
            return comparator.test(spec.get(EXPECTED_KEY), actual);
        }
        throw new InvalidExpectationTypeException(expectation);
    }
}
