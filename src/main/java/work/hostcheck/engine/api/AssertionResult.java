package work.hostcheck.engine.api;

import work.hostcheck.engine.shared.ValueFormatter;

/**
 * Outcome of one declared check. {@code error} is set when the check could not be evaluated.
 */
public record AssertionResult(String member, Object expectation, Object actual, boolean passed, String error) {
    public static AssertionResult evaluated(String member, Object expectation, Object actual, boolean passed) {
        return new AssertionResult(member, expectation, actual, passed, null);
    }

    public static AssertionResult errored(String member, Object expectation, String error) {
        return new AssertionResult(member, expectation, null, false, error);
    }

    public boolean errored() {
        return error != null;
    }

    public String message(String typeName, String subject) {
        StringBuilder builder = new StringBuilder()
            .append(passed ? "Assertion passed: " : "Assertion failed: ")
            .append(typeName).append(' ')
            .append(subject).append(' ')
            .append(member).append(' ')
            .append(ValueFormatter.format(expectation))
            .append(". Actual result: ")
            .append(errored() ? "<none>" : ValueFormatter.format(actual));
        if (errored()) {
            builder.append(". Error: ").append(error);
        }
        return builder.toString();
    }
}
