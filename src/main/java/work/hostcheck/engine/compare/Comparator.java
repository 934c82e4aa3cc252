package work.hostcheck.engine.compare;

/**
 * Named binary predicate applied as {@code test(expected, actual)}.
 */
@FunctionalInterface
public interface Comparator {
    boolean test(Object expected, Object actual);
}
