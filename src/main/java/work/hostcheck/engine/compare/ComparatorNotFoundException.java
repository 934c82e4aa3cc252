package work.hostcheck.engine.compare;

public final class ComparatorNotFoundException extends InvalidComparatorException {
    private final String comparatorName;

    public ComparatorNotFoundException(String comparatorName) {
        super("comparator_not_found", "Comparison " + comparatorName + " is not a valid selection.");
        this.comparatorName = comparatorName;
    }

    public String comparatorName() {
        return comparatorName;
    }
}
