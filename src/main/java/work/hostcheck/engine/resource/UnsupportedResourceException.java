package work.hostcheck.engine.resource;

/**
 * The resource type is not implemented for the selected backend or platform.
 */
public final class UnsupportedResourceException extends RuntimeException {
    private final String typeName;
    private final String backendSelector;

    public UnsupportedResourceException(String typeName, String backendSelector, String reason) {
        super("The " + typeName + " resource is not supported by backend " + backendSelector + ": " + reason);
        this.typeName = typeName;
        this.backendSelector = backendSelector;
    }

    public String typeName() {
        return typeName;
    }

    public String backendSelector() {
        return backendSelector;
    }
}
