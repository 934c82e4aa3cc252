package work.hostcheck.engine.resource;

/**
 * A resource could not be instantiated from the declared subject and constructor arguments.
 */
public final class ResourceConstructionException extends RuntimeException {
    private final String typeName;

    public ResourceConstructionException(String typeName, String message) {
        super(message);
        this.typeName = typeName;
    }

    public ResourceConstructionException(String typeName, String message, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
