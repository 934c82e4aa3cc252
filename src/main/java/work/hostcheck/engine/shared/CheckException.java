package work.hostcheck.engine.shared;

/**
 * Failure scoped to a single declared check. Recorded in the report instead of aborting the resource.
 */
public class CheckException extends RuntimeException {
    private final String code;

    public CheckException(String code, String message) {
        super(message);
        this.code = code;
    }

    public CheckException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
