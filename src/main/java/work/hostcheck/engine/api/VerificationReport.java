package work.hostcheck.engine.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of verifying one declared resource instance. {@code success} is true when every recorded
 * assertion passed, including when there were none.
 */
public record VerificationReport(boolean success, List<String> passMessages, List<String> failMessages) {
    public VerificationReport {
        passMessages = passMessages == null ? List.of() : List.copyOf(passMessages);
        failMessages = failMessages == null ? List.of() : List.copyOf(failMessages);
    }

    public static VerificationReport failed() {
        return new VerificationReport(false, List.of(), List.of());
    }

    public static VerificationReport failed(String message) {
        return new VerificationReport(false, List.of(), List.of(message));
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("success", success);
        serializable.put("passed", passMessages);
        serializable.put("failed", failMessages);
        return serializable;
    }
}
