package work.hostcheck.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a {@link HostcheckRunner} execution: one report per declaration id, in document order.
 */
public record SuiteResult(
    Status status,
    Map<String, VerificationReport> reports,
    String error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public SuiteResult {
        reports = Collections.unmodifiableMap(new LinkedHashMap<>(reports));
    }

    public static SuiteResult of(Map<String, VerificationReport> reports, Instant startedAt) {
        boolean success = reports.values().stream().allMatch(VerificationReport::success);
        return new SuiteResult(success ? Status.SUCCESS : Status.FAILURE, reports, null, startedAt, Instant.now());
    }

    public static SuiteResult error(String message, Instant startedAt) {
        return new SuiteResult(Status.ERROR, Map.of(), message, startedAt, Instant.now());
    }

    public long passedCount() {
        return reports.values().stream().filter(VerificationReport::success).count();
    }

    public long failedCount() {
        return reports.size() - passedCount();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        if (error != null) {
            serializable.put("error", error);
        }
        Map<String, Object> results = new LinkedHashMap<>();
        reports.forEach((id, report) -> results.put(id, report.toSerializableMap()));
        serializable.put("results", results);
        serializable.put("passed", passedCount());
        serializable.put("failed", failedCount());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return fallbackJson(ex.getMessage());
        }
    }

    static String fallbackJson(String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("status", "error");
        node.put("message", message);
        return node.toString();
    }

    public String toText() {
        StringBuilder builder = new StringBuilder();
        if (error != null) {
            builder.append("ERROR ").append(error).append(System.lineSeparator());
        }
        reports.forEach((id, report) -> {
            builder.append(report.success() ? "PASS " : "FAIL ").append(id).append(System.lineSeparator());
            report.passMessages().forEach(message -> builder.append("  ").append(message).append(System.lineSeparator()));
            report.failMessages().forEach(message -> builder.append("  ").append(message).append(System.lineSeparator()));
        });
        builder.append(passedCount()).append(" passed, ").append(failedCount()).append(" failed");
        return builder.toString();
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        ERROR(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
