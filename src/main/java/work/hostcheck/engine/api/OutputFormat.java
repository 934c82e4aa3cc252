package work.hostcheck.engine.api;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    TEXT;

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}
