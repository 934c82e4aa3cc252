package work.hostcheck.engine.backend;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Creates backends from selectors such as {@code local://}.
 */
public final class Backends {
    private Backends() {}

    public static BackendFactory factory(Optional<Duration> commandTimeout) {
        Optional<Duration> timeout = commandTimeout == null ? Optional.empty() : commandTimeout;
        return selector -> create(selector, timeout);
    }

    public static Backend create(String selector, Optional<Duration> commandTimeout) {
        String effective = selector == null || selector.isBlank() ? Backend.DEFAULT_SELECTOR : selector.trim();
        String scheme = scheme(effective);
        if ("local".equals(scheme)) {
            return new LocalBackend(effective, commandTimeout);
        }
        throw new IllegalArgumentException("Unsupported backend: " + effective);
    }

    private static String scheme(String selector) {
        int separator = selector.indexOf("://");
        if (separator <= 0) {
            throw new IllegalArgumentException("Invalid backend selector: " + selector);
        }
        return selector.substring(0, separator).toLowerCase(Locale.ROOT);
    }
}
