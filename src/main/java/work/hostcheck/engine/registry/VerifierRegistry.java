package work.hostcheck.engine.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostcheck.engine.api.VerificationReport;
import work.hostcheck.engine.api.Verifier;
import work.hostcheck.engine.dispatch.VerificationDispatcher;
import work.hostcheck.engine.resource.ProviderDefinition;
import work.hostcheck.engine.resource.ProviderDirectory;
import work.hostcheck.engine.resource.ResourceResolver;

/**
 * One verifier per resource type in the provider directory, keyed by snake_case type name.
 * Built once and never modified.
 */
public final class VerifierRegistry {
    private static final Logger log = LoggerFactory.getLogger(VerifierRegistry.class);

    private final Map<String, Entry> verifiers;

    private VerifierRegistry(Map<String, Entry> verifiers) {
        this.verifiers = Collections.unmodifiableMap(new LinkedHashMap<>(verifiers));
    }

    public static VerifierRegistry create(ResourceResolver resolver, String backendSelector) {
        var entries = new LinkedHashMap<String, Entry>();
        var directory = resolver.directory();
        for (String providerName : directory.listResourceTypes()) {
            String name = ProviderDirectory.resourceName(providerName);
            log.debug("Generating verifier for {}", name);
            String description = directory.find(providerName).map(ProviderDefinition::description).orElse("");
            entries.put(name, new Entry(name, new VerificationDispatcher(name, backendSelector, resolver), description));
        }
        return new VerifierRegistry(entries);
    }

    public Entry get(String name) {
        return verifiers.get(name);
    }

    public List<String> names() {
        return List.copyOf(verifiers.keySet());
    }

    public Map<String, Entry> entries() {
        return verifiers;
    }

    public VerificationReport verify(String name, String subject, Map<String, Object> checks) {
        var entry = verifiers.get(name);
        if (entry == null) {
            throw new IllegalStateException("Resource type not registered: " + name);
        }
        return entry.verifier().verify(subject, checks);
    }

    public record Entry(String name, Verifier verifier, String description) {}
}
