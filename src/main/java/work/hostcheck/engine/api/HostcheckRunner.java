package work.hostcheck.engine.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.hostcheck.engine.backend.Backends;
import work.hostcheck.engine.declaration.Declaration;
import work.hostcheck.engine.declaration.DeclarationLoader;
import work.hostcheck.engine.provider.LocalProviders;
import work.hostcheck.engine.registry.VerifierRegistry;
import work.hostcheck.engine.resource.ProviderDirectory;
import work.hostcheck.engine.resource.ResourceConstructionException;
import work.hostcheck.engine.resource.ResourceResolver;

/**
 * Public entry point for embedding the engine: loads declaration documents and verifies each declaration.
 */
public final class HostcheckRunner {
    private static final Logger log = LoggerFactory.getLogger(HostcheckRunner.class);

    private final ProviderDirectory directory;

    public HostcheckRunner() {
        this(LocalProviders.directory());
    }

    public HostcheckRunner(ProviderDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public SuiteResult run(HostcheckConfiguration configuration) {
        var started = Instant.now();
        try {
            var resolver = new ResourceResolver(directory, Backends.factory(configuration.commandTimeout()));
            var registry = VerifierRegistry.create(resolver, configuration.backendSelector());
            var reports = new LinkedHashMap<String, VerificationReport>();
            for (Path document : configuration.documents()) {
                log.debug("Loading declarations from {}", document);
                for (Declaration declaration : DeclarationLoader.loadFromLocalFile(document)) {
                    if (reports.containsKey(declaration.id())) {
                        throw new IllegalArgumentException("Duplicate declaration id: " + declaration.id());
                    }
                    reports.put(declaration.id(), verify(registry, declaration));
                }
            }
            return SuiteResult.of(reports, started);
        } catch (RuntimeException ex) {
            log.debug("Run failed", ex);
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            return SuiteResult.error(message, started);
        }
    }

    static VerificationReport verify(VerifierRegistry registry, Declaration declaration) {
        var entry = registry.get(declaration.resourceType());
        if (entry == null) {
            return VerificationReport.failed("Unknown resource type " + declaration.resourceType() + " in " + declaration.id());
        }
        Map<String, Object> checks = declaration.checks();
        try {
            return entry.verifier().verify(declaration.subject(), checks);
        } catch (ResourceConstructionException ex) {
            return VerificationReport.failed(ex.getMessage());
        }
    }
}
