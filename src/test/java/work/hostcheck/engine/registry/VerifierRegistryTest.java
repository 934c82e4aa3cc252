package work.hostcheck.engine.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.hostcheck.engine.backend.Backends;
import work.hostcheck.engine.provider.LocalProviders;
import work.hostcheck.engine.resource.Attribute;
import work.hostcheck.engine.resource.ProviderDirectory;
import work.hostcheck.engine.resource.ResourceResolver;
import work.hostcheck.engine.resource.ResourceType;
import work.hostcheck.engine.resource.Subject;
import work.hostcheck.engine.support.EngineTestSupport;
import work.hostcheck.engine.support.EngineTestSupport.FakeBackend;

class VerifierRegistryTest {
    @Test
    void localProvidersAreExposedUnderSnakeCaseNames() {
        var resolver = new ResourceResolver(LocalProviders.directory(), Backends.factory(Optional.empty()));
        var registry = VerifierRegistry.create(resolver, "local://");
        assertEquals(List.of("command", "file", "package", "service", "system_info"), registry.names());
        assertEquals("Return system information", registry.get("system_info").description());
    }

    @Test
    void everyProviderGetsItsOwnVerifier() {
        var registry = VerifierRegistry.create(EngineTestSupport.fakeResolver(), EngineTestSupport.FAKE_SELECTOR);
        assertEquals(
            List.of("package", "file", "system_info", "shadowed", "exploding", "unavailable"),
            registry.names()
        );
        assertNotNull(registry.get("package"));
        assertNull(registry.get("Package"));
        assertTrue(registry.entries().get("file").verifier() != registry.entries().get("package").verifier());
    }

    @Test
    void verifyDelegatesToTheNamedVerifier() {
        var registry = VerifierRegistry.create(EngineTestSupport.fakeResolver(), EngineTestSupport.FAKE_SELECTOR);
        var report = registry.verify("package", "nginx", Map.of("is_installed", true));
        assertTrue(report.success());
        assertEquals(1, report.passMessages().size());
    }

    @Test
    void verifyingAnUnregisteredNameFails() {
        var registry = VerifierRegistry.create(EngineTestSupport.fakeResolver(), EngineTestSupport.FAKE_SELECTOR);
        var thrown = assertThrows(IllegalStateException.class, () -> registry.verify("teapot", "x", Map.of()));
        assertEquals("Resource type not registered: teapot", thrown.getMessage());
    }

    @Test
    void acronymTypeNamesStayReachable() {
        var directory = ProviderDirectory.builder().register(HttpServer.class).build();
        var backend = new FakeBackend();
        var registry = VerifierRegistry.create(new ResourceResolver(directory, selector -> backend), "fake://");
        assertEquals(List.of("http_server"), registry.names());

        var report = registry.verify("http_server", "web", Map.of("is_running", true));
        assertTrue(report.success());
        assertEquals(List.of("Assertion passed: http_server web is_running true. Actual result: true"), report.passMessages());
    }

    @ResourceType("HTTPServer")
    public static final class HttpServer {
        public HttpServer(@Subject String name) {}

        @Attribute
        public boolean isRunning() {
            return true;
        }
    }
}
