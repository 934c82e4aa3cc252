package work.hostcheck.engine.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.support.EngineTestSupport;
import work.hostcheck.engine.support.EngineTestSupport.FakeBackend;

class ResourceResolverTest {
    @Test
    void snakeCaseNameMapsToProvider() {
        var backend = new FakeBackend();
        var handle = EngineTestSupport.fakeResolver(backend).resolve("system_info", EngineTestSupport.FAKE_SELECTOR);
        assertEquals("SystemInfo", handle.typeName());
        assertEquals("Static system facts", handle.description());
        assertSame(backend, handle.backend());
    }

    @Test
    void blankSelectorFallsBackToLocal() {
        List<String> selectors = new ArrayList<>();
        var resolver = new ResourceResolver(EngineTestSupport.fakeDirectory(), selector -> {
            selectors.add(selector);
            return new FakeBackend();
        });
        resolver.resolve("package", null);
        resolver.resolve("package", " ");
        assertEquals(List.of(Backend.DEFAULT_SELECTOR, Backend.DEFAULT_SELECTOR), selectors);
    }

    @Test
    void unknownTypeIsUnsupported() {
        var thrown = assertThrows(
            UnsupportedResourceException.class,
            () -> EngineTestSupport.fakeResolver().resolve("teapot", EngineTestSupport.FAKE_SELECTOR)
        );
        assertEquals("teapot", thrown.typeName());
        assertEquals(EngineTestSupport.FAKE_SELECTOR, thrown.backendSelector());
    }

    @Test
    void providerRejectingBackendIsUnsupported() {
        assertThrows(
            UnsupportedResourceException.class,
            () -> EngineTestSupport.fakeResolver().resolve("unavailable", EngineTestSupport.FAKE_SELECTOR)
        );
        var directory = EngineTestSupport.fakeDirectory();
        assertFalse(directory.isSupported("Unavailable", new FakeBackend()));
        assertTrue(directory.isSupported("Package", new FakeBackend()));
        assertFalse(directory.isSupported("Teapot", new FakeBackend()));
    }

    @Test
    void directoryRejectsDuplicatesAndUnannotatedTypes() {
        var builder = ProviderDirectory.builder().register(EngineTestSupport.FakePackage.class);
        assertThrows(IllegalArgumentException.class, () -> builder.register(EngineTestSupport.FakePackage.class));
        assertThrows(IllegalArgumentException.class, () -> ProviderDirectory.builder().register(String.class));
    }

    @Test
    void providersAreFoundByExposedName() {
        var directory = ProviderDirectory.builder().register(EngineTestSupport.FakeSystemInfo.class).build();
        assertEquals("SystemInfo", directory.findByResourceName("system_info").orElseThrow().typeName());
        assertTrue(directory.findByResourceName("SystemInfo").isEmpty());
        assertEquals("http_server", ProviderDirectory.resourceName("HTTPServer"));
    }

    @Test
    void typesCollidingOnExposedNameAreRejected() {
        var builder = ProviderDirectory.builder().register(SystemInfoUpper.class);
        var thrown = assertThrows(IllegalArgumentException.class, () -> builder.register(EngineTestSupport.FakeSystemInfo.class));
        assertTrue(thrown.getMessage().endsWith("share the name system_info"));
    }

    @ResourceType("SYSTEMInfo")
    public static final class SystemInfoUpper {
        public SystemInfoUpper() {}
    }
}
