package work.hostcheck.engine.member;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.hostcheck.engine.support.EngineTestSupport.operation;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.hostcheck.engine.resource.ResourceHandle;
import work.hostcheck.engine.support.EngineTestSupport;

class MemberResolverTest {
    private final MemberResolver resolver = new MemberResolver();

    @Test
    void computedAttributeIsEvaluated() {
        var handle = handle("package");
        var instance = handle.instantiate("python", Map.of());
        var kind = resolver.resolve(handle, instance, "version");
        assertTrue(kind instanceof MemberKind.ComputedAttribute);
        assertEquals("2.7.9-1", resolver.result(handle, kind, true));
    }

    @Test
    void instanceFieldIsPlainValue() {
        var handle = handle("package");
        var instance = handle.instantiate("python", Map.of());
        var kind = resolver.resolve(handle, instance, "name");
        assertTrue(kind instanceof MemberKind.PlainValue);
        assertEquals("python", resolver.result(handle, kind, true));
    }

    @Test
    void staticFieldResolvesOnTheType() {
        var handle = handle("system_info");
        var instance = handle.instantiate(null, Map.of());
        var kind = resolver.resolve(handle, instance, "family");
        assertEquals(new MemberKind.PlainValue("family", "posix"), kind);
    }

    @Test
    void typeLevelMemberShadowsInstanceField() {
        var handle = handle("shadowed");
        var instance = handle.instantiate("svc", Map.of());
        var kind = resolver.resolve(handle, instance, "label");
        assertTrue(kind instanceof MemberKind.ComputedAttribute);
        assertEquals("type-level", resolver.result(handle, kind, true));
    }

    @Test
    void operationTakesParameterFromExpectation() {
        var handle = handle("package");
        var instance = handle.instantiate("nginx", Map.of());
        var kind = resolver.resolve(handle, instance, "has_file");
        assertTrue(kind instanceof MemberKind.Operation);
        assertEquals(true, resolver.result(handle, kind, operation("/usr/share/nginx/html", "is_", true)));
        assertEquals(false, resolver.result(handle, kind, operation("/etc/passwd", "is_", true)));
    }

    @Test
    void operationWithoutArgumentMappingIsRejected() {
        var handle = handle("package");
        var instance = handle.instantiate("nginx", Map.of());
        var kind = resolver.resolve(handle, instance, "has_file");
        var bare = assertThrows(MissingArgumentException.class, () -> resolver.result(handle, kind, true));
        assertTrue(bare.getMessage().contains("An argument mapping is required"));
        var noKey = assertThrows(
            MissingArgumentException.class,
            () -> resolver.result(handle, kind, Map.of("expected", true, "comparison", "is_"))
        );
        assertTrue(noKey.getMessage().contains("no key named \"parameter\""));
    }

    @Test
    void unknownMemberNamesTheResource() {
        var handle = handle("package");
        var instance = handle.instantiate("nginx", Map.of());
        var thrown = assertThrows(UnknownMemberException.class, () -> resolver.resolve(handle, instance, "bogus_attr"));
        assertEquals("The Package resource does not have any attribute or operation named bogus_attr", thrown.getMessage());
        assertEquals("unknown_member", thrown.code());
    }

    @Test
    void providerFailureBecomesInvocationError() {
        var handle = handle("exploding");
        var instance = handle.instantiate("fine", Map.of());
        var thrown = assertThrows(MemberInvocationException.class, () -> resolver.resolve(handle, instance, "state"));
        assertTrue(thrown.getMessage().endsWith("state probe crashed"));
    }

    private static ResourceHandle handle(String typeName) {
        return EngineTestSupport.fakeResolver().resolve(typeName, EngineTestSupport.FAKE_SELECTOR);
    }
}
