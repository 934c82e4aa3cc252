package work.hostcheck.engine.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.hostcheck.engine.support.EngineTestSupport.comparison;
import static work.hostcheck.engine.support.EngineTestSupport.dispatcher;
import static work.hostcheck.engine.support.EngineTestSupport.operation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.hostcheck.engine.resource.ResourceConstructionException;

class VerificationDispatcherTest {
    @Test
    void passingAndFailingChecksAreReportedSeparately() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("is_installed", true);
        checks.put("bogus_attr", true);

        var report = dispatcher("package").verify("python", checks);

        assertFalse(report.success());
        assertEquals(
            List.of("Assertion passed: package python is_installed true. Actual result: true"),
            report.passMessages()
        );
        assertEquals(1, report.failMessages().size());
        assertEquals(
            "Assertion failed: package python bogus_attr true. Actual result: <none>. Error: "
                + "The Package resource does not have any attribute or operation named bogus_attr",
            report.failMessages().get(0)
        );
    }

    @Test
    void noChecksIsVacuouslySuccessful() {
        var report = dispatcher("package").verify("python", Map.of());
        assertTrue(report.success());
        assertTrue(report.passMessages().isEmpty());
        assertTrue(report.failMessages().isEmpty());
    }

    @Test
    void unsupportedResourceFailsWithoutMessages() {
        var report = dispatcher("unavailable").verify("anything", Map.of("exists", true));
        assertFalse(report.success());
        assertTrue(report.passMessages().isEmpty());
        assertTrue(report.failMessages().isEmpty());
    }

    @Test
    void unknownResourceTypeFailsWithoutMessages() {
        var report = dispatcher("no_such_thing").verify("anything", Map.of("exists", true));
        assertFalse(report.success());
        assertTrue(report.passMessages().isEmpty());
        assertTrue(report.failMessages().isEmpty());
    }

    @Test
    void operationReceivesParameterAndComparisonApplies() {
        var checks = Map.<String, Object>of("contains", operation("master", "is_", true));
        var report = dispatcher("file").verify("/etc/salt/minion", checks);
        assertTrue(report.success());
        assertEquals(1, report.passMessages().size());
        assertTrue(report.passMessages().get(0).startsWith("Assertion passed: file /etc/salt/minion contains {"));
        assertTrue(report.passMessages().get(0).endsWith(". Actual result: true"));
    }

    @Test
    void operationWithoutParameterFails() {
        var report = dispatcher("file").verify("/etc/salt/minion", Map.of("contains", true));
        assertFalse(report.success());
        assertTrue(report.failMessages().get(0).contains("An argument mapping is required"));
    }

    @Test
    void unknownComparatorIsRecordedAsFailure() {
        var report = dispatcher("package").verify("python", Map.of("version", comparison("frobnicate", "1")));
        assertFalse(report.success());
        assertTrue(report.failMessages().get(0).endsWith("Error: Comparison frobnicate is not a valid selection."));
    }

    @Test
    void equalityComparisonOnComputedAttribute() {
        assertTrue(dispatcher("package").verify("python", Map.of("version", comparison("eq", "2.7.9-1"))).success());
        var report = dispatcher("package").verify("python", Map.of("version", comparison("eq", "3.0.0")));
        assertFalse(report.success());
        assertTrue(report.failMessages().get(0).endsWith("Actual result: \"2.7.9-1\""));
    }

    @Test
    void booleanExpectationRequiresBooleanResult() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("installed_count", true);
        checks.put("missing_flag", false);
        var report = dispatcher("package").verify("python", checks);
        assertFalse(report.success());
        assertEquals(2, report.failMessages().size());
        assertEquals("Assertion failed: package python installed_count true. Actual result: 1", report.failMessages().get(0));
        assertEquals("Assertion failed: package python missing_flag false. Actual result: null", report.failMessages().get(1));
    }

    @Test
    void invalidExpectationTypeIsRecordedAsFailure() {
        var report = dispatcher("package").verify("python", Map.of("version", "2.7.9-1"));
        assertFalse(report.success());
        assertTrue(report.failMessages().get(0).endsWith("Expected bool or mapping but received String"));
    }

    @Test
    void reservedNamesAreNeverEvaluated() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("_meta", true);
        checks.put("__internal", Map.of("anything", 1));
        checks.put("is_installed", true);
        var report = dispatcher("package").verify("nginx", checks);
        assertTrue(report.success());
        assertEquals(1, report.passMessages().size());
        assertTrue(report.failMessages().isEmpty());
    }

    @Test
    void constructorArgumentsAreConsumedNotChecked() {
        var report = dispatcher("file").verify("/etc/salt/minion", Map.of(
            "encoding", "latin-1",
            "exists", true
        ));
        assertTrue(report.success());
        assertEquals(1, report.passMessages().size());
        assertTrue(report.passMessages().get(0).contains(" exists "));
    }

    @Test
    void constructorArgumentIsVisibleAsInstanceValue() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("encoding", "latin-1");
        checks.put("path", comparison("eq", "/etc/salt/minion"));
        var report = dispatcher("file").verify("/etc/salt/minion", checks);
        assertTrue(report.success());
        assertEquals(1, report.passMessages().size());
    }

    @Test
    void typeLevelValueIsCheckedWithoutSubject() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("family", comparison("eq", "posix"));
        checks.put("type", comparison("eq", "linux"));
        var report = dispatcher("system_info").verify("ignored", checks);
        assertTrue(report.success());
        assertEquals(2, report.passMessages().size());
    }

    @Test
    void constructionFailurePropagates() {
        var thrown = assertThrows(
            ResourceConstructionException.class,
            () -> dispatcher("exploding").verify("boom", Map.of("state", true))
        );
        assertTrue(thrown.getMessage().contains("cannot inspect boom"));
    }

    @Test
    void unconvertibleConstructorArgumentPropagates() {
        assertThrows(
            ResourceConstructionException.class,
            () -> dispatcher("exploding").verify("fine", Map.of("retries", "three"))
        );
    }

    @Test
    void providerFailureDuringCheckDoesNotStopEvaluation() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("retries", 3);
        checks.put("state", true);
        checks.put("owner", true);
        var report = dispatcher("exploding").verify("fine", checks);
        assertFalse(report.success());
        assertEquals(2, report.failMessages().size());
        assertTrue(report.failMessages().get(0).contains("state probe crashed"));
        assertTrue(report.failMessages().get(1).contains("named owner"));
    }

    @Test
    void checksAreEvaluatedInDeclarationOrder() {
        var checks = new LinkedHashMap<String, Object>();
        checks.put("version", comparison("search", "^1\\.24"));
        checks.put("is_installed", true);
        checks.put("has_file", operation("/usr/share/nginx/index.html", "eq", true));
        var report = dispatcher("package").verify("nginx", checks);
        assertTrue(report.success());
        assertEquals(3, report.passMessages().size());
        assertTrue(report.passMessages().get(0).contains(" version "));
        assertTrue(report.passMessages().get(1).contains(" is_installed "));
        assertTrue(report.passMessages().get(2).contains(" has_file "));
    }
}
