package work.hostcheck.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CaseConverterTest {
    @Test
    void camelToSnake() {
        assertEquals("package", CaseConverter.camelToSnake("Package"));
        assertEquals("system_info", CaseConverter.camelToSnake("SystemInfo"));
        assertEquals("is_installed", CaseConverter.camelToSnake("isInstalled"));
        assertEquals("http_server", CaseConverter.camelToSnake("HTTPServer"));
        assertEquals("sha256sum", CaseConverter.camelToSnake("sha256sum"));
        assertEquals("family", CaseConverter.camelToSnake("FAMILY"));
    }
}
