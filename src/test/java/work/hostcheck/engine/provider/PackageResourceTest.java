package work.hostcheck.engine.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.hostcheck.engine.support.EngineTestSupport.FakeBackend;

class PackageResourceTest {
    @Test
    void dpkgStatusDecidesInstallation() {
        var backend = new FakeBackend()
            .withCommand("dpkg-query")
            .on("dpkg-query -f ${Status} -W nginx", 0, "install ok installed")
            .on("dpkg-query -f ${Status} -W vim", 0, "deinstall ok config-files")
            .on("dpkg-query -f ${Status} ${Version} -W nginx", 0, "install ok installed 1.24.0-2");

        var nginx = new PackageResource(backend, "nginx");
        assertTrue(nginx.isInstalled());
        assertEquals("1.24.0-2", nginx.version());
        assertFalse(new PackageResource(backend, "vim").isInstalled());
        assertFalse(new PackageResource(backend, "absent").isInstalled());
        assertEquals(List.of("dpkg-query", "-f", "${Status}", "-W", "nginx"), backend.executed().get(0));
    }

    @Test
    void versionOfMissingPackageFails() {
        var backend = new FakeBackend().withCommand("dpkg-query");
        var thrown = assertThrows(IllegalStateException.class, () -> new PackageResource(backend, "absent").version());
        assertEquals("The package absent is not installed", thrown.getMessage());
        assertThrows(UnsupportedOperationException.class, () -> new PackageResource(backend, "absent").release());
    }

    @Test
    void rpmIsUsedWithoutDpkg() {
        var backend = new FakeBackend()
            .withCommand("rpm")
            .on("rpm -q bash", 0, "bash-5.1.8-6.el9.x86_64")
            .on("rpm -q --queryformat %{VERSION} bash", 0, "5.1.8")
            .on("rpm -q --queryformat %{RELEASE} bash", 0, "6.el9");

        var bash = new PackageResource(backend, "bash");
        assertTrue(bash.isInstalled());
        assertEquals("5.1.8", bash.version());
        assertEquals("6.el9", bash.release());
        assertFalse(new PackageResource(backend, "zsh").isInstalled());
    }

    @Test
    void supportedOnlyWithAPackageManager() {
        assertTrue(PackageResource.supported(new FakeBackend().withCommand("rpm")));
        assertTrue(PackageResource.supported(new FakeBackend().withCommand("dpkg-query")));
        assertFalse(PackageResource.supported(new FakeBackend()));
    }
}
