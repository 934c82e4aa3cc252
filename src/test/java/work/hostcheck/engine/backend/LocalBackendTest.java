package work.hostcheck.engine.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocalBackendTest {
    @BeforeEach
    void requirePosixShell() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
    }

    @Test
    void capturesExitStatusAndBothStreams() {
        var result = new LocalBackend().runShell("echo out; echo err >&2; exit 4");
        assertEquals(4, result.exitStatus());
        assertEquals("out\n", result.stdout());
        assertEquals("err\n", result.stderr());
        assertFalse(result.succeeded());
    }

    @Test
    void concurrentNoisyCommandsCompleteWhileCommonPoolIsBusy() throws Exception {
        var backend = new LocalBackend(Backend.DEFAULT_SELECTOR, Optional.of(Duration.ofSeconds(30)));
        assumeTrue(backend.hasCommand("head"));
        var release = new CountDownLatch(1);
        List<CompletableFuture<Void>> blockers = new ArrayList<>();
        for (int i = 0; i < ForkJoinPool.getCommonPoolParallelism(); i++) {
            blockers.add(CompletableFuture.runAsync(() -> {
                try {
                    release.await();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }));
        }
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<CommandResult>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(() -> backend.runShell("head -c 300000 /dev/zero >&2; echo done")));
            }
            for (Future<CommandResult> future : results) {
                CommandResult result = future.get();
                assertEquals(0, result.exitStatus());
                assertEquals("done\n", result.stdout());
                assertEquals(300000, result.stderr().length());
            }
        } finally {
            release.countDown();
            callers.shutdownNow();
        }
        CompletableFuture.allOf(blockers.toArray(new CompletableFuture[0])).join();
    }

    @Test
    void timeoutKillsTheCommand() {
        var backend = new LocalBackend(Backend.DEFAULT_SELECTOR, Optional.of(Duration.ofMillis(200)));
        var thrown = assertThrows(BackendException.class, () -> backend.runShell("sleep 5"));
        assertTrue(thrown.getMessage().startsWith("Command timed out"));
    }

    @Test
    void missingExecutableCannotStart() {
        assertThrows(BackendException.class, () -> new LocalBackend().run(List.of("/nonexistent/hostcheck-probe")));
        assertThrows(IllegalArgumentException.class, () -> new LocalBackend().run(List.of()));
    }

    @Test
    void commandLookupUsesPath() {
        var backend = new LocalBackend();
        assertTrue(backend.hasCommand("sh"));
        assertTrue(backend.hasCommand("/bin/sh"));
        assertFalse(backend.hasCommand("hostcheck-no-such-command"));
        assertFalse(backend.hasCommand(""));
    }
}
