package work.hostcheck.engine.backend;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands on the host the engine itself runs on.
 */
public final class LocalBackend implements Backend {
    private static final Logger log = LoggerFactory.getLogger(LocalBackend.class);

    private final String selector;
    private final Optional<Duration> commandTimeout;

    public LocalBackend() {
        this(DEFAULT_SELECTOR, Optional.empty());
    }

    public LocalBackend(String selector, Optional<Duration> commandTimeout) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.commandTimeout = commandTimeout == null ? Optional.empty() : commandTimeout;
    }

    @Override
    public String selector() {
        return selector;
    }

    public Optional<Duration> commandTimeout() {
        return commandTimeout;
    }

    @Override
    public CommandResult run(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        log.debug("Running {} on {}", command, selector);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new BackendException("Unable to start " + command.get(0) + ": " + ex.getMessage(), ex);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException ex) {
            log.debug("Unable to close stdin of {}", command, ex);
        }
        // each stream gets its own thread, outside any shared pool
        ExecutorService drains = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "hostcheck-drain");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<String> stdout = drains.submit(() -> drain(process.getInputStream()));
            Future<String> stderr = drains.submit(() -> drain(process.getErrorStream()));
            if (commandTimeout.isPresent()) {
                if (!process.waitFor(commandTimeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new BackendException("Command timed out after " + commandTimeout.get() + ": " + command);
                }
            } else {
                process.waitFor();
            }
            var result = new CommandResult(command, process.exitValue(), stdout.get(), stderr.get());
            log.debug("Command {} exited with {}", command, result.exitStatus());
            return result;
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while running " + command, ex);
        } catch (ExecutionException ex) {
            throw new BackendException("Unable to read output of " + command + ": " + ex.getCause().getMessage(), ex.getCause());
        } finally {
            drains.shutdownNow();
        }
    }

    @Override
    public boolean hasCommand(String executable) {
        if (executable == null || executable.isBlank()) {
            return false;
        }
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isBlank()) {
            return false;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            if (Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
