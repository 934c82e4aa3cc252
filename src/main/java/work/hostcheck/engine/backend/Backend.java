package work.hostcheck.engine.backend;

import java.util.List;

/**
 * Execution context that resource providers inspect the target host through.
 */
public interface Backend {
    String DEFAULT_SELECTOR = "local://";

    String selector();

    /**
     * Runs {@code command} on the target and waits for it to finish.
     *
     * @throws BackendException when the command cannot be started, times out or is interrupted
     */
    CommandResult run(List<String> command);

    /**
     * Runs {@code script} through the target's POSIX shell.
     */
    default CommandResult runShell(String script) {
        return run(List.of("/bin/sh", "-c", script));
    }

    boolean hasCommand(String executable);
}
