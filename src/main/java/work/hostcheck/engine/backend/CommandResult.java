package work.hostcheck.engine.backend;

import java.util.List;

/**
 * Outcome of a command executed through a {@link Backend}.
 */
public record CommandResult(List<String> command, int exitStatus, String stdout, String stderr) {
    public CommandResult {
        command = command == null ? List.of() : List.copyOf(command);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitStatus == 0;
    }
}
