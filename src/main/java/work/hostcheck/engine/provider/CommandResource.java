package work.hostcheck.engine.provider;

import work.hostcheck.engine.backend.Backend;
import work.hostcheck.engine.backend.CommandResult;
import work.hostcheck.engine.resource.Attribute;
import work.hostcheck.engine.resource.Param;
import work.hostcheck.engine.resource.ResourceType;
import work.hostcheck.engine.resource.Subject;

/**
 * Runs a shell command once and exposes its exit status and output.
 */
@ResourceType(value = "Command", description = "Run a shell command and inspect its result")
public final class CommandResource {
    private final Backend backend;

    @Attribute
    private final String command;

    @Attribute
    private final String cwd;

    private CommandResult result;

    public CommandResource(Backend backend, @Subject String command, @Param("cwd") String cwd) {
        this.backend = backend;
        this.command = command;
        this.cwd = cwd;
    }

    @Attribute
    public int rc() {
        return result().exitStatus();
    }

    @Attribute
    public String stdout() {
        return result().stdout();
    }

    @Attribute
    public String stderr() {
        return result().stderr();
    }

    @Attribute
    public boolean succeeded() {
        return result().succeeded();
    }

    @Attribute
    public boolean failed() {
        return !result().succeeded();
    }

    private CommandResult result() {
        if (result == null) {
            String script = cwd == null || cwd.isBlank() ? command : "cd " + ShellQuote.quote(cwd) + " && " + command;
            result = backend.runShell(script);
        }
        return result;
    }
}
