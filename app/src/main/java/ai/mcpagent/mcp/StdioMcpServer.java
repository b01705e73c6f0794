package ai.mcpagent.mcp;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

@JsonTypeName("stdio")
public record StdioMcpServer(
        /** Unique name of the server within the configuration. */
        String name,

        /**
         * Executable to launch the MCP server over stdio.
         *
         * <p>This is the binary or script name as it would be invoked from a shell, e.g. "node", "python", or an
         * absolute path to an executable.
         */
        @Nullable String command,

        /**
         * Command-line arguments passed to the {@code command}.
         *
         * <p>Arguments are provided in order and without shell parsing.
         */
        List<String> args,

        /**
         * Environment variables to set for the server process.
         *
         * <p>Keys and values are applied on top of the current process environment. Values beginning with
         * {@code $VAR} or {@code ${VAR}} are expanded from this process's environment at launch.
         */
        Map<String, String> env,

        /** Optional human-readable description. */
        @Nullable String description)
        implements McpServer {

    public StdioMcpServer {
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public StdioMcpServer(String name, String command, List<String> args) {
        this(name, command, args, Map.of(), null);
    }

    /** A subprocess that exited is not restarted behind the caller's back; use an explicit restart. */
    @Override
    @JsonIgnore
    public boolean reconnect() {
        return false;
    }

    @Override
    @JsonIgnore
    public String transportName() {
        return "stdio";
    }
}
