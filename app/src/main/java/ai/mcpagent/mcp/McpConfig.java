package ai.mcpagent.mcp;

import ai.mcpagent.exception.McpConfigException;
import java.util.HashSet;
import java.util.List;

/** Ordered set of MCP servers. Order decides precedence when two servers advertise the same tool name. */
public record McpConfig(List<McpServer> servers) {
    public static final McpConfig EMPTY = new McpConfig(List.of());

    public McpConfig {
        servers = List.copyOf(servers);
    }

    /**
     * Checks that names are unique and every server has what its transport needs to start.
     *
     * @throws McpConfigException on the first problem found
     */
    public void validate() {
        var seen = new HashSet<String>();
        for (var server : servers) {
            var name = server.name();
            if (name == null || name.isBlank()) {
                throw new McpConfigException("MCP server without a name");
            }
            if (!seen.add(name)) {
                throw new McpConfigException("Duplicate MCP server name: " + name);
            }
            if (server instanceof StdioMcpServer stdio) {
                if (stdio.command() == null || stdio.command().isBlank()) {
                    throw new McpConfigException("MCP server '%s' uses stdio but has no command".formatted(name));
                }
            } else if (server instanceof SseMcpServer sse) {
                if (sse.url() == null) {
                    throw new McpConfigException("MCP server '%s' uses sse but has no url".formatted(name));
                }
                var scheme = sse.url().getScheme();
                if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                    throw new McpConfigException(
                            "MCP server '%s' has an unsupported url scheme: %s".formatted(name, sse.url()));
                }
            } else {
                throw new McpConfigException("Unsupported MCP server type: "
                        + server.getClass().getName());
            }
        }
    }
}
