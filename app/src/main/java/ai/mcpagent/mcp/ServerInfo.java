package ai.mcpagent.mcp;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import io.modelcontextprotocol.spec.McpSchema;
import org.jetbrains.annotations.Nullable;

/** What a server told us about itself during the handshake. Cached for the life of the connection. */
public record ServerInfo(
        String protocolVersion,
        String serverName,
        String serverVersion,
        McpSchema.ServerCapabilities capabilities,
        @Nullable String instructions) {

    static ServerInfo fromInitializeResult(McpSchema.InitializeResult result) throws McpException {
        if (result.protocolVersion() == null || result.protocolVersion().isBlank()) {
            throw new McpException(ErrorKind.PROTOCOL_FRAMING, "initialize result has no protocolVersion");
        }
        var info = result.serverInfo();
        var capabilities = result.capabilities();
        return new ServerInfo(
                result.protocolVersion(),
                info == null || info.name() == null ? "unknown" : info.name(),
                info == null || info.version() == null ? "" : info.version(),
                capabilities == null ? McpSchema.ServerCapabilities.builder().build() : capabilities,
                result.instructions());
    }

    public boolean supportsToolListChanged() {
        var tools = capabilities.tools();
        return tools != null && Boolean.TRUE.equals(tools.listChanged());
    }
}
