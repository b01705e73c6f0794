package ai.mcpagent.mcp;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jetbrains.annotations.Nullable;

/**
 * Configuration of one MCP server. Immutable; the name is unique within a {@link McpConfig}.
 *
 * <p>Serialized with a {@code transport} discriminator so that {@code .mcprc} entries map directly onto the two
 * implementations.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "transport",
        defaultImpl = StdioMcpServer.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SseMcpServer.class, name = "sse"),
    @JsonSubTypes.Type(value = StdioMcpServer.class, name = "stdio")
})
public interface McpServer {

    /** Unique name used for status reporting and as the owner tag of discovered tools. */
    String name();

    /** Optional free-form description shown in status output. */
    @Nullable
    String description();

    /** Whether a degraded connection to this server may be recreated transparently on next use. */
    boolean reconnect();

    /** Wire name of the transport, matching the JSON discriminator. */
    String transportName();
}
