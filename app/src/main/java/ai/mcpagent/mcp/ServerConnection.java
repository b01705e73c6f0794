package ai.mcpagent.mcp;

import ai.mcpagent.mcp.McpProtocolClient.ConnectionState;
import ai.mcpagent.tools.ToolDescriptor;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.jetbrains.annotations.Nullable;

/**
 * Runtime state of one configured server: its current client (and through it the transport), the tools it last
 * advertised, and the last error seen. Owned by {@link McpServerRegistry}; lifecycle changes happen under
 * {@link #lifecycleLock()}, while reads go through volatile fields and never block.
 */
public final class ServerConnection {
    private final McpServer config;
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile @Nullable McpProtocolClient client;
    private volatile List<ToolDescriptor> tools = List.of();
    private volatile @Nullable String lastError;

    ServerConnection(McpServer config) {
        this.config = config;
    }

    public McpServer config() {
        return config;
    }

    public String name() {
        return config.name();
    }

    /** UNINITIALIZED until the first start attempt, then the state of the current client. */
    public ConnectionState state() {
        var current = client;
        return current == null ? ConnectionState.UNINITIALIZED : current.state();
    }

    public List<ToolDescriptor> tools() {
        return tools;
    }

    public @Nullable String lastError() {
        return lastError;
    }

    @Nullable
    McpProtocolClient client() {
        return client;
    }

    ReentrantLock lifecycleLock() {
        return lifecycleLock;
    }

    void setClient(@Nullable McpProtocolClient client) {
        this.client = client;
    }

    void setTools(List<ToolDescriptor> tools) {
        this.tools = List.copyOf(tools);
    }

    void setLastError(@Nullable String lastError) {
        this.lastError = lastError;
    }
}
