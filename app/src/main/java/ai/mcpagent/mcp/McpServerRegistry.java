package ai.mcpagent.mcp;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.McpProtocolClient.ConnectionState;
import ai.mcpagent.mcp.transport.SseTransport;
import ai.mcpagent.mcp.transport.StdioTransport;
import ai.mcpagent.mcp.transport.Transport;
import ai.mcpagent.tools.ToolDescriptor;
import ai.mcpagent.util.ExecutorServiceUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Owns one {@link ServerConnection} per configured server and the merged catalog of the tools they advertise.
 *
 * <p>Connections are created lazily: {@link #initialize(McpConfig)} only records them, and a server process is launched
 * (or its stream opened) the first time something needs it. Lifecycle changes on a connection are serialized by that
 * connection's lock; invocations on a READY connection take no registry lock at all.
 *
 * <p>The catalog is an immutable snapshot replaced as a whole whenever a server's tool list changes, so readers never
 * see a mix of old and new entries. When two servers advertise the same tool name, the server configured first wins
 * and the other entry is kept in {@link #shadowedTools()}.
 */
public class McpServerRegistry implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(McpServerRegistry.class);

    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_DISCOVERY_TIMEOUT = Duration.ofSeconds(30);

    /** Creates an unstarted transport for a server configuration. */
    @FunctionalInterface
    public interface TransportFactory {
        Transport create(McpServer server);
    }

    /** Per-server health as exported to callers. Never blocks on network activity to produce. */
    public record ServerStatus(ConnectionState state, @Nullable String lastError, int toolCount) {
        public ObjectNode toJson() {
            var node = JsonNodeFactory.instance.objectNode();
            node.put("state", state.name());
            if (lastError == null) {
                node.putNull("lastError");
            } else {
                node.put("lastError", lastError);
            }
            node.put("toolCount", toolCount);
            return node;
        }
    }

    private record Catalog(Map<String, ToolDescriptor> tools, List<ToolDescriptor> shadowed) {
        static final Catalog EMPTY = new Catalog(Map.of(), List.of());
    }

    private final TransportFactory transportFactory;
    private final Duration handshakeTimeout;
    private final Duration discoveryTimeout;
    private final ExecutorService rediscoveryExecutor =
            ExecutorServiceUtil.newFixedThreadExecutor(1, "mcp-rediscovery");
    private final Object catalogLock = new Object();

    private volatile Map<String, ServerConnection> connections = Map.of();
    private volatile Catalog catalog = Catalog.EMPTY;
    private volatile boolean initialized;
    private volatile boolean shutdown;

    public McpServerRegistry() {
        this(defaultTransportFactory(null), DEFAULT_HANDSHAKE_TIMEOUT, DEFAULT_DISCOVERY_TIMEOUT);
    }

    public McpServerRegistry(TransportFactory transportFactory, Duration handshakeTimeout, Duration discoveryTimeout) {
        this.transportFactory = transportFactory;
        this.handshakeTimeout = handshakeTimeout;
        this.discoveryTimeout = discoveryTimeout;
    }

    /** Stdio servers run in {@code workingDirectory} (the current directory if null); SSE servers use OkHttp. */
    public static TransportFactory defaultTransportFactory(@Nullable Path workingDirectory) {
        return server -> {
            if (server instanceof StdioMcpServer stdio) {
                return new StdioTransport(stdio, workingDirectory);
            } else if (server instanceof SseMcpServer sse) {
                return new SseTransport(sse);
            }
            throw new IllegalArgumentException(
                    "Unsupported MCP server type: " + server.getClass().getName());
        };
    }

    /**
     * Validates the configuration and records one connection per server. Nothing is launched here.
     *
     * @throws ai.mcpagent.exception.McpConfigException if the configuration is invalid
     */
    public synchronized void initialize(McpConfig config) {
        if (initialized) {
            throw new IllegalStateException("MCP server registry already initialized");
        }
        config.validate();
        var map = new LinkedHashMap<String, ServerConnection>();
        for (var server : config.servers()) {
            map.put(server.name(), new ServerConnection(server));
        }
        connections = Collections.unmodifiableMap(map);
        initialized = true;
        logger.debug("Registered {} MCP server(s): {}", map.size(), map.keySet());
    }

    /**
     * Returns a READY client for the server, starting it (handshake and tool discovery) on first use. A degraded
     * connection is recreated if its configuration allows reconnecting.
     *
     * @throws McpException {@code SERVER_UNAVAILABLE} for unknown names, shut-down registries, failed servers that have
     *     not been restarted, and degraded servers that may not reconnect; otherwise the start failure itself
     */
    @Blocking
    public McpProtocolClient ensureStarted(String serverName) throws McpException, InterruptedException {
        var conn = connection(serverName);
        var client = conn.client();
        if (client != null && client.state() == ConnectionState.READY) {
            return client;
        }

        conn.lifecycleLock().lockInterruptibly();
        try {
            if (shutdown) {
                throw new McpException(ErrorKind.SERVER_UNAVAILABLE, "MCP server registry is shut down");
            }
            client = conn.client();
            if (client != null) {
                switch (client.state()) {
                    case READY -> {
                        return client;
                    }
                    case DEGRADED -> {
                        if (!conn.config().reconnect()) {
                            throw new McpException(
                                    ErrorKind.SERVER_UNAVAILABLE,
                                    "MCP server '%s' is degraded (%s); restart it to continue"
                                            .formatted(serverName, conn.lastError()));
                        }
                        logger.info("Reconnecting to degraded MCP server '{}'", serverName);
                        client.close();
                    }
                    case CLOSED -> throw new McpException(
                            ErrorKind.SERVER_UNAVAILABLE,
                            "MCP server '%s' is closed (%s); restart it to retry".formatted(serverName, conn.lastError()));
                    default -> throw new IllegalStateException(
                            "Unexpected state " + client.state() + " for MCP server " + serverName);
                }
            }
            return start(conn);
        } finally {
            conn.lifecycleLock().unlock();
        }
    }

    // must hold conn.lifecycleLock()
    private McpProtocolClient start(ServerConnection conn) throws McpException, InterruptedException {
        var name = conn.name();
        var client = new McpProtocolClient(name, transportFactory.create(conn.config()));
        client.setToolsChangedListener(() -> scheduleRediscovery(name));
        client.setConnectionLostListener(e -> conn.setLastError(e.getMessage()));
        conn.setClient(client);
        conn.setTools(List.of());

        try {
            client.connect(handshakeTimeout);
            var tools = client.listTools(discoveryTimeout);
            conn.setTools(tools);
            conn.setLastError(null);
            publishCatalog();
            logger.info("MCP server '{}' ready with {} tool(s)", name, tools.size());
            return client;
        } catch (McpException e) {
            conn.setLastError(e.getMessage());
            client.close();
            publishCatalog();
            throw e;
        } catch (InterruptedException e) {
            // the caller was cancelled, not the server: leave the connection for the next user to start
            logger.debug("Start of MCP server '{}' abandoned by an interrupted caller", name);
            client.close();
            conn.setClient(null);
            conn.setTools(List.of());
            conn.setLastError(null);
            publishCatalog();
            throw e;
        }
    }

    /**
     * Starts every server that has not been started yet, tolerating individual failures (they are logged and appear
     * in {@link #getServerStatus()}).
     *
     * @return the number of servers that are READY afterwards
     */
    @Blocking
    public int startAll() throws InterruptedException {
        int ready = 0;
        for (var conn : connections.values()) {
            if (conn.state() == ConnectionState.UNINITIALIZED) {
                try {
                    ensureStarted(conn.name());
                } catch (McpException e) {
                    logger.warn("MCP server '{}' failed to start: {}", conn.name(), e.getMessage());
                }
            }
            if (conn.state() == ConnectionState.READY) {
                ready++;
            }
        }
        return ready;
    }

    /** Closes and recreates a connection, clearing its last error. */
    @Blocking
    public McpProtocolClient restart(String serverName) throws McpException, InterruptedException {
        var conn = connection(serverName);
        conn.lifecycleLock().lockInterruptibly();
        try {
            if (shutdown) {
                throw new McpException(ErrorKind.SERVER_UNAVAILABLE, "MCP server registry is shut down");
            }
            var old = conn.client();
            if (old != null) {
                old.close();
            }
            conn.setLastError(null);
            logger.info("Restarting MCP server '{}'", serverName);
            return start(conn);
        } finally {
            conn.lifecycleLock().unlock();
        }
    }

    /** Re-lists a READY server's tools and atomically replaces its catalog entries. */
    @Blocking
    public List<ToolDescriptor> rediscover(String serverName) throws McpException, InterruptedException {
        var conn = connection(serverName);
        var client = ensureStarted(serverName);
        conn.lifecycleLock().lockInterruptibly();
        try {
            var tools = client.listTools(discoveryTimeout);
            conn.setTools(tools);
            publishCatalog();
            logger.debug("Rediscovered {} tool(s) on MCP server '{}'", tools.size(), serverName);
            return tools;
        } finally {
            conn.lifecycleLock().unlock();
        }
    }

    private void scheduleRediscovery(String serverName) {
        if (shutdown) {
            return;
        }
        try {
            rediscoveryExecutor.submit(() -> rediscoverQuietly(serverName));
        } catch (RejectedExecutionException e) {
            logger.debug("Skipping rediscovery of MCP server '{}' during shutdown", serverName);
        }
    }

    private void rediscoverQuietly(String serverName) {
        try {
            rediscover(serverName);
        } catch (McpException e) {
            logger.warn("Rediscovery of MCP server '{}' failed: {}", serverName, e.getMessage());
        } catch (InterruptedException e) {
            logger.debug("Rediscovery of MCP server '{}' interrupted", serverName);
            Thread.currentThread().interrupt();
        }
    }

    /** Calls a tool on a server, starting or reconnecting the server first if needed. */
    @Blocking
    public McpToolResult invoke(String serverName, String toolName, JsonNode arguments, Instant deadline)
            throws McpException, InterruptedException {
        return ensureStarted(serverName).invoke(toolName, arguments, deadline);
    }

    /** Current merged catalog in server configuration order. */
    public List<ToolDescriptor> catalog() {
        return List.copyOf(catalog.tools().values());
    }

    public @Nullable ToolDescriptor lookup(String toolName) {
        return catalog.tools().get(toolName);
    }

    /** Entries hidden by a same-named tool from an earlier server. */
    public List<ToolDescriptor> shadowedTools() {
        return catalog.shadowed();
    }

    private void publishCatalog() {
        synchronized (catalogLock) {
            var tools = new LinkedHashMap<String, ToolDescriptor>();
            var shadowed = new ArrayList<ToolDescriptor>();
            for (var conn : connections.values()) {
                for (var tool : conn.tools()) {
                    var existing = tools.get(tool.name());
                    if (existing != null) {
                        logger.debug(
                                "Tool {} from MCP server {} is shadowed by the one from {}",
                                tool.name(),
                                conn.name(),
                                existing.serverName());
                        shadowed.add(tool);
                    } else {
                        tools.put(tool.name(), tool);
                    }
                }
            }
            catalog = new Catalog(Collections.unmodifiableMap(tools), List.copyOf(shadowed));
        }
    }

    /** One entry per configured server, in configuration order. */
    public Map<String, ServerStatus> getServerStatus() {
        var result = new LinkedHashMap<String, ServerStatus>();
        for (var conn : connections.values()) {
            result.put(conn.name(), new ServerStatus(conn.state(), conn.lastError(), conn.tools().size()));
        }
        return Collections.unmodifiableMap(result);
    }

    /** {@code {serverName: {state, lastError, toolCount}}}. */
    public ObjectNode exportStatus() {
        var node = JsonNodeFactory.instance.objectNode();
        getServerStatus().forEach((name, status) -> node.set(name, status.toJson()));
        return node;
    }

    private ServerConnection connection(String serverName) throws McpException {
        var conn = connections.get(serverName);
        if (conn == null) {
            throw new McpException(ErrorKind.SERVER_UNAVAILABLE, "Unknown MCP server: " + serverName);
        }
        return conn;
    }

    /** Closes every connection. Failures are logged and do not stop the remaining connections from closing. */
    public void shutdown() {
        shutdown = true;
        rediscoveryExecutor.shutdownNow();
        for (var conn : connections.values()) {
            var client = conn.client();
            if (client == null) {
                continue;
            }
            try {
                client.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing MCP server '{}'", conn.name(), e);
            }
        }
        logger.debug("MCP server registry shut down");
    }

    @Override
    public void close() {
        shutdown();
    }
}
