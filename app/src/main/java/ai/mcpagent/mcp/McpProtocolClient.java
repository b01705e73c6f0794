package ai.mcpagent.mcp;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.transport.JsonRpcFrames;
import ai.mcpagent.mcp.transport.Transport;
import ai.mcpagent.tools.JsonSchemas;
import ai.mcpagent.tools.ToolDescriptor;
import ai.mcpagent.util.ExecutorServiceUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * JSON-RPC 2.0 client for one MCP server connection. Frames are the {@link McpSchema} message types; this class adds
 * correlation, deadlines and cancellation on top of a {@link Transport}.
 *
 * <p>Lifecycle: {@code UNINITIALIZED -> HANDSHAKING -> READY -> (DEGRADED | CLOSED)}. A failed handshake is terminal.
 * Losing the transport while READY moves to DEGRADED and fails every outstanding call with
 * {@link ErrorKind#SERVER_UNAVAILABLE}; the client never reconnects by itself.
 *
 * <p>Every request gets a correlation id that is unique for the life of this client. Responses are matched by id only,
 * so concurrent calls never see each other's results. A call that times out or is cancelled is removed from the pending
 * table before it fails, and any response that turns up later is discarded.
 */
public class McpProtocolClient implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(McpProtocolClient.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonRpcFrames.OBJECT_MAPPER;
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String CLIENT_NAME = "mcp-agent";
    public static final String CLIENT_VERSION = "0.1.0";

    static final String METHOD_NOTIFICATION_CANCELLED = "notifications/cancelled";
    static final int METHOD_NOT_FOUND = McpSchema.ErrorCodes.METHOD_NOT_FOUND;
    private static final int MAX_TOOL_PAGES = 100;
    // bound for frames sent on behalf of no particular call: cancellations and replies to the server
    private static final Duration CONTROL_FRAME_TIMEOUT = Duration.ofSeconds(2);

    public enum ConnectionState {
        UNINITIALIZED,
        HANDSHAKING,
        READY,
        DEGRADED,
        CLOSED
    }

    /** An invocation in flight. {@code result} completes exactly once. */
    public record PendingCall(long correlationId, CompletableFuture<McpToolResult> result) {}

    private final String serverName;
    private final Transport transport;
    private final AtomicLong nextId = new AtomicLong(1);
    private final ConcurrentHashMap<Long, CompletableFuture<McpSchema.JSONRPCResponse>> pending = new ConcurrentHashMap<>();
    private final Semaphore serialCalls = new Semaphore(1, true);
    private final AtomicInteger malformedFrames = new AtomicInteger();
    private final Object stateLock = new Object();

    private volatile ConnectionState state = ConnectionState.UNINITIALIZED;
    private volatile @Nullable ServerInfo serverInfo;
    private volatile @Nullable McpException lastError;
    private volatile @Nullable Runnable toolsChangedListener;
    private volatile @Nullable Consumer<McpException> connectionLostListener;

    public McpProtocolClient(String serverName, Transport transport) {
        this.serverName = serverName;
        this.transport = transport;
    }

    public String serverName() {
        return serverName;
    }

    public ConnectionState state() {
        return state;
    }

    public @Nullable ServerInfo serverInfo() {
        return serverInfo;
    }

    public @Nullable McpException lastError() {
        return lastError;
    }

    /** Called from the reader thread when the server announces {@code notifications/tools/list_changed}. */
    public void setToolsChangedListener(@Nullable Runnable listener) {
        this.toolsChangedListener = listener;
    }

    /** Called from the reader thread when a READY connection degrades. */
    public void setConnectionLostListener(@Nullable Consumer<McpException> listener) {
        this.connectionLostListener = listener;
    }

    /**
     * Starts the transport and performs the {@code initialize} handshake.
     *
     * @throws McpException {@code TRANSPORT_UNAVAILABLE} if the server cannot be started, {@code TIMEOUT} if it does
     *     not answer within {@code handshakeTimeout}, {@code PROTOCOL_FRAMING} if the answer is an error or malformed.
     *     In every case the client ends CLOSED.
     */
    @Blocking
    public ServerInfo connect(Duration handshakeTimeout) throws McpException, InterruptedException {
        synchronized (stateLock) {
            if (state != ConnectionState.UNINITIALIZED) {
                throw new IllegalStateException("connect() called in state " + state + " for " + serverName);
            }
            state = ConnectionState.HANDSHAKING;
        }
        var deadline = Instant.now().plus(handshakeTimeout);

        try {
            transport.start();
        } catch (McpException e) {
            throw failHandshake(e);
        } catch (InterruptedException e) {
            failHandshake(new McpException(ErrorKind.CANCELLED, "Interrupted while starting " + serverName));
            throw e;
        }
        ExecutorServiceUtil.startDaemon("mcp-reader-" + serverName, this::readLoop);

        var initialize = new McpSchema.InitializeRequest(
                PROTOCOL_VERSION,
                McpSchema.ClientCapabilities.builder().build(),
                new McpSchema.Implementation(CLIENT_NAME, CLIENT_VERSION));
        McpSchema.JSONRPCResponse response;
        try {
            response = await(sendRequest(McpSchema.METHOD_INITIALIZE, initialize, deadline), deadline, "initialize");
        } catch (McpException e) {
            if (e.kind() == ErrorKind.SERVER_UNAVAILABLE) {
                // the process died or the stream dropped before answering: the server never became available
                throw failHandshake(new McpException(
                        ErrorKind.TRANSPORT_UNAVAILABLE,
                        "MCP server '%s' went away during handshake: %s".formatted(serverName, e.getMessage()),
                        e));
            }
            throw failHandshake(e);
        } catch (InterruptedException e) {
            failHandshake(new McpException(ErrorKind.CANCELLED, "Interrupted during handshake with " + serverName));
            throw e;
        }

        if (response.error() != null) {
            throw failHandshake(new McpException(
                    ErrorKind.PROTOCOL_FRAMING,
                    "MCP server '%s' rejected initialize: %s".formatted(serverName, errorMessage(response))));
        }
        ServerInfo info;
        try {
            info = ServerInfo.fromInitializeResult(resultAs(response, McpSchema.InitializeResult.class, "initialize"));
        } catch (McpException e) {
            throw failHandshake(e);
        }
        if (!PROTOCOL_VERSION.equals(info.protocolVersion())) {
            logger.info(
                    "MCP server '{}' negotiated protocol {} (requested {})",
                    serverName,
                    info.protocolVersion(),
                    PROTOCOL_VERSION);
        }

        try {
            transport.send(
                    new McpSchema.JSONRPCNotification(
                            McpSchema.JSONRPC_VERSION, McpSchema.METHOD_NOTIFICATION_INITIALIZED, null),
                    deadline);
        } catch (McpException e) {
            throw failHandshake(e);
        }

        synchronized (stateLock) {
            if (state != ConnectionState.HANDSHAKING) {
                throw failHandshake(new McpException(
                        ErrorKind.TRANSPORT_UNAVAILABLE, "MCP server '%s' closed during handshake".formatted(serverName)));
            }
            serverInfo = info;
            state = ConnectionState.READY;
        }
        logger.debug("Connected to MCP server '{}' ({} {})", serverName, info.serverName(), info.serverVersion());
        return info;
    }

    private McpException failHandshake(McpException error) {
        logger.warn("Handshake with MCP server '{}' failed: {}", serverName, error.getMessage());
        lastError = error;
        close();
        return error;
    }

    /**
     * Lists the server's tools, following {@code nextCursor} pagination. Entries without a name, or whose schema cannot
     * be represented, are skipped with a warning.
     */
    @Blocking
    public List<ToolDescriptor> listTools(Duration timeout) throws McpException, InterruptedException {
        requireReady();
        var deadline = Instant.now().plus(timeout);
        var result = new ArrayList<ToolDescriptor>();
        String cursor = null;
        for (int pageIndex = 0; pageIndex < MAX_TOOL_PAGES; pageIndex++) {
            Object params = cursor == null ? Map.of() : new McpSchema.PaginatedRequest(cursor);
            var response = await(sendRequest(McpSchema.METHOD_TOOLS_LIST, params, deadline), deadline, "tools/list");
            if (response.error() != null) {
                throw new McpException(
                        ErrorKind.PROTOCOL_FRAMING,
                        "MCP server '%s' failed tools/list: %s".formatted(serverName, errorMessage(response)));
            }
            var page = resultAs(response, McpSchema.ListToolsResult.class, "tools/list");
            if (page.tools() != null) {
                for (var tool : page.tools()) {
                    var descriptor = toDescriptor(tool);
                    if (descriptor != null) {
                        result.add(descriptor);
                    }
                }
            }
            if (page.nextCursor() == null || page.nextCursor().isEmpty()) {
                return result;
            }
            cursor = page.nextCursor();
        }
        logger.warn("MCP server '{}' returned more than {} pages of tools; truncating", serverName, MAX_TOOL_PAGES);
        return result;
    }

    private @Nullable ToolDescriptor toDescriptor(McpSchema.Tool tool) {
        var name = tool.name();
        if (name == null || name.isBlank()) {
            logger.warn("Skipping tool without a name from MCP server '{}': {}", serverName, tool);
            return null;
        }
        try {
            var schema = JsonSchemas.objectSchemaFromJson(withoutNulls(OBJECT_MAPPER.valueToTree(tool.inputSchema())));
            var hints = tool.annotations();
            boolean sideEffecting = hints != null
                    && (Boolean.FALSE.equals(hints.readOnlyHint()) || Boolean.TRUE.equals(hints.destructiveHint()));
            JsonNode outputSchema = tool.outputSchema() == null ? null : OBJECT_MAPPER.valueToTree(tool.outputSchema());
            return new ToolDescriptor(
                    name,
                    tool.description() == null ? "" : tool.description(),
                    schema,
                    outputSchema,
                    serverName,
                    sideEffecting);
        } catch (JsonSchemas.UnsupportedSchemaException e) {
            logger.warn("Skipping tool '{}' from MCP server '{}': {}", name, serverName, e.getMessage());
            return null;
        }
    }

    // McpSchema.JsonSchema serializes absent keywords as explicit nulls
    private static @Nullable JsonNode withoutNulls(@Nullable JsonNode node) {
        if (node instanceof ObjectNode object) {
            var copy = object.deepCopy();
            var names = new ArrayList<String>();
            copy.fieldNames().forEachRemaining(names::add);
            for (var field : names) {
                if (copy.get(field).isNull()) {
                    copy.remove(field);
                }
            }
            return copy;
        }
        return node;
    }

    /**
     * Calls a tool and waits for its result until {@code deadline}.
     *
     * @throws McpException {@code TIMEOUT} when the deadline passes (the server is told to cancel),
     *     {@code SERVER_UNAVAILABLE} if the connection is or becomes unusable, {@code TOOL_EXECUTION} for a JSON-RPC
     *     error reply
     * @throws InterruptedException if the calling thread is interrupted; the call is abandoned and the server is told
     *     to cancel
     */
    @Blocking
    public McpToolResult invoke(String toolName, JsonNode arguments, Instant deadline)
            throws McpException, InterruptedException {
        var call = invokeAsync(toolName, arguments, deadline);
        return awaitCall(call, deadline, "tools/call " + toolName);
    }

    /**
     * Sends a tool call without waiting for the result. Blocks only while waiting for a turn on transports that cannot
     * multiplex.
     */
    public PendingCall invokeAsync(String toolName, JsonNode arguments, Instant deadline)
            throws McpException, InterruptedException {
        requireReady();
        boolean serialized = !transport.supportsMultiplexing();
        if (serialized) {
            long waitMillis = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
            if (!serialCalls.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
                throw new McpException(
                        ErrorKind.TIMEOUT,
                        "Timed out waiting for a turn on MCP server '%s' to call %s".formatted(serverName, toolName));
            }
        }

        Map<String, Object> argumentMap = arguments == null || arguments.isNull()
                ? Map.of()
                : OBJECT_MAPPER.convertValue(arguments, ARGUMENTS_TYPE);

        Request request;
        try {
            request = sendRequest(
                    McpSchema.METHOD_TOOLS_CALL, new McpSchema.CallToolRequest(toolName, argumentMap), deadline);
        } catch (McpException e) {
            if (serialized) serialCalls.release();
            throw e;
        }
        if (serialized) {
            request.response().whenComplete((r, t) -> serialCalls.release());
        }

        var result = request.response().thenApply(response -> {
            if (response.error() != null) {
                throw new CompletionException(new McpException(
                        ErrorKind.TOOL_EXECUTION,
                        "Tool '%s' on MCP server '%s' failed: %s".formatted(toolName, serverName, errorMessage(response))));
            }
            JsonNode body = OBJECT_MAPPER.valueToTree(response.result());
            if (body == null || !body.isObject()) {
                throw new CompletionException(new McpException(
                        ErrorKind.PROTOCOL_FRAMING,
                        "tools/call response from '%s' has no result object".formatted(serverName)));
            }
            try {
                return McpToolResult.fromCallResult(OBJECT_MAPPER.treeToValue(body, McpSchema.CallToolResult.class), body);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CompletionException(new McpException(
                        ErrorKind.PROTOCOL_FRAMING,
                        "Malformed tools/call result from '%s': %s".formatted(serverName, e.getMessage()),
                        e));
            }
        });
        return new PendingCall(request.id(), result);
    }

    private McpToolResult awaitCall(PendingCall call, Instant deadline, String what)
            throws McpException, InterruptedException {
        long remaining = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
        try {
            return call.result().get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(call.correlationId(), ErrorKind.TIMEOUT, "timeout");
            throw new McpException(
                    ErrorKind.TIMEOUT,
                    "No response to %s from MCP server '%s' before its deadline".formatted(what, serverName),
                    e);
        } catch (InterruptedException e) {
            abandon(call.correlationId(), ErrorKind.CANCELLED, "cancelled");
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e, what);
        } catch (CancellationException e) {
            throw new McpException(ErrorKind.CANCELLED, what + " was cancelled", e);
        }
    }

    /**
     * Best-effort cancellation: the local call fails with {@link ErrorKind#CANCELLED} and the server is sent
     * {@code notifications/cancelled}. Whether the server stops work is up to the server.
     *
     * @return false if the id was not pending (already answered, timed out, or unknown)
     */
    public boolean cancel(long correlationId) {
        return abandon(correlationId, ErrorKind.CANCELLED, "cancelled by client");
    }

    private boolean abandon(long id, ErrorKind kind, String reason) {
        var future = pending.remove(id);
        if (future == null) {
            return false;
        }
        future.completeExceptionally(
                new McpException(kind, "Request %d to MCP server '%s' abandoned: %s".formatted(id, serverName, reason)));
        if (transport.isOpen()) {
            var notice = new McpSchema.JSONRPCNotification(
                    McpSchema.JSONRPC_VERSION, METHOD_NOTIFICATION_CANCELLED, Map.of("requestId", id, "reason", reason));
            try {
                transport.send(notice, Instant.now().plus(CONTROL_FRAME_TIMEOUT));
            } catch (McpException e) {
                logger.debug("Could not notify MCP server '{}' of cancellation of {}: {}", serverName, id, e.getMessage());
            }
        }
        return true;
    }

    private record Request(long id, CompletableFuture<McpSchema.JSONRPCResponse> response) {}

    private Request sendRequest(String method, Object params, Instant deadline) throws McpException {
        long id = nextId.getAndIncrement();
        var future = new CompletableFuture<McpSchema.JSONRPCResponse>();
        pending.put(id, future);

        try {
            transport.send(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params), deadline);
        } catch (McpException e) {
            pending.remove(id);
            future.completeExceptionally(e);
            throw e;
        }
        // the connection may have dropped between registration and send
        if (state == ConnectionState.DEGRADED || state == ConnectionState.CLOSED) {
            failPending(id, new McpException(ErrorKind.SERVER_UNAVAILABLE, "MCP server '%s' is %s".formatted(serverName, state)));
        }
        return new Request(id, future);
    }

    private McpSchema.JSONRPCResponse await(Request request, Instant deadline, String what)
            throws McpException, InterruptedException {
        long remaining = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
        try {
            return request.response().get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(request.id(), ErrorKind.TIMEOUT, "timeout");
            throw new McpException(
                    ErrorKind.TIMEOUT,
                    "No response to %s from MCP server '%s' before its deadline".formatted(what, serverName),
                    e);
        } catch (InterruptedException e) {
            abandon(request.id(), ErrorKind.CANCELLED, "cancelled");
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e, what);
        }
    }

    private McpException unwrap(ExecutionException e, String what) {
        var cause = e.getCause();
        if (cause instanceof McpException me) {
            return me;
        }
        return new McpException(ErrorKind.PROTOCOL_FRAMING, what + " failed: " + cause, cause);
    }

    private <T> T resultAs(McpSchema.JSONRPCResponse response, Class<T> type, String what) throws McpException {
        if (response.result() == null) {
            throw new McpException(
                    ErrorKind.PROTOCOL_FRAMING, "%s response from '%s' has no result".formatted(what, serverName));
        }
        try {
            return OBJECT_MAPPER.convertValue(response.result(), type);
        } catch (IllegalArgumentException e) {
            throw new McpException(
                    ErrorKind.PROTOCOL_FRAMING,
                    "Malformed %s result from '%s': %s".formatted(what, serverName, e.getMessage()),
                    e);
        }
    }

    private static String errorMessage(McpSchema.JSONRPCResponse response) {
        var error = response.error();
        var message = error.message() == null ? "unknown error" : error.message();
        return message + " (code " + error.code() + ")";
    }

    private void requireReady() throws McpException {
        var current = state;
        if (current != ConnectionState.READY) {
            throw new McpException(
                    ErrorKind.SERVER_UNAVAILABLE, "MCP server '%s' is not ready (state %s)".formatted(serverName, current));
        }
    }

    // ---- inbound ----

    private void readLoop() {
        try {
            while (true) {
                var inbound = transport.receive();
                if (inbound instanceof Transport.Message message) {
                    dispatch(message.message());
                } else if (inbound instanceof Transport.Malformed malformed) {
                    malformedFrames.incrementAndGet();
                    logger.warn(
                            "Discarding malformed frame from MCP server '{}' ({}): {}",
                            serverName,
                            malformed.reason(),
                            abbreviate(malformed.raw()));
                } else if (inbound instanceof Transport.Closed closed) {
                    onTransportClosed(closed);
                    return;
                }
            }
        } catch (InterruptedException e) {
            logger.debug("Reader for MCP server '{}' interrupted", serverName);
            onTransportClosed(new Transport.Closed("reader interrupted", null));
        }
    }

    private void dispatch(McpSchema.JSONRPCMessage message) {
        if (message instanceof McpSchema.JSONRPCRequest request && request.method() != null) {
            if (request.id() == null) {
                onNotification(request.method(), request.params());
            } else {
                answerServerRequest(request);
            }
        } else if (message instanceof McpSchema.JSONRPCNotification notification && notification.method() != null) {
            onNotification(notification.method(), notification.params());
        } else if (message instanceof McpSchema.JSONRPCResponse response) {
            onResponse(response);
        } else {
            malformedFrames.incrementAndGet();
            logger.warn("Discarding message without a method from MCP server '{}'", serverName);
        }
    }

    private void onResponse(McpSchema.JSONRPCResponse response) {
        var id = response.id();
        long correlationId;
        if (id instanceof Number number) {
            correlationId = number.longValue();
        } else if (id instanceof String text) {
            try {
                correlationId = Long.parseLong(text);
            } catch (NumberFormatException e) {
                logger.debug("Discarding response with foreign id {} from MCP server '{}'", text, serverName);
                return;
            }
        } else {
            malformedFrames.incrementAndGet();
            logger.warn("Discarding response without a usable id from MCP server '{}': {}", serverName, id);
            return;
        }
        var future = pending.remove(correlationId);
        if (future == null) {
            logger.debug("Discarding late or unknown response {} from MCP server '{}'", correlationId, serverName);
            return;
        }
        future.complete(response);
    }

    private void answerServerRequest(McpSchema.JSONRPCRequest request) {
        var method = request.method();
        var reply = McpSchema.METHOD_PING.equals(method)
                ? new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), Map.of(), null)
                : new McpSchema.JSONRPCResponse(
                        McpSchema.JSONRPC_VERSION,
                        request.id(),
                        null,
                        new McpSchema.JSONRPCResponse.JSONRPCError(METHOD_NOT_FOUND, "Method not found: " + method, null));
        try {
            transport.send(reply, Instant.now().plus(CONTROL_FRAME_TIMEOUT));
        } catch (McpException e) {
            logger.debug("Could not answer {} from MCP server '{}': {}", method, serverName, e.getMessage());
        }
    }

    private void onNotification(String method, @Nullable Object params) {
        switch (method) {
            case McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED -> {
                logger.debug("MCP server '{}' reports a changed tool list", serverName);
                var listener = toolsChangedListener;
                if (listener != null) {
                    listener.run();
                }
            }
            case McpSchema.METHOD_NOTIFICATION_MESSAGE -> {
                JsonNode body = OBJECT_MAPPER.valueToTree(params);
                logger.debug(
                        "[{}] {}: {}",
                        serverName,
                        body == null ? "info" : body.path("level").asText("info"),
                        body == null ? "" : body.path("data"));
            }
            default -> logger.trace("Ignoring notification {} from MCP server '{}'", method, serverName);
        }
    }

    private void onTransportClosed(Transport.Closed closed) {
        var reason = closed.exitCode() == null
                ? closed.reason()
                : closed.reason() + " (exit code " + closed.exitCode() + ")";
        var error = new McpException(
                ErrorKind.SERVER_UNAVAILABLE, "Connection to MCP server '%s' lost: %s".formatted(serverName, reason));
        boolean degraded = false;
        synchronized (stateLock) {
            if (state == ConnectionState.READY) {
                state = ConnectionState.DEGRADED;
                lastError = error;
                degraded = true;
            }
        }
        failAllPending(error);
        if (degraded) {
            logger.warn("MCP server '{}' degraded: {}", serverName, reason);
            var listener = connectionLostListener;
            if (listener != null) {
                listener.accept(error);
            }
        }
    }

    private void failPending(long id, McpException error) {
        var future = pending.remove(id);
        if (future != null) {
            future.completeExceptionally(error);
        }
    }

    private void failAllPending(McpException error) {
        for (var id : List.copyOf(pending.keySet())) {
            failPending(id, error);
        }
    }

    /** Closes the transport; outstanding calls fail with {@code SERVER_UNAVAILABLE}. Safe to call repeatedly. */
    @Override
    public void close() {
        synchronized (stateLock) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            state = ConnectionState.CLOSED;
        }
        failAllPending(new McpException(
                ErrorKind.SERVER_UNAVAILABLE, "Connection to MCP server '%s' closed".formatted(serverName)));
        transport.close();
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }

    @VisibleForTesting
    int pendingCount() {
        return pending.size();
    }

    @VisibleForTesting
    int malformedFrameCount() {
        return malformedFrames.get();
    }
}
