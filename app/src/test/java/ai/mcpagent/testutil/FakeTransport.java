package ai.mcpagent.testutil;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.transport.JsonRpcFrames;
import ai.mcpagent.mcp.transport.Transport;
import ai.mcpagent.util.ExecutorServiceUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory MCP server behind the {@link Transport} interface. Answers the handshake, {@code tools/list} and
 * {@code tools/call} according to the tools it was given, and records every frame the client sends as JSON.
 * Everything it delivers goes through the same frame decoding as the real transports.
 */
public class FakeTransport implements Transport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** How the fake answers {@code initialize}. */
    public enum HandshakeBehavior {
        ANSWER,
        SILENT,
        ERROR,
        DIE
    }

    /**
     * @param delayMs how long to wait before answering; negative means never answer
     * @param handler builds the text result from the call's arguments
     */
    public record FakeTool(String name, String inputSchemaJson, long delayMs, boolean isError, Function<JsonNode, String> handler) {
        public static FakeTool echo(String name) {
            return new FakeTool(
                    name,
                    "{\"type\":\"object\",\"properties\":{\"text\":{\"type\":\"string\"}},\"required\":[\"text\"]}",
                    0,
                    false,
                    args -> args.path("text").asText());
        }

        public FakeTool withDelay(long delayMs) {
            return new FakeTool(name, inputSchemaJson, delayMs, isError, handler);
        }

        public FakeTool hanging() {
            return withDelay(-1);
        }

        public FakeTool failing() {
            return new FakeTool(name, inputSchemaJson, delayMs, true, handler);
        }
    }

    private final String name;
    private final Map<String, FakeTool> tools = new LinkedHashMap<>();
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler =
            Executors.newScheduledThreadPool(4, ExecutorServiceUtil.createNamedThreadFactory("fake-mcp"));
    private final AtomicInteger inFlightCalls = new AtomicInteger();
    private final AtomicInteger maxInFlightCalls = new AtomicInteger();
    private final AtomicInteger starts = new AtomicInteger();

    private volatile boolean open;
    private volatile boolean failOnStart;
    private volatile boolean failOnClose;
    private volatile boolean multiplexing = true;
    private volatile HandshakeBehavior handshake = HandshakeBehavior.ANSWER;
    private volatile int pageSize = Integer.MAX_VALUE;
    private volatile @Nullable String toolAnnotationsJson;

    public FakeTransport(String name, FakeTool... tools) {
        this.name = name;
        for (var tool : tools) {
            this.tools.put(tool.name(), tool);
        }
    }

    // ---- configuration ----

    public FakeTransport failOnStart() {
        this.failOnStart = true;
        return this;
    }

    /** close() still closes, then throws. */
    public FakeTransport failOnClose() {
        this.failOnClose = true;
        return this;
    }

    public FakeTransport withoutMultiplexing() {
        this.multiplexing = false;
        return this;
    }

    public FakeTransport handshake(HandshakeBehavior behavior) {
        this.handshake = behavior;
        return this;
    }

    public FakeTransport pageSize(int pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    /** Annotations attached to every listed tool, e.g. {@code {"readOnlyHint": false}}. */
    public FakeTransport toolAnnotations(String json) {
        this.toolAnnotationsJson = json;
        return this;
    }

    public synchronized void setTools(FakeTool... replacement) {
        tools.clear();
        for (var tool : replacement) {
            tools.put(tool.name(), tool);
        }
    }

    // ---- server-initiated traffic ----

    public void pushNotification(String method) {
        var frame = MAPPER.createObjectNode();
        frame.put("jsonrpc", "2.0");
        frame.put("method", method);
        pushFrame(frame);
    }

    public void pushRequest(long id, String method) {
        var frame = MAPPER.createObjectNode();
        frame.put("jsonrpc", "2.0");
        frame.put("id", id);
        frame.put("method", method);
        pushFrame(frame);
    }

    public void pushFrame(JsonNode frame) {
        inbound.add(JsonRpcFrames.decode(frame.toString()));
    }

    public void pushMalformed(String raw) {
        inbound.add(new Malformed(raw, "not JSON"));
    }

    /** Simulates the server process exiting. */
    public void die(int exitCode) {
        open = false;
        inbound.add(new Closed("process exited", exitCode));
    }

    // ---- Transport ----

    @Override
    public void start() throws McpException {
        starts.incrementAndGet();
        if (failOnStart) {
            throw new McpException(ErrorKind.TRANSPORT_UNAVAILABLE, "cannot start " + name);
        }
        open = true;
    }

    @Override
    public void send(McpSchema.JSONRPCMessage frame, @Nullable Instant deadline) throws McpException {
        if (!open) {
            throw new McpException(ErrorKind.SERVER_UNAVAILABLE, name + " is not open");
        }
        JsonNode message = MAPPER.valueToTree(frame);
        sent.add(message);
        var method = message.path("method").asText(null);
        if (method == null || !message.has("id")) {
            return;
        }
        long id = message.get("id").asLong();
        switch (method) {
            case "initialize" -> answerInitialize(id);
            case "tools/list" -> answerToolsList(id, message.path("params").path("cursor").asText(null));
            case "tools/call" -> answerToolsCall(id, message.path("params"));
            default -> reply(id, error(-32601, "Method not found: " + method));
        }
    }

    private void answerInitialize(long id) {
        switch (handshake) {
            case ANSWER -> {
                var result = MAPPER.createObjectNode();
                result.put("protocolVersion", "2024-11-05");
                result.putObject("capabilities").putObject("tools").put("listChanged", true);
                var info = result.putObject("serverInfo");
                info.put("name", name);
                info.put("version", "1.0");
                reply(id, result("result", result));
            }
            case ERROR -> reply(id, error(-32602, "unsupported protocol version"));
            case DIE -> die(1);
            case SILENT -> {}
        }
    }

    private synchronized void answerToolsList(long id, @Nullable String cursor) {
        var all = new ArrayList<>(tools.values());
        int start = cursor == null ? 0 : Integer.parseInt(cursor);
        int end = (int) Math.min(all.size(), (long) start + pageSize);
        var result = MAPPER.createObjectNode();
        var array = result.putArray("tools");
        for (var tool : all.subList(start, end)) {
            var node = array.addObject();
            node.put("name", tool.name());
            node.put("description", "Fake tool " + tool.name());
            try {
                node.set("inputSchema", MAPPER.readTree(tool.inputSchemaJson()));
                if (toolAnnotationsJson != null) {
                    node.set("annotations", MAPPER.readTree(toolAnnotationsJson));
                }
            } catch (Exception e) {
                throw new IllegalStateException("bad fake schema for " + tool.name(), e);
            }
        }
        if (end < all.size()) {
            result.put("nextCursor", String.valueOf(end));
        }
        reply(id, result("result", result));
    }

    private void answerToolsCall(long id, JsonNode params) {
        FakeTool tool;
        synchronized (this) {
            tool = tools.get(params.path("name").asText());
        }
        if (tool == null) {
            reply(id, error(-32602, "Unknown tool: " + params.path("name").asText()));
            return;
        }
        int now = inFlightCalls.incrementAndGet();
        maxInFlightCalls.accumulateAndGet(now, Math::max);
        if (tool.delayMs() < 0) {
            return;
        }
        Runnable answer = () -> {
            inFlightCalls.decrementAndGet();
            var result = MAPPER.createObjectNode();
            var block = result.putArray("content").addObject();
            block.put("type", "text");
            block.put("text", tool.handler().apply(params.path("arguments")));
            result.put("isError", tool.isError());
            reply(id, result("result", result));
        };
        if (tool.delayMs() == 0) {
            answer.run();
        } else {
            scheduler.schedule(answer, tool.delayMs(), TimeUnit.MILLISECONDS);
        }
    }

    private static ObjectNode result(String field, JsonNode value) {
        var node = MAPPER.createObjectNode();
        node.set(field, value);
        return node;
    }

    private static ObjectNode error(int code, String message) {
        var node = MAPPER.createObjectNode();
        var error = node.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return node;
    }

    private void reply(long id, ObjectNode body) {
        if (!open) {
            return;
        }
        var frame = MAPPER.createObjectNode();
        frame.put("jsonrpc", "2.0");
        frame.put("id", id);
        frame.setAll(body);
        pushFrame(frame);
    }

    @Override
    public Inbound receive() throws InterruptedException {
        var next = inbound.take();
        if (next instanceof Closed) {
            inbound.add(next);
        }
        return next;
    }

    @Override
    public void close() {
        if (open) {
            open = false;
            inbound.add(new Closed("closed by client", null));
        }
        scheduler.shutdownNow();
        if (failOnClose) {
            throw new IllegalStateException("cannot close " + name);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean supportsMultiplexing() {
        return multiplexing;
    }

    @Override
    public String describe() {
        return "fake:" + name;
    }

    // ---- inspection ----

    public List<JsonNode> sent() {
        return List.copyOf(sent);
    }

    public int sendCount() {
        return sent.size();
    }

    public List<String> sentMethods() {
        return sent.stream().map(f -> f.path("method").asText("")).toList();
    }

    /** Request ids named by {@code notifications/cancelled} frames, in order. */
    public List<Long> cancelledIds() {
        return sent.stream()
                .filter(f -> "notifications/cancelled".equals(f.path("method").asText()))
                .map(f -> f.path("params").path("requestId").asLong())
                .toList();
    }

    /** Ids of every request the client sent, in order. */
    public List<Long> requestIds() {
        return sent.stream()
                .filter(f -> f.has("id") && f.has("method"))
                .map(f -> f.get("id").asLong())
                .toList();
    }

    public int maxInFlightCalls() {
        return maxInFlightCalls.get();
    }

    public int starts() {
        return starts.get();
    }
}
