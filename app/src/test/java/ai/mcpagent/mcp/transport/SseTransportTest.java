package ai.mcpagent.mcp.transport;

import static org.junit.jupiter.api.Assertions.*;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.McpProtocolClient;
import ai.mcpagent.mcp.SseMcpServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(15)
class SseTransportTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String END = "<end>";

    private HttpServer server;
    private final BlockingQueue<String> events = new LinkedBlockingQueue<>();
    private final List<String> posted = new CopyOnWriteArrayList<>();
    private final OkHttpClient http = new OkHttpClient.Builder().readTimeout(Duration.ZERO).build();
    private final CountDownLatch releaseStalledPosts = new CountDownLatch(1);
    private volatile boolean announceEndpoint = true;
    // tools/call POSTs hang until the test ends; everything else is answered like a minimal MCP server
    private volatile boolean stallToolCalls = false;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/sse", this::stream);
        server.createContext("/message", this::message);
        server.start();
    }

    @AfterEach
    void stopServer() {
        releaseStalledPosts.countDown();
        events.add(END);
        server.stop(0);
    }

    private void stream(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/event-stream");
        exchange.sendResponseHeaders(200, 0);
        try (var out = exchange.getResponseBody()) {
            if (announceEndpoint) {
                out.write("event: endpoint\ndata: /message?sessionId=abc\n\n".getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
            while (true) {
                var event = events.poll(10, TimeUnit.SECONDS);
                if (event == null || END.equals(event)) {
                    return;
                }
                out.write(event.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void message(HttpExchange exchange) throws IOException {
        var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        posted.add(exchange.getRequestURI().getQuery() + " " + body);
        if (stallToolCalls) {
            answerAsServer(MAPPER.readTree(body));
        } else {
            // echo the frame back over the event stream
            events.add("event: message\ndata: " + body + "\n\n");
        }
        exchange.sendResponseHeaders(202, -1);
        exchange.close();
    }

    private void answerAsServer(JsonNode frame) {
        var method = frame.path("method").asText("");
        if (McpSchema.METHOD_TOOLS_CALL.equals(method)) {
            try {
                releaseStalledPosts.await(20, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return;
        }
        if (!frame.has("id")) {
            return;
        }
        var result = McpSchema.METHOD_INITIALIZE.equals(method)
                ? "{\"protocolVersion\":\"2024-11-05\",\"capabilities\":{},\"serverInfo\":{\"name\":\"stall\",\"version\":\"1\"}}"
                : "{\"tools\":[]}";
        events.add("event: message\ndata: {\"jsonrpc\":\"2.0\",\"id\":" + frame.get("id") + ",\"result\":" + result
                + "}\n\n");
    }

    private SseTransport transport(Duration connectTimeout) {
        var url = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/sse");
        return new SseTransport(new SseMcpServer("sse-test", url), http, connectTimeout);
    }

    @Test
    void postsToAnnouncedEndpointAndReceivesMessages() throws Exception {
        try (var transport = transport(Duration.ofSeconds(5))) {
            transport.start();
            assertTrue(transport.isOpen());

            transport.send(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_TOOLS_LIST, 7, null));

            var inbound = assertInstanceOf(Transport.Message.class, transport.receive());
            var echoed = assertInstanceOf(McpSchema.JSONRPCRequest.class, inbound.message());
            assertEquals(McpSchema.METHOD_TOOLS_LIST, echoed.method());
            assertEquals(7, ((Number) echoed.id()).intValue());
            assertEquals(1, posted.size());
            assertTrue(posted.get(0).startsWith("sessionId=abc "));
        }
    }

    @Test
    void malformedEventIsReportedAndStreamContinues() throws Exception {
        try (var transport = transport(Duration.ofSeconds(5))) {
            transport.start();
            events.add("event: message\ndata: {broken\n\n");
            events.add("event: message\ndata: {\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}\n\n");

            assertInstanceOf(Transport.Malformed.class, transport.receive());
            assertInstanceOf(Transport.Message.class, transport.receive());
        }
    }

    @Test
    void missingEndpointEventIsTransportUnavailable() {
        announceEndpoint = false;
        var transport = transport(Duration.ofMillis(300));
        var e = assertThrows(McpException.class, transport::start);
        assertEquals(ErrorKind.TRANSPORT_UNAVAILABLE, e.kind());
        assertFalse(transport.isOpen());
    }

    @Test
    void unreachableServerIsTransportUnavailable() throws Exception {
        var url = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/sse");
        server.stop(0);
        var transport = new SseTransport(new SseMcpServer("gone", url), http, Duration.ofSeconds(5));
        var e = assertThrows(McpException.class, transport::start);
        assertEquals(ErrorKind.TRANSPORT_UNAVAILABLE, e.kind());
    }

    @Test
    void serverClosingStreamIsReportedAsClosed() throws Exception {
        try (var transport = transport(Duration.ofSeconds(5))) {
            transport.start();
            events.add(END);
            assertInstanceOf(Transport.Closed.class, transport.receive());
            assertFalse(transport.isOpen());
            var e = assertThrows(
                    McpException.class,
                    () -> transport.send(new McpSchema.JSONRPCNotification(
                            McpSchema.JSONRPC_VERSION, McpSchema.METHOD_NOTIFICATION_INITIALIZED, null)));
            assertEquals(ErrorKind.SERVER_UNAVAILABLE, e.kind());
        }
    }

    @Test
    void postThatIsNeverAnsweredTimesOutAtTheDeadline() throws Exception {
        stallToolCalls = true;
        try (var transport = transport(Duration.ofSeconds(5))) {
            transport.start();
            var call = new McpSchema.JSONRPCRequest(
                    McpSchema.JSONRPC_VERSION,
                    McpSchema.METHOD_TOOLS_CALL,
                    1,
                    new McpSchema.CallToolRequest("x", Map.of()));

            long start = System.nanoTime();
            var e = assertThrows(McpException.class, () -> transport.send(call, Instant.now().plusMillis(300)));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(ErrorKind.TIMEOUT, e.kind());
            assertTrue(elapsedMs < 2_000, "send took " + elapsedMs + " ms");
        }
    }

    @Test
    void toolCallOnStalledServerTimesOutWithinItsDeadline() throws Exception {
        stallToolCalls = true;
        var client = new McpProtocolClient("stall", transport(Duration.ofSeconds(5)));
        try {
            client.connect(Duration.ofSeconds(5));
            long start = System.nanoTime();
            var e = assertThrows(
                    McpException.class,
                    () -> client.invoke("x", MAPPER.createObjectNode(), Instant.now().plusMillis(500)));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(ErrorKind.TIMEOUT, e.kind());
            assertTrue(elapsedMs < 3_000, "invoke took " + elapsedMs + " ms");
            assertEquals(McpProtocolClient.ConnectionState.READY, client.state());
        } finally {
            client.close();
        }
    }
}
