package ai.mcpagent.mcp.transport;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.SseMcpServer;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Talks to a remote MCP server over the SSE transport: a long-lived {@code text/event-stream} GET carries server
 * frames, and client frames are POSTed to the URL announced by the server's first {@code endpoint} event.
 *
 * <p>This class never reconnects. A dropped stream surfaces as a {@link Closed} frame and the owner decides whether to
 * open a new transport.
 */
public final class SseTransport implements Transport {
    private static final Logger logger = LogManager.getLogger(SseTransport.class);
    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    // Shared across transports. The event stream must never hit a read timeout; POSTs carry their own call timeout
    private static final OkHttpClient sharedHttpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(0, TimeUnit.SECONDS)
            .build();

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_POST_TIMEOUT = Duration.ofSeconds(30);

    private final SseMcpServer config;
    private final OkHttpClient httpClient;
    private final Duration connectTimeout;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final CompletableFuture<HttpUrl> endpoint = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean closedFrameQueued = new AtomicBoolean(false);

    private volatile @Nullable EventSource eventSource;

    public SseTransport(SseMcpServer config) {
        this(config, sharedHttpClient, DEFAULT_CONNECT_TIMEOUT);
    }

    public SseTransport(SseMcpServer config, OkHttpClient httpClient, Duration connectTimeout) {
        this.config = config;
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void start() throws McpException, InterruptedException {
        if (eventSource != null) {
            throw new IllegalStateException("Transport already started: " + describe());
        }
        var url = Objects.requireNonNull(config.url(), "url");
        HttpUrl streamUrl = HttpUrl.parse(url.toString());
        if (streamUrl == null) {
            throw new McpException(ErrorKind.TRANSPORT_UNAVAILABLE, "Invalid SSE url for " + config.name() + ": " + url);
        }

        var request = new Request.Builder()
                .url(streamUrl)
                .header("Accept", "text/event-stream")
                .build();
        eventSource = EventSources.createFactory(httpClient).newEventSource(request, new Listener(streamUrl));

        try {
            var messageUrl = endpoint.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("MCP server '{}' announced message endpoint {}", config.name(), messageUrl);
        } catch (TimeoutException e) {
            close();
            throw new McpException(
                    ErrorKind.TRANSPORT_UNAVAILABLE,
                    "MCP server '%s' sent no endpoint event within %d ms".formatted(
                            config.name(), connectTimeout.toMillis()),
                    e);
        } catch (ExecutionException e) {
            close();
            var cause = e.getCause() == null ? e : e.getCause();
            throw new McpException(
                    ErrorKind.TRANSPORT_UNAVAILABLE,
                    "Unable to open event stream for MCP server '%s' at %s: %s".formatted(
                            config.name(), url, cause.getMessage()),
                    cause);
        } catch (InterruptedException e) {
            close();
            throw e;
        }
    }

    private final class Listener extends EventSourceListener {
        private final HttpUrl streamUrl;

        private Listener(HttpUrl streamUrl) {
            this.streamUrl = streamUrl;
        }

        @Override
        public void onOpen(EventSource source, Response response) {
            logger.debug("Event stream open for MCP server '{}' ({})", config.name(), response.code());
        }

        @Override
        public void onEvent(EventSource source, @Nullable String id, @Nullable String type, String data) {
            if ("endpoint".equals(type)) {
                var resolved = streamUrl.resolve(data.trim());
                if (resolved == null) {
                    endpoint.completeExceptionally(new IOException("Unusable endpoint event: " + data));
                } else {
                    endpoint.complete(resolved);
                }
                return;
            }
            if (type != null && !"message".equals(type)) {
                logger.debug("Ignoring '{}' event from MCP server '{}'", type, config.name());
                return;
            }
            inbound.add(JsonRpcFrames.decode(data));
        }

        @Override
        public void onClosed(EventSource source) {
            queueClosed("event stream closed by server");
        }

        @Override
        public void onFailure(EventSource source, @Nullable Throwable t, @Nullable Response response) {
            var reason = t != null
                    ? String.valueOf(t.getMessage())
                    : response != null ? "HTTP " + response.code() : "unknown failure";
            if (!endpoint.isDone()) {
                endpoint.completeExceptionally(t != null ? t : new IOException(reason));
            }
            if (!closed.get()) {
                logger.debug("Event stream for MCP server '{}' failed: {}", config.name(), reason);
            }
            queueClosed("event stream failed: " + reason);
        }
    }

    private void queueClosed(String reason) {
        if (closedFrameQueued.compareAndSet(false, true)) {
            inbound.add(new Closed(reason, null));
        }
    }

    /**
     * POSTs one message. The whole call, including waiting for the server's HTTP response, is bounded by
     * {@code deadline} and never exceeds {@link #DEFAULT_POST_TIMEOUT}.
     */
    @Override
    public void send(McpSchema.JSONRPCMessage message, @Nullable Instant deadline) throws McpException {
        var messageUrl = endpoint.getNow(null);
        if (messageUrl == null || !isOpen()) {
            throw new McpException(
                    ErrorKind.SERVER_UNAVAILABLE, "Event stream for MCP server '%s' is not open".formatted(config.name()));
        }
        var request = new Request.Builder()
                .url(messageUrl)
                .post(RequestBody.create(JsonRpcFrames.encode(message), JSON_MEDIA_TYPE))
                .build();

        long timeoutMillis = DEFAULT_POST_TIMEOUT.toMillis();
        if (deadline != null) {
            timeoutMillis = Math.min(timeoutMillis, Duration.between(Instant.now(), deadline).toMillis());
        }
        if (timeoutMillis <= 0) {
            throw new McpException(
                    ErrorKind.TIMEOUT, "Deadline passed before posting to MCP server '%s'".formatted(config.name()));
        }
        var call = httpClient.newCall(request);
        call.timeout().timeout(timeoutMillis, TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new McpException(
                        ErrorKind.SERVER_UNAVAILABLE,
                        "MCP server '%s' rejected message with HTTP %d".formatted(config.name(), response.code()));
            }
        } catch (InterruptedIOException e) {
            // okhttp reports an expired call timeout this way
            throw new McpException(
                    ErrorKind.TIMEOUT,
                    "MCP server '%s' did not accept a message within %d ms".formatted(config.name(), timeoutMillis),
                    e);
        } catch (IOException e) {
            if (e instanceof McpException me) throw me;
            throw new McpException(
                    ErrorKind.SERVER_UNAVAILABLE,
                    "Failed posting to MCP server '%s': %s".formatted(config.name(), e.getMessage()),
                    e);
        }
    }

    @Override
    public Inbound receive() throws InterruptedException {
        if (eventSource == null) {
            return new Closed("not started", null);
        }
        var next = inbound.take();
        if (next instanceof Closed) {
            inbound.add(next);
        }
        return next;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        var source = eventSource;
        if (source != null) {
            source.cancel();
        }
        queueClosed("closed by client");
        logger.debug("Closed event stream for MCP server '{}'", config.name());
    }

    @Override
    public boolean isOpen() {
        return eventSource != null && !closed.get() && !closedFrameQueued.get();
    }

    @Override
    public String describe() {
        return String.valueOf(config.url());
    }
}
