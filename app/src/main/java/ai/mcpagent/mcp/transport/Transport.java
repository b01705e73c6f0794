package ai.mcpagent.mcp.transport;

import ai.mcpagent.exception.McpException;
import io.modelcontextprotocol.spec.McpSchema;
import java.time.Instant;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Bidirectional channel carrying JSON-RPC messages to and from one MCP server.
 *
 * <p>Implementations own the underlying process or connection: {@link #close()} releases it and is safe to call more
 * than once. Inbound frames are delivered in arrival order through {@link #receive()}; once the channel ends,
 * {@code receive()} keeps returning the same {@link Closed} frame.
 */
public interface Transport extends AutoCloseable {

    /** Launches the process or opens the stream. */
    @Blocking
    void start() throws McpException, InterruptedException;

    /** Writes one message. Fails with {@code SERVER_UNAVAILABLE} if the channel is not open. */
    default void send(McpSchema.JSONRPCMessage message) throws McpException {
        send(message, null);
    }

    /**
     * Writes one message, giving up with {@code TIMEOUT} once {@code deadline} passes. Transports whose writes cannot
     * stall may ignore the deadline.
     */
    void send(McpSchema.JSONRPCMessage message, @Nullable Instant deadline) throws McpException;

    /** Blocks until the next inbound message, a framing error, or closure. */
    @Blocking
    Inbound receive() throws InterruptedException;

    @Override
    void close();

    boolean isOpen();

    /**
     * True when several requests may be outstanding at once. Callers serialize invocations on transports that return
     * false.
     */
    default boolean supportsMultiplexing() {
        return true;
    }

    /** Short description for logs, e.g. the command line or URL. */
    String describe();

    sealed interface Inbound permits Message, Malformed, Closed {}

    /** A well-formed JSON-RPC request, notification or response. */
    record Message(McpSchema.JSONRPCMessage message) implements Inbound {}

    /** A frame that could not be parsed. Frames before and after it are unaffected. */
    record Malformed(String raw, String reason) implements Inbound {}

    /** The channel ended. {@code exitCode} is set when the server was a local process that exited. */
    record Closed(String reason, @Nullable Integer exitCode) implements Inbound {}
}
