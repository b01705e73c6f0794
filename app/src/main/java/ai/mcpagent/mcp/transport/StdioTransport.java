package ai.mcpagent.mcp.transport;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import ai.mcpagent.mcp.StdioMcpServer;
import ai.mcpagent.util.Environment;
import ai.mcpagent.util.ExecutorServiceUtil;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs an MCP server as a child process and exchanges newline-delimited JSON over its stdin and stdout. Stderr is
 * drained to the debug log so a chatty server never blocks on a full pipe.
 */
public final class StdioTransport implements Transport {
    private static final Logger logger = LogManager.getLogger(StdioTransport.class);

    private static final long EXIT_WAIT_MILLIS = 2_000;

    private final StdioMcpServer config;
    private final @Nullable Path workingDirectory;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile @Nullable Process process;
    private volatile @Nullable BufferedWriter stdin;
    private volatile boolean endOfStream;
    private volatile @Nullable Integer exitCode;

    public StdioTransport(StdioMcpServer config) {
        this(config, null);
    }

    public StdioTransport(StdioMcpServer config, @Nullable Path workingDirectory) {
        this.config = config;
        this.workingDirectory = workingDirectory;
    }

    @Override
    public void start() throws McpException {
        if (process != null) {
            throw new IllegalStateException("Transport already started: " + describe());
        }
        var command = config.command();
        if (command == null || command.isBlank()) {
            throw new McpException(ErrorKind.TRANSPORT_UNAVAILABLE, "No command configured for " + config.name());
        }

        var commandLine = new ArrayList<String>();
        commandLine.add(command);
        commandLine.addAll(config.args());
        var pb = new ProcessBuilder(commandLine);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        pb.environment().putAll(Environment.expandEnvMap(config.env()));

        Process started;
        try {
            started = pb.start();
        } catch (IOException e) {
            closed.set(true);
            throw new McpException(
                    ErrorKind.TRANSPORT_UNAVAILABLE,
                    "Unable to launch MCP server '%s' with `%s`: %s".formatted(config.name(), describe(), e.getMessage()),
                    e);
        }
        process = started;
        stdin = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));
        logger.debug("Started MCP server '{}' (pid {}): {}", config.name(), started.pid(), describe());

        ExecutorServiceUtil.startDaemon("mcp-stdio-out-" + config.name(), () -> readStdout(started));
        ExecutorServiceUtil.startDaemon("mcp-stdio-err-" + config.name(), () -> drainStderr(started));
    }

    private void readStdout(Process p) {
        try (var reader = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                inbound.add(JsonRpcFrames.decode(line));
            }
        } catch (IOException e) {
            // stdout closes under us when close() destroys the process
            logger.debug("Stdout of MCP server '{}' ended: {}", config.name(), e.getMessage());
        }
        endOfStream = true;
        inbound.add(new Closed(closed.get() ? "closed by client" : "server process ended", awaitExit(p)));
    }

    private void drainStderr(Process p) {
        try (var reader = new BufferedReader(new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.debug("[{} stderr] {}", config.name(), line);
            }
        } catch (IOException e) {
            logger.trace("Stderr of MCP server '{}' ended: {}", config.name(), e.getMessage());
        }
    }

    private @Nullable Integer awaitExit(Process p) {
        try {
            if (p.waitFor(EXIT_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                exitCode = p.exitValue();
                logger.debug("MCP server '{}' exited with code {}", config.name(), exitCode);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return exitCode;
    }

    /** Pipe writes ignore the deadline. */
    @Override
    public void send(McpSchema.JSONRPCMessage message, @Nullable Instant deadline) throws McpException {
        var writer = stdin;
        if (writer == null || !isOpen()) {
            throw new McpException(ErrorKind.SERVER_UNAVAILABLE, "MCP server '%s' is not running".formatted(config.name()));
        }
        var frame = JsonRpcFrames.encode(message);
        try {
            synchronized (writeLock) {
                writer.write(frame);
                writer.write('\n');
                writer.flush();
            }
        } catch (IOException e) {
            throw new McpException(
                    ErrorKind.SERVER_UNAVAILABLE,
                    "Failed writing to MCP server '%s': %s".formatted(config.name(), e.getMessage()),
                    e);
        }
    }

    @Override
    public Inbound receive() throws InterruptedException {
        if (process == null) {
            return new Closed("not started", null);
        }
        var next = inbound.take();
        if (next instanceof Closed) {
            // keep returning the terminal frame to later callers
            inbound.add(next);
        }
        return next;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        var p = process;
        if (p == null) {
            return;
        }
        var writer = stdin;
        if (writer != null) {
            try {
                synchronized (writeLock) {
                    writer.close();
                }
            } catch (IOException e) {
                logger.debug("Error closing stdin of MCP server '{}': {}", config.name(), e.getMessage());
            }
        }
        try {
            if (!p.waitFor(EXIT_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                p.destroy();
                if (!p.waitFor(EXIT_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                    logger.warn("MCP server '{}' did not exit, killing it", config.name());
                    p.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        if (!p.isAlive()) {
            exitCode = p.exitValue();
        }
        logger.debug("Closed MCP server '{}' (exit code {})", config.name(), exitCode);
    }

    @Override
    public boolean isOpen() {
        var p = process;
        return p != null && !closed.get() && !endOfStream && p.isAlive();
    }

    /** Exit code of the server process, or null while it is running or if it was never started. */
    public @Nullable Integer exitCode() {
        return exitCode;
    }

    @Override
    public String describe() {
        var sb = new StringBuilder(String.valueOf(config.command()));
        config.args().forEach(a -> sb.append(' ').append(a));
        return sb.toString();
    }
}
