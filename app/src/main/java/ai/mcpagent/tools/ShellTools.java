package ai.mcpagent.tools;

import ai.mcpagent.util.Environment;
import ai.mcpagent.util.ExecutorServiceUtil;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Runs shell commands in the workspace root. */
public class ShellTools {
    private static final Logger logger = LogManager.getLogger(ShellTools.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration MAX_TIMEOUT = Duration.ofMinutes(10);
    static final int MAX_OUTPUT_CHARS = 30_000;

    private final Path root;
    private final Duration defaultTimeout;

    public ShellTools(Path workspaceRoot) {
        this(workspaceRoot, DEFAULT_TIMEOUT);
    }

    public ShellTools(Path workspaceRoot, Duration defaultTimeout) {
        this.root = workspaceRoot.toAbsolutePath().normalize();
        this.defaultTimeout = defaultTimeout;
    }

    @SideEffecting
    @Tool(
            name = "bash",
            value =
                    """
    Executes a shell command in the workspace root and returns its exit code and combined stdout/stderr.
    Commands time out after 2 minutes unless timeoutMs is given (at most 600000).
    Output longer than 30000 characters is truncated in the middle.
    """)
    public String bash(
            @P("The command to execute") String command,
            @P(value = "Optional timeout in milliseconds (max 600000)", required = false) @Nullable Integer timeoutMs)
            throws IOException, InterruptedException {
        if (command.isBlank()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        var timeout = timeoutMs == null ? defaultTimeout : Duration.ofMillis(timeoutMs);
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("Timeout cannot exceed " + MAX_TIMEOUT.toMillis() + "ms");
        }

        var shell = Environment.isWindows() ? List.of("cmd.exe", "/c", command) : List.of("/bin/sh", "-c", command);
        var process = new ProcessBuilder(shell)
                .directory(root.toFile())
                .redirectErrorStream(true)
                .start();
        process.getOutputStream().close();

        var output = new BoundedOutput(MAX_OUTPUT_CHARS);
        var reader = ExecutorServiceUtil.startDaemon("bash-output", () -> copy(process.getInputStream(), output));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                reader.join(1_000);
                return "Command timed out after %d ms\n%s".formatted(timeout.toMillis(), output.render());
            }
            reader.join(1_000);
        } catch (InterruptedException e) {
            destroyTree(process);
            throw e;
        }

        int exitCode = process.exitValue();
        logger.debug("`{}` exited with {}", command, exitCode);
        return "Exit code: %d\n%s".formatted(exitCode, output.render());
    }

    /** Background jobs started by the command hold the output pipe open, so they go down with the shell. */
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void copy(InputStream in, BoundedOutput out) {
        try (in) {
            var buffer = new byte[8192];
            int n;
            while ((n = in.read(buffer)) >= 0) {
                out.write(buffer, n);
            }
        } catch (IOException e) {
            logger.trace("Shell output stream closed: {}", e.getMessage());
        }
    }

    /** Keeps the first and last {@code limit} bytes of a stream and counts the lines dropped between them. */
    static final class BoundedOutput {
        private final int limit;
        private final byte[] head;
        private final byte[] tail;
        private int headSize;
        private int tailStart;
        private int tailSize;
        private long droppedBytes;
        private long droppedLines;

        BoundedOutput(int limit) {
            this.limit = limit;
            this.head = new byte[limit];
            this.tail = new byte[limit];
        }

        synchronized void write(byte[] bytes, int length) {
            for (int i = 0; i < length; i++) {
                byte b = bytes[i];
                if (headSize < limit) {
                    head[headSize++] = b;
                } else if (tailSize < limit) {
                    tail[(tailStart + tailSize++) % limit] = b;
                } else {
                    if (tail[tailStart] == '\n') {
                        droppedLines++;
                    }
                    droppedBytes++;
                    tail[tailStart] = b;
                    tailStart = (tailStart + 1) % limit;
                }
            }
        }

        synchronized int retainedBytes() {
            return headSize + tailSize;
        }

        synchronized String render() {
            var kept = new byte[headSize + tailSize];
            System.arraycopy(head, 0, kept, 0, headSize);
            for (int i = 0; i < tailSize; i++) {
                kept[headSize + i] = tail[(tailStart + i) % limit];
            }
            var text = new String(kept, StandardCharsets.UTF_8);
            if (droppedBytes == 0) {
                return truncate(text);
            }
            // a single endless line still counts as one
            return truncate(text, Math.max(1, droppedLines));
        }
    }

    static String truncate(String content) {
        return truncate(content, 0);
    }

    /** {@code droppedLines} were already cut from the middle of {@code content} before it got here. */
    static String truncate(String content, long droppedLines) {
        if (content.length() <= MAX_OUTPUT_CHARS && droppedLines == 0) {
            return content;
        }
        int half = Math.min(MAX_OUTPUT_CHARS / 2, content.length() / 2);
        var start = content.substring(0, half);
        var end = content.substring(content.length() - half);
        long truncatedLines = droppedLines + content.substring(half, content.length() - half).lines().count();
        return "%s\n\n... [%d lines truncated] ...\n\n%s".formatted(start, truncatedLines, end);
    }
}
