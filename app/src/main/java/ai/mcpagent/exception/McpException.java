package ai.mcpagent.exception;

import java.io.IOException;
import org.jetbrains.annotations.Nullable;

/**
 * Failure of a transport or protocol operation against an MCP server. Always carries the {@link ErrorKind} so callers
 * can fold it into a tagged result without inspecting messages.
 */
public class McpException extends IOException {
    private final ErrorKind kind;

    public McpException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public McpException(ErrorKind kind, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "McpException[" + kind + "]: " + getMessage();
    }
}
