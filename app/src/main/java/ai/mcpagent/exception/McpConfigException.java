package ai.mcpagent.exception;

/** Invalid server configuration. This is the only error that aborts registry initialization. */
public class McpConfigException extends RuntimeException {
    public McpConfigException(String message) {
        super(message);
    }

    public McpConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
