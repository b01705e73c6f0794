package ai.mcpagent.exception;

/** Classification attached to every failed tool dispatch, protocol call, or model call. */
public enum ErrorKind {
    /** The server process could not be launched or the remote stream could not be opened. */
    TRANSPORT_UNAVAILABLE,
    /** A frame could not be parsed, or the handshake produced an invalid reply. */
    PROTOCOL_FRAMING,
    /** No response arrived before the invocation or handshake deadline. */
    TIMEOUT,
    /** The connection dropped, or was never usable, while a call was outstanding. */
    SERVER_UNAVAILABLE,
    /** The requested tool is not in the catalog visible to the caller. */
    UNKNOWN_TOOL,
    /** The arguments did not match the tool's input schema. */
    SCHEMA_VALIDATION,
    /** The call was abandoned because its task was cancelled. */
    CANCELLED,
    /** The model provider failed after all retries. */
    MODEL_CALL_FAILURE,
    /** The tool ran and reported a failure of its own. */
    TOOL_EXECUTION
}
