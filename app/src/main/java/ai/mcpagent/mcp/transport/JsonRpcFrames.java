package ai.mcpagent.mcp.transport;

import ai.mcpagent.exception.ErrorKind;
import ai.mcpagent.exception.McpException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.IOException;

/** Text framing of JSON-RPC messages, shared by the transports. One frame is one JSON object. */
public final class JsonRpcFrames {
    /** Mapper for {@link McpSchema} types; servers are free to send fields this client does not know. */
    public static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonRpcFrames() {}

    /** Parses one frame. Never throws: anything that is not a JSON-RPC message comes back as {@link Transport.Malformed}. */
    public static Transport.Inbound decode(String raw) {
        try {
            return new Transport.Message(McpSchema.deserializeJsonRpcMessage(OBJECT_MAPPER, raw));
        } catch (IOException | RuntimeException e) {
            // a bare JSON null or array never reaches the message types
            return new Transport.Malformed(raw, String.valueOf(e.getMessage()));
        }
    }

    public static String encode(McpSchema.JSONRPCMessage message) throws McpException {
        try {
            return OBJECT_MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new McpException(ErrorKind.PROTOCOL_FRAMING, "Unable to serialize frame: " + e.getOriginalMessage(), e);
        }
    }
}
