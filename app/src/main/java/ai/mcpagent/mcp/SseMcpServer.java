package ai.mcpagent.mcp;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.net.URI;
import org.jetbrains.annotations.Nullable;

@JsonTypeName("sse")
public record SseMcpServer(
        /** Unique name of the server within the configuration. */
        String name,

        /**
         * URL of the server's event stream, including scheme (for example {@code http://localhost:8931/sse}).
         *
         * <p>The server announces the URL for outbound messages with its first {@code endpoint} event.
         */
        @Nullable URI url,

        /** Optional human-readable description. */
        @Nullable String description,

        /**
         * Whether a dropped stream is reopened on the next call. When false, the server stays unavailable until an
         * explicit restart.
         */
        boolean reconnect)
        implements McpServer {

    public SseMcpServer(String name, URI url) {
        this(name, url, null, true);
    }

    @JsonCreator
    static SseMcpServer fromJson(
            @JsonProperty("name") String name,
            @JsonProperty("url") @Nullable URI url,
            @JsonProperty("description") @Nullable String description,
            @JsonProperty("reconnect") @Nullable Boolean reconnect) {
        return new SseMcpServer(name, url, description, reconnect == null || reconnect);
    }

    @Override
    @JsonIgnore
    public String transportName() {
        return "sse";
    }
}
