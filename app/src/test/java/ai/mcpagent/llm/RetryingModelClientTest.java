package ai.mcpagent.llm;

import static org.junit.jupiter.api.Assertions.*;

import ai.mcpagent.exception.LlmException;
import ai.mcpagent.testutil.ScriptedModelClient;
import dev.langchain4j.data.message.UserMessage;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetryingModelClientTest {
    private static final ModelRequest REQUEST = new ModelRequest(List.of(UserMessage.from("hi")), List.of(), 0);

    private static LlmException transientError() {
        return new LlmException("calling scripted-model", new RuntimeException("503 overloaded"));
    }

    @Test
    void retriesTransientFailures() throws Exception {
        var delegate = new ScriptedModelClient()
                .thenFail(transientError())
                .thenFail(transientError())
                .thenAnswer("third time lucky");
        var client = new RetryingModelClient(delegate, 8, Duration.ofMillis(1));

        var turn = client.call(REQUEST);

        assertEquals("third time lucky", turn.message().text());
        assertEquals(3, delegate.callCount());
    }

    @Test
    void doesNotRetryRejectedRequests() {
        var rejected = new LlmException("calling scripted-model", new RuntimeException("BadRequestError"), false);
        var delegate = new ScriptedModelClient().thenFail(rejected).thenAnswer("unused");
        var client = new RetryingModelClient(delegate, 8, Duration.ofMillis(1));

        var e = assertThrows(LlmException.class, () -> client.call(REQUEST));

        assertSame(rejected, e);
        assertEquals(1, delegate.callCount());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        var delegate = new ScriptedModelClient();
        for (int i = 0; i < 5; i++) {
            delegate.thenFail(transientError());
        }
        var client = new RetryingModelClient(delegate, 3, Duration.ofMillis(1));

        var e = assertThrows(LlmException.class, () -> client.call(REQUEST));

        assertEquals(3, delegate.callCount());
        assertFalse(e.isRetryable());
        assertTrue(e.getMessage().contains("(3 attempts)"));
        assertInstanceOf(LlmException.class, e.getCause());
    }

    @Test
    void backoffDoublesUpToSixteenTimesTheBaseDelay() {
        var client = new RetryingModelClient(new ScriptedModelClient(), 8, Duration.ofSeconds(1));
        assertEquals(Duration.ofSeconds(1), client.backoff(1));
        assertEquals(Duration.ofSeconds(2), client.backoff(2));
        assertEquals(Duration.ofSeconds(8), client.backoff(4));
        assertEquals(Duration.ofSeconds(16), client.backoff(5));
        assertEquals(Duration.ofSeconds(16), client.backoff(7));
        assertEquals(Duration.ofSeconds(16), client.backoff(40));
    }

    @Test
    void rejectsNonPositiveAttemptCounts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryingModelClient(new ScriptedModelClient(), 0, Duration.ZERO));
    }
}
