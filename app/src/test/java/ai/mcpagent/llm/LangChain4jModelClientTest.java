package ai.mcpagent.llm;

import static org.junit.jupiter.api.Assertions.*;

import ai.mcpagent.exception.LlmException;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiTokenUsage;
import dev.langchain4j.model.output.TokenUsage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class LangChain4jModelClientTest {

    /** Records each request and answers with {@code responder}. */
    private static final class FakeChatModel implements ChatModel {
        final List<ChatRequest> requests = new ArrayList<>();
        private final Function<ChatRequest, ChatResponse> responder;

        FakeChatModel(Function<ChatRequest, ChatResponse> responder) {
            this.responder = responder;
        }

        @Override
        public ChatResponse chat(ChatRequest chatRequest) {
            requests.add(chatRequest);
            return responder.apply(chatRequest);
        }
    }

    private static ChatResponse answer(String text, TokenUsage usage) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).tokenUsage(usage).build();
    }

    private static ModelRequest request(List<ToolSpecification> tools, int thinking) {
        return new ModelRequest(List.of(UserMessage.from("hi")), tools, thinking);
    }

    @Test
    void passesMessagesAndToolsAndReportsUsage() throws Exception {
        var chat = new FakeChatModel(r -> answer("hello", new TokenUsage(12, 3)));
        var client = new LangChain4jModelClient(chat, "test-model");
        var tool = ToolSpecification.builder().name("lookup").description("looks up").build();

        var turn = client.call(request(List.of(tool), 0));

        assertEquals("hello", turn.message().text());
        assertEquals("test-model", turn.modelName());
        assertEquals(new RichTokenUsage(12, 0, 0, 3), turn.usage());
        var sent = chat.requests.get(0);
        assertEquals(1, sent.messages().size());
        assertEquals(List.of(tool), sent.toolSpecifications());
        assertNull(sent.maxOutputTokens());
    }

    @Test
    void thinkingBudgetWidensTheOutputLimit() throws Exception {
        var chat = new FakeChatModel(r -> answer("ok", new TokenUsage(1, 1)));

        new LangChain4jModelClient(chat, "m").call(request(List.of(), 2000));
        new LangChain4jModelClient(chat, "m", 1000).call(request(List.of(), 500));
        new LangChain4jModelClient(chat, "m", 1000).call(request(List.of(), 0));

        assertEquals(LangChain4jModelClient.DEFAULT_OUTPUT_TOKENS + 2000, chat.requests.get(0).maxOutputTokens());
        assertEquals(1500, chat.requests.get(1).maxOutputTokens());
        assertEquals(1000, chat.requests.get(2).maxOutputTokens());
    }

    @Test
    void providerFailuresBecomeLlmExceptions() {
        var transientChat = new FakeChatModel(r -> {
            throw new RuntimeException("connection reset");
        });
        var rejectingChat = new FakeChatModel(r -> {
            throw new RuntimeException("invalid_request_error: bad schema");
        });

        var transientError = assertThrows(
                LlmException.class, () -> new LangChain4jModelClient(transientChat, "m").call(request(List.of(), 0)));
        var rejected = assertThrows(
                LlmException.class, () -> new LangChain4jModelClient(rejectingChat, "m").call(request(List.of(), 0)));

        assertTrue(transientError.isRetryable());
        assertFalse(rejected.isRetryable());
    }

    @Test
    void classifiesRetryableErrors() {
        assertTrue(LangChain4jModelClient.isRetryable(new RuntimeException("timeout")));
        assertFalse(LangChain4jModelClient.isRetryable(new IllegalArgumentException("bad")));
        assertFalse(LangChain4jModelClient.isRetryable(
                new RuntimeException("wrapped", new RuntimeException("Incorrect API key provided"))));
        assertFalse(LangChain4jModelClient.isRetryable(new RuntimeException("UnsupportedParamsError: temperature")));
    }

    @Test
    void openAiUsageDetailsAreRead() {
        var usage = OpenAiTokenUsage.builder()
                .inputTokenCount(100)
                .inputTokensDetails(OpenAiTokenUsage.InputTokensDetails.builder()
                        .cachedTokens(40)
                        .build())
                .outputTokenCount(50)
                .outputTokensDetails(OpenAiTokenUsage.OutputTokensDetails.builder()
                        .reasoningTokens(20)
                        .build())
                .build();

        assertEquals(new RichTokenUsage(100, 40, 20, 50), RichTokenUsage.from(usage));
        assertEquals(RichTokenUsage.ZERO, RichTokenUsage.from(null));
    }
}
