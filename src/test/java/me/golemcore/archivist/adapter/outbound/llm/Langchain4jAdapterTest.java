package me.golemcore.archivist.adapter.outbound.llm;

import me.golemcore.archivist.domain.model.LlmRequest;
import me.golemcore.archivist.domain.model.LlmResponse;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class Langchain4jAdapterTest {

    private static final String TEST_MODEL = "openai/gpt-4o-mini";

    private ArchivistProperties properties;
    private ChatModel mockModel;
    private List<String> createdModels;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ArchivistProperties();
        ArchivistProperties.ProviderProperties openai = new ArchivistProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        mockModel = mock(ChatModel.class);
        createdModels = new ArrayList<>();
        adapter = new Langchain4jAdapter(properties) {
            @Override
            protected ChatModel createModel(String model, double temperature, Integer maxTokens) {
                createdModels.add(model + "|" + temperature + "|" + maxTokens);
                return mockModel;
            }
        };
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnResponseOnSuccessfulChat() throws Exception {
        ChatResponse chatResponse = ChatResponse.builder()
                .aiMessage(AiMessage.from("I summarized it."))
                .tokenUsage(new TokenUsage(10, 5, 15))
                .finishReason(FinishReason.STOP)
                .build();
        when(mockModel.chat((List<ChatMessage>) any())).thenReturn(chatResponse);

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .systemPrompt("You are Golem.")
                .userPrompt("Conversation: hi")
                .maxTokens(300)
                .build()).get();

        assertEquals("I summarized it.", response.getContent());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(TEST_MODEL, response.getModel());
        assertEquals(10, response.getInputTokens());
        assertEquals(5, response.getOutputTokens());

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(mockModel).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue();
        assertEquals(2, messages.size());
        assertEquals("You are Golem.", ((SystemMessage) messages.get(0)).text());
        assertEquals("Conversation: hi", ((UserMessage) messages.get(1)).singleText());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCacheModelPerSettings() throws Exception {
        when(mockModel.chat((List<ChatMessage>) any())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());
        LlmRequest request = LlmRequest.builder().userPrompt("hi").maxTokens(100).build();

        adapter.chat(request).get();
        adapter.chat(request).get();
        adapter.chat(LlmRequest.builder().userPrompt("hi").maxTokens(200).build()).get();

        assertEquals(List.of(TEST_MODEL + "|0.3|100", TEST_MODEL + "|0.3|200"), createdModels);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapNonRetryableFailure() {
        when(mockModel.chat((List<ChatMessage>) any())).thenThrow(new RuntimeException("invalid api key"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().userPrompt("hi").build()).get());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("invalid api key"));
        verify(mockModel, times(1)).chat((List<ChatMessage>) any());
    }

    @Test
    void shouldPreferSummarizationModel() {
        assertEquals(TEST_MODEL, adapter.getCurrentModel());

        properties.getSummarization().setModel("anthropic/claude-3-5-haiku-latest");

        assertEquals("anthropic/claude-3-5-haiku-latest", adapter.getCurrentModel());
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldRequireApiKeyToBeAvailable() {
        assertTrue(adapter.isAvailable());

        properties.getLlm().getProviders().get("openai").setApiKey(" ");

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailForUnconfiguredProvider() {
        Langchain4jAdapter real = new Langchain4jAdapter(properties);

        assertThrows(IllegalStateException.class, () -> real.createModel("mistral/small", 0.3, null));
    }

    @Test
    void shouldParseProviderPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-3-5-haiku"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o"));
        assertEquals("openai", Langchain4jAdapter.providerOf(null));
        assertEquals("claude-3-5-haiku", Langchain4jAdapter.stripProviderPrefix("anthropic/claude-3-5-haiku"));
        assertEquals("gpt-4o", Langchain4jAdapter.stripProviderPrefix("gpt-4o"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "rate_limit_exceeded", "429 Too Many Requests", "Anthropic API is overloaded" })
    void shouldDetectRateLimitErrors(String message) {
        assertTrue(Langchain4jAdapter.isRateLimitError(new RuntimeException("wrapped",
                new RuntimeException(message))));
    }

    @Test
    void shouldNotTreatOtherErrorsAsRateLimits() {
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException("invalid api key")));
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException((String) null)));
    }
}
