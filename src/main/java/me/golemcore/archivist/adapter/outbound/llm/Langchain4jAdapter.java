package me.golemcore.archivist.adapter.outbound.llm;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.archivist.domain.model.LlmRequest;
import me.golemcore.archivist.domain.model.LlmResponse;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.LlmPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Model ids carry their provider as a prefix ({@code "anthropic/claude-3-5-haiku"},
 * {@code "openai/gpt-4o-mini"}). Anthropic uses its native client, every other
 * provider goes through the OpenAI-compatible one with the provider's
 * {@code base-url}. Rate-limited calls are retried with exponential backoff.
 *
 * <p>
 * Configuration via {@code archivist.llm.providers.<name>.api-key} and
 * {@code archivist.llm.providers.<name>.base-url}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 1024;

    private final ArchivistProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null && !request.getModel().isBlank()
                    ? request.getModel()
                    : getCurrentModel();
            ChatModel chatModel = models.computeIfAbsent(cacheKey(model, request),
                    key -> createModel(model, request.getTemperature(), request.getMaxTokens()));
            List<ChatMessage> messages = toMessages(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return toResponse(response, model);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.warn("[LLM] Chat failed for {}: {}", model, e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public String getCurrentModel() {
        String summarizationModel = properties.getSummarization().getModel();
        return summarizationModel != null && !summarizationModel.isBlank()
                ? summarizationModel
                : properties.getLlm().getDefaultModel();
    }

    @Override
    public boolean isAvailable() {
        ArchivistProperties.ProviderProperties config = properties.getLlm().getProviders()
                .get(providerOf(getCurrentModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Builds the langchain4j model for a provider-prefixed model id.
     */
    protected ChatModel createModel(String model, double temperature, Integer maxTokens) {
        String provider = providerOf(model);
        ArchivistProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add archivist.llm.providers." + provider + ".api-key");
        }
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.info("[LLM] Creating {} model {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxTokens(maxTokens != null ? maxTokens : ANTHROPIC_DEFAULT_MAX_TOKENS)
                    .maxRetries(0)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .temperature(temperature)
                .maxRetries(0)
                .timeout(timeout);
        if (maxTokens != null) {
            builder.maxTokens(maxTokens);
        }
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    static String providerOf(String model) {
        if (model == null || !model.contains("/")) {
            return PROVIDER_OPENAI;
        }
        return model.substring(0, model.indexOf('/'));
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("overloaded"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static List<ChatMessage> toMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>(2);
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getUserPrompt() != null ? request.getUserPrompt() : ""));
        return messages;
    }

    private static LlmResponse toResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        LlmResponse.LlmResponseBuilder builder = LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop");
        if (response.tokenUsage() != null) {
            builder.inputTokens(response.tokenUsage().inputTokenCount())
                    .outputTokens(response.tokenUsage().outputTokenCount());
        }
        return builder.build();
    }

    private static String cacheKey(String model, LlmRequest request) {
        return model + "|" + request.getTemperature() + "|" + request.getMaxTokens();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }
}
