package me.golemcore.archivist.adapter.outbound.summarization;


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
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.SummarizationException;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.LlmPort;
import me.golemcore.archivist.port.outbound.SummarizationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link SummarizationPort} backed by {@link LlmPort}.
 *
 * <p>
 * Summaries are written in the first person as the configured persona and
 * name the other speaker. Level-1 prompts ask for facts, decisions, open
 * questions and next steps; merge prompts ask for a shorter synthesis.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmSummarizationAdapter implements SummarizationPort {

    private static final String SUMMARY_PROMPT = """
            You are %s. Write a concise summary of the conversation excerpt below, \
            in the first person, as yourself.

            Rules:
            - At most %d words
            - Refer to the other speaker as %s, never as "you"
            - Keep the key facts, decisions, open questions and next steps
            - Add one short sentence on how you feel about the exchange
            - Write in the language of the conversation
            - Output only the summary, no preamble""";

    private static final String MERGE_PROMPT = """
            You are %s. Merge the summaries below into one level %d summary, \
            in the first person, as yourself.

            Rules:
            - At most %d words
            - Refer to the other speaker as %s, never as "you"
            - Keep only the concepts that matter across all summaries
            - Note how the conversation evolved
            - Write in the language of the summaries
            - Output only the summary, no preamble""";

    private static final int TOKENS_PER_WORD = 3;

    private final LlmPort llmPort;
    private final ArchivistProperties properties;

    @Override
    public CompletableFuture<String> summarize(List<MemoryItem> items, String speakerLabel) {
        if (items == null || items.isEmpty()) {
            return CompletableFuture.failedFuture(new SummarizationException("Nothing to summarize"));
        }
        ArchivistProperties.SummarizationProperties config = properties.getSummarization();
        String conversation = items.stream()
                .map(MemoryItem::getText)
                .collect(Collectors.joining("\n"));
        LlmRequest request = request(
                SUMMARY_PROMPT.formatted(config.getPersona(), config.getMaxSummaryWords(), speakerLabel),
                "Conversation:\n" + conversation,
                config.getMaxSummaryWords());
        return complete(request, "summary of " + items.size() + " items");
    }

    @Override
    public CompletableFuture<String> merge(List<MemoryItem> summaries, int targetLevel, String speakerLabel) {
        if (summaries == null || summaries.size() < 2) {
            return CompletableFuture.failedFuture(new SummarizationException("Merge needs at least two summaries"));
        }
        ArchivistProperties.SummarizationProperties config = properties.getSummarization();
        String joined = summaries.stream()
                .map(MemoryItem::getText)
                .collect(Collectors.joining("\n\n"));
        LlmRequest request = request(
                MERGE_PROMPT.formatted(config.getPersona(), targetLevel, config.getMaxMergeWords(), speakerLabel),
                "Summaries:\n" + joined,
                config.getMaxMergeWords());
        return complete(request, "L" + targetLevel + " merge");
    }

    private LlmRequest request(String systemPrompt, String userPrompt, int maxWords) {
        ArchivistProperties.SummarizationProperties config = properties.getSummarization();
        return LlmRequest.builder()
                .model(config.getModel())
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .temperature(config.getTemperature())
                .maxTokens(maxWords * TOKENS_PER_WORD)
                .build();
    }

    private CompletableFuture<String> complete(LlmRequest request, String description) {
        if (llmPort == null || !llmPort.isAvailable()) {
            log.warn("[Compaction] LLM not available, cannot produce {}", description);
            return CompletableFuture.failedFuture(new SummarizationException("LLM not available"));
        }
        return llmPort.chat(request).thenApply(response -> {
            String text = extract(response);
            if (text == null) {
                throw new SummarizationException("LLM returned empty " + description);
            }
            log.debug("[Compaction] {} produced ({} chars)", description, text.length());
            return text;
        });
    }

    private static String extract(LlmResponse response) {
        if (response == null || response.getContent() == null || response.getContent().isBlank()) {
            return null;
        }
        return response.getContent().trim();
    }
}
