package me.golemcore.archivist.domain.service;


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

import me.golemcore.archivist.domain.model.ArchiveStore;
import me.golemcore.archivist.domain.model.CompressionAction;
import me.golemcore.archivist.domain.model.ItemQuality;
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.MemoryLedger;
import me.golemcore.archivist.domain.model.RawItem;
import me.golemcore.archivist.domain.model.SummaryItem;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.SummarizationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Decides and executes compaction of a {@link MemoryLedger}.
 *
 * <p>
 * Rules run in fixed order on every evaluation, each against the ledger as
 * left by the previous one:
 * <ol>
 * <li>CREATE_L1: enough raw items accumulated, summarize the oldest window
 * into a level-1 summary placed where the window started</li>
 * <li>BUDGET_REPLACE: active characters above budget, summarize the oldest
 * contiguous block of raw items</li>
 * <li>MERGE_UP: too many summaries, merge the two oldest summaries of the
 * lowest populated level into one of the next level</li>
 * </ol>
 * The most recent raw items are never selected. A failed or timed out
 * summarization leaves the ledger untouched for that rule only.
 *
 * <p>
 * Merges are awaited one at a time so each sees the ledger produced by the
 * previous step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompressionPolicyEngine {

    private final SummarizationPort summarizationPort;
    private final TopicExtractor topicExtractor;
    private final ArchivistProperties properties;
    private final Clock clock;

    /**
     * Runs every rule once.
     *
     * @return fired actions in rule order, empty when nothing applied
     */
    public List<CompressionAction> evaluate(MemoryLedger ledger, ArchiveStore archive, String speakerLabel) {
        List<CompressionAction> actions = new ArrayList<>(3);
        createLevelOne(ledger, archive, speakerLabel).ifPresent(actions::add);
        replaceOverBudget(ledger, archive, speakerLabel).ifPresent(actions::add);
        mergeUp(ledger, archive, speakerLabel).ifPresent(actions::add);
        return actions;
    }

    Optional<CompressionAction> createLevelOne(MemoryLedger ledger, ArchiveStore archive, String speakerLabel) {
        int threshold = ledger.getL1Threshold();
        List<RawItem> raw = ledger.rawItems();
        if (raw.size() < threshold + protectedRecentRaw()) {
            return Optional.empty();
        }
        List<RawItem> eligible = eligibleRaw(raw);
        if (eligible.size() < threshold) {
            return Optional.empty();
        }
        List<MemoryItem> window = new ArrayList<>(eligible.subList(0, threshold));
        return replaceWithSummary(ledger, archive, window, speakerLabel, CompressionAction.Type.CREATE_L1);
    }

    Optional<CompressionAction> replaceOverBudget(MemoryLedger ledger, ArchiveStore archive, String speakerLabel) {
        if (ledger.activeCharTotal() <= ledger.getBudgetMax()) {
            return Optional.empty();
        }
        int blockSize = properties.getMemory().getBudgetBlockSize();
        List<RawItem> eligible = eligibleRaw(ledger.rawItems());
        if (eligible.size() < blockSize) {
            log.debug("[Compaction] Over budget but only {} raw items eligible", eligible.size());
            return Optional.empty();
        }
        List<MemoryItem> block = oldestContiguousBlock(ledger, eligible, blockSize);
        return replaceWithSummary(ledger, archive, block, speakerLabel, CompressionAction.Type.BUDGET_REPLACE);
    }

    Optional<CompressionAction> mergeUp(MemoryLedger ledger, ArchiveStore archive, String speakerLabel) {
        if (ledger.summaryRatio() <= ledger.getHierarchicalThreshold()) {
            return Optional.empty();
        }
        List<SummaryItem> pair = lowestLevelPair(ledger);
        if (pair.isEmpty()) {
            return Optional.empty();
        }
        SummaryItem first = pair.get(0);
        SummaryItem second = pair.get(1);
        int targetLevel = first.getLevel() + 1;
        List<MemoryItem> inputs = List.of(first, second);

        long start = clock.millis();
        Optional<String> text = await(
                () -> summarizationPort.merge(inputs, targetLevel, speakerLabel),
                "merge to L" + targetLevel);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        List<String> covers = new ArrayList<>(new LinkedHashSet<>(first.getCovers()));
        for (String id : second.getCovers()) {
            if (!covers.contains(id)) {
                covers.add(id);
            }
        }
        SummaryItem merged = SummaryItem.builder()
                .id(newSummaryId(targetLevel))
                .level(targetLevel)
                .text(text.get())
                .topics(topicExtractor.union(List.of(first.getTopics(), second.getTopics()),
                        properties.getMemory().getMaxTopics()))
                .covers(covers)
                .createdAt(clock.instant())
                .quality(ItemQuality.MERGED)
                .build();

        List<String> evicted = List.of(first.getId(), second.getId());
        ledger.removeMany(evicted);
        ledger.append(merged);
        archive.append(merged);

        log.info("[Compaction] MERGE_UP: 2 L{} -> {} ({} chars) in {}ms",
                first.getLevel(), merged.getId(), merged.getCharCount(), clock.millis() - start);
        return Optional.of(CompressionAction.builder()
                .type(CompressionAction.Type.MERGE_UP)
                .produced(List.of(merged))
                .evictedIds(evicted)
                .budgetAfter(ledger.activeCharTotal())
                .build());
    }

    private Optional<CompressionAction> replaceWithSummary(MemoryLedger ledger, ArchiveStore archive,
            List<MemoryItem> window, String speakerLabel, CompressionAction.Type type) {
        long start = clock.millis();
        Optional<String> text = await(() -> summarizationPort.summarize(List.copyOf(window), speakerLabel),
                type.name());
        if (text.isEmpty()) {
            return Optional.empty();
        }

        List<String> windowIds = window.stream().map(MemoryItem::getId).toList();
        List<String> windowTexts = window.stream().map(MemoryItem::getText).toList();
        SummaryItem summary = SummaryItem.builder()
                .id(newSummaryId(1))
                .level(1)
                .text(text.get())
                .topics(topicExtractor.extract(windowTexts, properties.getMemory().getMaxTopics()))
                .covers(windowIds)
                .createdAt(clock.instant())
                .quality(ItemQuality.LEVEL_ONE)
                .build();

        int position = ledger.indexOf(windowIds.get(0));
        ledger.removeMany(windowIds);
        ledger.insertAt(position, summary);
        archive.append(summary);

        log.info("[Compaction] {}: {} raw items -> {} ({} chars) in {}ms",
                type, window.size(), summary.getId(), summary.getCharCount(), clock.millis() - start);
        return Optional.of(CompressionAction.builder()
                .type(type)
                .produced(List.of(summary))
                .evictedIds(windowIds)
                .budgetAfter(ledger.activeCharTotal())
                .build());
    }

    private Optional<String> await(Supplier<CompletableFuture<String>> call, String operation) {
        long timeoutMs = properties.getSummarization().getTimeoutMs();
        CompletableFuture<String> future = null;
        try {
            future = call.get();
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                log.warn("[Compaction] {} skipped: summarizer returned empty text", operation);
                return Optional.empty();
            }
            return Optional.of(text.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Compaction] {} interrupted: {}", operation, e.getMessage());
            return Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Compaction] {} timed out after {}ms", operation, timeoutMs);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Compaction] {} failed: {}", operation, cause.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Compaction] {} failed: {}", operation, e.getMessage());
            return Optional.empty();
        }
    }

    private List<RawItem> eligibleRaw(List<RawItem> raw) {
        int keep = protectedRecentRaw();
        if (raw.size() <= keep) {
            return List.of();
        }
        return raw.subList(0, raw.size() - keep);
    }

    /**
     * First run of eligible raw items that are adjacent in the ledger, at most
     * {@code maxSize} long.
     */
    private List<MemoryItem> oldestContiguousBlock(MemoryLedger ledger, List<RawItem> eligible, int maxSize) {
        List<String> eligibleIds = eligible.stream().map(MemoryItem::getId).toList();
        List<MemoryItem> block = new ArrayList<>();
        for (MemoryItem item : ledger.items()) {
            if (eligibleIds.contains(item.getId())) {
                block.add(item);
                if (block.size() == maxSize) {
                    break;
                }
            } else if (!block.isEmpty()) {
                break;
            }
        }
        return block;
    }

    private List<SummaryItem> lowestLevelPair(MemoryLedger ledger) {
        int maxLevel = ledger.maxLevel();
        for (int level = 1; level <= maxLevel; level++) {
            List<SummaryItem> atLevel = ledger.summariesAt(level);
            if (atLevel.size() >= 2) {
                return atLevel.subList(0, 2);
            }
        }
        return List.of();
    }

    private int protectedRecentRaw() {
        return Math.max(0, properties.getMemory().getProtectedRecentRaw());
    }

    private static String newSummaryId(int level) {
        return "l" + level + "_" + UUID.randomUUID();
    }
}
