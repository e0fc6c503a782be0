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

import me.golemcore.archivist.domain.model.ArchiveStats;
import me.golemcore.archivist.domain.model.ArchiveStore;
import me.golemcore.archivist.domain.model.CompressionAction;
import me.golemcore.archivist.domain.model.DecompressionResult;
import me.golemcore.archivist.domain.model.IngestResult;
import me.golemcore.archivist.domain.model.ItemQuality;
import me.golemcore.archivist.domain.model.ItemRole;
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.MemoryLedger;
import me.golemcore.archivist.domain.model.MemorySnapshot;
import me.golemcore.archivist.domain.model.MemoryStats;
import me.golemcore.archivist.domain.model.RawItem;
import me.golemcore.archivist.domain.model.SearchOptions;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.model.SearchStats;
import me.golemcore.archivist.domain.model.StateImportResult;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Hierarchical memory of one conversational entity: active ledger, archive and
 * the operations the conversation layer calls.
 *
 * <p>
 * Every operation runs under one exclusive lock, so an ingestion and the
 * compaction it triggers complete before the next call is served. Distinct
 * entities never share state.
 */
@Slf4j
public class ConversationMemory {

    private static final String SEPARATOR = "\n\n";

    @Getter
    private final String entityId;
    private final ArchivistProperties properties;
    private final CompressionPolicyEngine policyEngine;
    private final DecompressionEngine decompressionEngine;
    private final ProactiveSearchEngine searchEngine;
    private final TopicExtractor topicExtractor;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private MemoryLedger ledger;
    private final ArchiveStore archive = new ArchiveStore();
    private Instant lastSearchAt;

    public ConversationMemory(String entityId, ArchivistProperties properties, CompressionPolicyEngine policyEngine,
            DecompressionEngine decompressionEngine, ProactiveSearchEngine searchEngine,
            TopicExtractor topicExtractor, Clock clock) {
        this.entityId = entityId;
        this.properties = properties;
        this.policyEngine = policyEngine;
        this.decompressionEngine = decompressionEngine;
        this.searchEngine = searchEngine;
        this.topicExtractor = topicExtractor;
        this.clock = clock;
        ArchivistProperties.MemoryProperties memory = properties.getMemory();
        this.ledger = new MemoryLedger(memory.getBudgetMax(), memory.getL1Threshold(),
                memory.getHierarchicalThreshold());
    }

    /**
     * Appends one conversation turn and runs compaction.
     */
    public IngestResult ingest(String text, ItemRole role, String speakerLabel) {
        return ingest(text, role, speakerLabel, result -> {
        });
    }

    /**
     * Appends one conversation turn, runs compaction and hands the accepted
     * result to {@code afterIngest} before the entity lock is released.
     */
    public IngestResult ingest(String text, ItemRole role, String speakerLabel, Consumer<IngestResult> afterIngest) {
        if (text == null || text.isBlank()) {
            return IngestResult.rejected("Message text is empty");
        }
        int maxChars = properties.getMemory().getMaxIngestChars();
        if (text.length() > maxChars) {
            return IngestResult.rejected("Message exceeds " + maxChars + " characters");
        }
        ItemRole effectiveRole = role != null ? role : ItemRole.USER;
        String speaker = resolveSpeaker(effectiveRole, speakerLabel);
        String summarySpeaker = speakerLabel != null && !speakerLabel.isBlank() ? speakerLabel.trim() : "User";

        return withLock(() -> {
            RawItem item = RawItem.builder()
                    .id("msg_" + UUID.randomUUID())
                    .text(speaker + ": " + text.trim())
                    .topics(topicExtractor.extract(List.of(text), properties.getMemory().getMaxTopics()))
                    .createdAt(clock.instant())
                    .quality(rawQuality(text, effectiveRole))
                    .role(effectiveRole)
                    .speaker(speaker)
                    .build();
            ledger.append(item);
            archive.append(item);
            log.trace("[Memory] {} ingested {} ({} chars)", entityId, item.getId(), item.getCharCount());

            List<CompressionAction> actions = policyEngine.evaluate(ledger, archive, summarySpeaker);
            IngestResult result = IngestResult.builder()
                    .accepted(true)
                    .itemId(item.getId())
                    .actions(actions)
                    .build();
            afterIngest.accept(result);
            return result;
        });
    }

    /**
     * Packs summaries (highest level first, then most recent) and then the most
     * recent raw items into at most {@code maxChars} characters. Packing stops at
     * the first item that does not fit. Raw items are rendered in chronological
     * order after the summaries. {@code query} does not affect selection.
     */
    public String buildContext(String query, int maxChars) {
        if (maxChars <= 0) {
            return "";
        }
        return withLock(() -> {
            List<MemoryItem> items = ledger.items();
            List<Integer> summaryOrder = new ArrayList<>();
            List<Integer> rawOrder = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).isSummary()) {
                    summaryOrder.add(i);
                } else {
                    rawOrder.add(i);
                }
            }
            summaryOrder.sort(Comparator.<Integer>comparingInt(i -> items.get(i).getLevel()).reversed()
                    .thenComparing(i -> items.get(i).getCreatedAt(), Comparator.<Instant>reverseOrder())
                    .thenComparing(Comparator.<Integer>reverseOrder()));
            rawOrder.sort(Comparator.reverseOrder());

            List<Integer> selected = new ArrayList<>();
            int used = 0;
            boolean full = false;
            for (Integer index : summaryOrder) {
                int cost = renderSummary(items.get(index)).length() + (used > 0 ? SEPARATOR.length() : 0);
                if (used + cost > maxChars) {
                    full = true;
                    break;
                }
                selected.add(index);
                used += cost;
            }
            List<Integer> selectedRaw = new ArrayList<>();
            if (!full) {
                for (Integer index : rawOrder) {
                    int cost = items.get(index).getText().length() + (used > 0 ? SEPARATOR.length() : 0);
                    if (used + cost > maxChars) {
                        break;
                    }
                    selectedRaw.add(index);
                    used += cost;
                }
            }
            selectedRaw.sort(Comparator.naturalOrder());

            List<String> parts = new ArrayList<>();
            for (Integer index : selected) {
                parts.add(renderSummary(items.get(index)));
            }
            for (Integer index : selectedRaw) {
                parts.add(items.get(index).getText());
            }
            return String.join(SEPARATOR, parts);
        });
    }

    public MemoryStats stats() {
        return withLock(() -> {
            Map<Integer, Integer> counts = new LinkedHashMap<>();
            for (MemoryItem item : ledger.items()) {
                counts.merge(item.getLevel(), 1, Integer::sum);
            }
            int active = ledger.activeCharTotal();
            return MemoryStats.builder()
                    .totalItems(ledger.size())
                    .rawItems(ledger.rawItems().size())
                    .countsByLevel(new TreeMap<>(counts))
                    .activeChars(active)
                    .budgetMax(ledger.getBudgetMax())
                    .budgetUsedPercent(active * 100.0 / ledger.getBudgetMax())
                    .summaryRatio(ledger.summaryRatio())
                    .build();
        });
    }

    public ArchiveStats archiveStats() {
        return withLock(archive::stats);
    }

    public SearchStats searchStats() {
        return withLock(() -> {
            ArchiveStats stats = archive.stats();
            return new SearchStats(stats.totalItems(), stats.countsByLevel(), lastSearchAt);
        });
    }

    public DecompressionResult decompress(String itemId, int targetLevel) {
        return withLock(() -> decompressionEngine.decompress(archive, itemId, targetLevel));
    }

    public SearchResult search(String query, int maxLevel) {
        return withLock(() -> {
            lastSearchAt = clock.instant();
            return searchEngine.search(archive, query, maxLevel);
        });
    }

    public SearchResult advancedSearch(SearchOptions options) {
        return withLock(() -> {
            lastSearchAt = clock.instant();
            return searchEngine.advancedSearch(archive, options);
        });
    }

    public MemorySnapshot exportState() {
        return withLock(() -> MemorySnapshot.builder()
                .entityId(entityId)
                .exportedAt(clock.instant())
                .budgetMax(ledger.getBudgetMax())
                .l1Threshold(ledger.getL1Threshold())
                .hierarchicalThreshold(ledger.getHierarchicalThreshold())
                .ledger(new ArrayList<>(ledger.items()))
                .archive(archive.snapshot())
                .build());
    }

    /**
     * Replaces ledger and archive with the snapshot content. The current state is
     * kept when the snapshot is invalid.
     */
    public StateImportResult importState(MemorySnapshot snapshot) {
        return importState(snapshot, result -> {
        });
    }

    /**
     * Imports the snapshot and, when it was accepted, runs {@code afterImport}
     * before the entity lock is released.
     */
    public StateImportResult importState(MemorySnapshot snapshot, Consumer<StateImportResult> afterImport) {
        String error = validate(snapshot);
        if (error != null) {
            log.warn("[Memory] Rejected snapshot for {}: {}", entityId, error);
            return StateImportResult.failed(error);
        }
        return withLock(() -> {
            MemoryLedger restored;
            try {
                restored = new MemoryLedger(snapshot.getBudgetMax(), snapshot.getL1Threshold(),
                        snapshot.getHierarchicalThreshold());
            } catch (IllegalArgumentException e) {
                return StateImportResult.failed(e.getMessage());
            }
            archive.clear();
            for (List<MemoryItem> levelItems : snapshot.getArchive().values()) {
                levelItems.forEach(archive::append);
            }
            for (MemoryItem item : snapshot.getLedger()) {
                // ledger items are archived at creation, tolerate documents that omit them
                archive.append(item);
            }
            restored.replaceAll(snapshot.getLedger());
            ledger = restored;
            log.info("[Memory] Imported {} ledger items and {} archived items for {}",
                    ledger.size(), archive.size(), entityId);
            StateImportResult result = StateImportResult.ok(ledger.size(), archive.size());
            afterImport.accept(result);
            return result;
        });
    }

    public void clear() {
        clear(() -> {
        });
    }

    /**
     * Empties ledger and archive, then runs {@code afterClear} under the entity
     * lock.
     */
    public void clear(Runnable afterClear) {
        withLock(() -> {
            ledger.clear();
            archive.clear();
            lastSearchAt = null;
            afterClear.run();
            return null;
        });
    }

    /**
     * Immutable copy of the active ledger.
     */
    public List<MemoryItem> ledgerSnapshot() {
        return withLock(() -> List.copyOf(ledger.items()));
    }

    /**
     * Immutable copy of the archive keyed by level.
     */
    public Map<Integer, List<MemoryItem>> archiveSnapshot() {
        return withLock(() -> Map.copyOf(archive.snapshot()));
    }

    private String validate(MemorySnapshot snapshot) {
        if (snapshot == null) {
            return "Snapshot is missing";
        }
        if (snapshot.getSchemaVersion() > MemorySnapshot.SCHEMA_VERSION) {
            return "Unsupported schema version " + snapshot.getSchemaVersion();
        }
        if (snapshot.getLedger() == null || snapshot.getArchive() == null) {
            return "Snapshot must contain ledger and archive";
        }
        Set<String> ledgerIds = new HashSet<>();
        for (MemoryItem item : snapshot.getLedger()) {
            if (item == null) {
                return "Ledger contains a null item";
            }
            if (!ledgerIds.add(item.getId())) {
                return "Duplicate ledger item " + item.getId();
            }
        }
        Set<String> archivedIds = new HashSet<>();
        for (Map.Entry<Integer, List<MemoryItem>> entry : snapshot.getArchive().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                return "Archive contains an empty level entry";
            }
            for (MemoryItem item : entry.getValue()) {
                if (item == null) {
                    return "Archive level " + entry.getKey() + " contains a null item";
                }
                if (item.getLevel() != entry.getKey()) {
                    return "Item " + item.getId() + " has level " + item.getLevel()
                            + " but is archived under level " + entry.getKey();
                }
                if (!archivedIds.add(item.getId())) {
                    return "Duplicate archived item " + item.getId();
                }
            }
        }
        return null;
    }

    private String resolveSpeaker(ItemRole role, String speakerLabel) {
        if (role == ItemRole.ASSISTANT) {
            return properties.getMemory().getAssistantLabel();
        }
        return speakerLabel != null && !speakerLabel.isBlank() ? speakerLabel.trim() : "User";
    }

    static ItemQuality rawQuality(String content, ItemRole role) {
        int words = content.isBlank() ? 0 : content.trim().split("\\s+").length;
        double authority = Math.min(1.0, content.length() / 1000.0 * 0.3 + words / 50.0 * 0.2);
        if (role == ItemRole.ASSISTANT) {
            authority = Math.min(1.0, authority + 0.3);
        }
        return new ItemQuality(authority, 0.5, 0.1);
    }

    private static String renderSummary(MemoryItem item) {
        return "[Summary L" + item.getLevel() + "] " + item.getText();
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
