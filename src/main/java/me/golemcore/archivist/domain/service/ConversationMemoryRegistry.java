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

import me.golemcore.archivist.domain.model.CompressionAction;
import me.golemcore.archivist.domain.model.IngestResult;
import me.golemcore.archivist.domain.model.ItemRole;
import me.golemcore.archivist.domain.model.MemorySnapshot;
import me.golemcore.archivist.domain.model.StateImportResult;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.SnapshotSinkPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Owns one {@link ConversationMemory} per entity and persists it after every
 * compaction that changed the ledger.
 *
 * <p>
 * Memories are created lazily. On first access the latest persisted snapshot
 * is restored when the sink has one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationMemoryRegistry {

    private static final Pattern ENTITY_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final ArchivistProperties properties;
    private final CompressionPolicyEngine policyEngine;
    private final DecompressionEngine decompressionEngine;
    private final ProactiveSearchEngine searchEngine;
    private final TopicExtractor topicExtractor;
    private final SnapshotSinkPort snapshotSink;
    private final Clock clock;

    private final Map<String, ConversationMemory> memories = new ConcurrentHashMap<>();

    /**
     * Returns the entity memory, creating an empty one when none exists.
     *
     * @throws IllegalArgumentException
     *             if the entity id is not a safe identifier
     */
    public ConversationMemory getOrCreate(String entityId) {
        validateEntityId(entityId);
        return memories.computeIfAbsent(entityId, this::load);
    }

    /**
     * Returns the entity memory when it is live or persisted.
     */
    public Optional<ConversationMemory> find(String entityId) {
        validateEntityId(entityId);
        ConversationMemory live = memories.get(entityId);
        if (live != null) {
            return Optional.of(live);
        }
        Optional<MemorySnapshot> persisted = snapshotSink.loadLatest(entityId);
        if (persisted.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(memories.computeIfAbsent(entityId, id -> restore(id, persisted.get())));
    }

    /**
     * Ingests one turn. Compression events and the snapshot are written while
     * the entity lock is held, so saves for one entity follow ingestion order.
     */
    public IngestResult ingest(String entityId, String text, ItemRole role, String speakerLabel) {
        ConversationMemory memory = getOrCreate(entityId);
        return memory.ingest(text, role, speakerLabel, result -> {
            if (result.actions().isEmpty()) {
                return;
            }
            for (CompressionAction action : result.actions()) {
                snapshotSink.recordAction(entityId, action);
            }
            snapshotSink.snapshot(entityId, memory.exportState());
        });
    }

    public StateImportResult importState(String entityId, MemorySnapshot snapshot) {
        ConversationMemory memory = getOrCreate(entityId);
        return memory.importState(snapshot, result -> snapshotSink.snapshot(entityId, memory.exportState()));
    }

    /**
     * Empties the entity memory and drops its persisted state.
     *
     * @return false when the entity was unknown
     */
    public boolean clear(String entityId) {
        Optional<ConversationMemory> memory = find(entityId);
        if (memory.isEmpty()) {
            return false;
        }
        memory.get().clear(() -> snapshotSink.delete(entityId));
        log.info("[Memory] Cleared {}", entityId);
        return true;
    }

    public Set<String> entityIds() {
        return Set.copyOf(memories.keySet());
    }

    private ConversationMemory load(String entityId) {
        return snapshotSink.loadLatest(entityId)
                .map(snapshot -> restore(entityId, snapshot))
                .orElseGet(() -> create(entityId));
    }

    private ConversationMemory restore(String entityId, MemorySnapshot snapshot) {
        ConversationMemory memory = create(entityId);
        StateImportResult result = memory.importState(snapshot);
        if (result.success()) {
            log.info("[Memory] Restored {} from snapshot ({} archived items)", entityId, result.archivedItems());
        } else {
            log.warn("[Memory] Ignoring unreadable snapshot of {}: {}", entityId, result.error());
        }
        return memory;
    }

    private ConversationMemory create(String entityId) {
        return new ConversationMemory(entityId, properties, policyEngine, decompressionEngine, searchEngine,
                topicExtractor, clock);
    }

    public static boolean isValidEntityId(String entityId) {
        return entityId != null && ENTITY_ID.matcher(entityId).matches();
    }

    private static void validateEntityId(String entityId) {
        if (!isValidEntityId(entityId)) {
            throw new IllegalArgumentException("Invalid entity id: " + entityId);
        }
    }
}
