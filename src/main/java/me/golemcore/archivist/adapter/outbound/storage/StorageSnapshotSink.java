package me.golemcore.archivist.adapter.outbound.storage;


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
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.MemorySnapshot;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.SnapshotSinkPort;
import me.golemcore.archivist.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Persists entity snapshots and compression events through {@link StoragePort}.
 *
 * <p>
 * Layout under the snapshot directory:
 * <ul>
 * <li>{@code <entity>/state.json} - latest snapshot, written atomically with a
 * {@code .bak} of the previous one</li>
 * <li>{@code <entity>/compression-events.jsonl} - one line per compaction</li>
 * </ul>
 * Deleting an entity removes every file under its directory, the event log
 * included. Failures are logged and never reach the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageSnapshotSink implements SnapshotSinkPort {

    static final String STATE_FILE = "state.json";
    static final String EVENTS_FILE = "compression-events.jsonl";

    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void snapshot(String entityId, MemorySnapshot snapshot) {
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            storagePort.putTextAtomic(directory(), entityId + "/" + STATE_FILE, json, true).get();
            log.debug("[Snapshot] Saved {} ({} chars)", entityId, json.length());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Snapshot] Save of {} interrupted", entityId);
        } catch (JsonProcessingException | ExecutionException e) {
            log.warn("[Snapshot] Failed to save {}: {}", entityId, e.getMessage());
        }
    }

    @Override
    public void recordAction(String entityId, CompressionAction action) {
        CompressionEvent event = new CompressionEvent(
                clock.instant(),
                entityId,
                action.type().name(),
                action.produced().stream().map(MemoryItem::getId).toList(),
                action.evictedIds(),
                action.budgetAfter());
        try {
            String line = objectMapper.writeValueAsString(event) + "\n";
            storagePort.appendText(directory(), entityId + "/" + EVENTS_FILE, line).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Snapshot] Event log of {} interrupted", entityId);
        } catch (JsonProcessingException | ExecutionException e) {
            log.warn("[Snapshot] Failed to record {} for {}: {}", action.type(), entityId, e.getMessage());
        }
    }

    @Override
    public Optional<MemorySnapshot> loadLatest(String entityId) {
        try {
            String statePath = entityId + "/" + STATE_FILE;
            if (!Boolean.TRUE.equals(storagePort.exists(directory(), statePath).get())) {
                return Optional.empty();
            }
            String json = storagePort.getText(directory(), statePath).get();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, MemorySnapshot.class));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Snapshot] Load of {} interrupted", entityId);
            return Optional.empty();
        } catch (JsonProcessingException | ExecutionException e) {
            log.warn("[Snapshot] Failed to load {}: {}", entityId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String entityId) {
        try {
            List<String> files = storagePort.listObjects(directory(), entityId).get();
            for (String file : files) {
                storagePort.deleteObject(directory(), file).get();
            }
            log.debug("[Snapshot] Deleted {} files of {}", files.size(), entityId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Snapshot] Delete of {} interrupted", entityId);
        } catch (ExecutionException e) {
            log.warn("[Snapshot] Failed to delete {}: {}", entityId, e.getMessage());
        }
    }

    private String directory() {
        return properties.getStorage().getSnapshotDirectory();
    }

    record CompressionEvent(Instant timestamp, String entityId, String action, List<String> producedIds,
            List<String> evictedIds, int budgetAfter) {
    }
}
