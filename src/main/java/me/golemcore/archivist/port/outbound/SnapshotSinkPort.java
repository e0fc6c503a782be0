package me.golemcore.archivist.port.outbound;


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
import me.golemcore.archivist.domain.model.MemorySnapshot;

import java.util.Optional;

/**
 * Durable destination for entity state, written after every compaction that
 * changed the ledger.
 */
public interface SnapshotSinkPort {

    void snapshot(String entityId, MemorySnapshot snapshot);

    void recordAction(String entityId, CompressionAction action);

    Optional<MemorySnapshot> loadLatest(String entityId);

    void delete(String entityId);
}
