package me.golemcore.archivist.domain.model;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Append-only record of every item ever produced for one entity, grouped by
 * level. Eviction from the active ledger never removes anything here.
 */
public class ArchiveStore {

    private final Map<Integer, List<MemoryItem>> levels = new TreeMap<>();
    private final Map<String, MemoryItem> byId = new HashMap<>();

    /**
     * Archives an item under its own level.
     *
     * @return false when an item with the same id is already archived
     */
    public boolean append(MemoryItem item) {
        if (item == null || byId.containsKey(item.getId())) {
            return false;
        }
        levels.computeIfAbsent(item.getLevel(), level -> new ArrayList<>()).add(item);
        byId.put(item.getId(), item);
        return true;
    }

    public Optional<MemoryItem> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public List<MemoryItem> itemsAt(int level) {
        List<MemoryItem> archived = levels.get(level);
        return archived != null ? List.copyOf(archived) : List.of();
    }

    public List<Integer> populatedLevels() {
        List<Integer> result = new ArrayList<>();
        for (Map.Entry<Integer, List<MemoryItem>> entry : levels.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public int maxLevel() {
        List<Integer> populated = populatedLevels();
        return populated.isEmpty() ? 0 : populated.get(populated.size() - 1);
    }

    public int size() {
        return byId.size();
    }

    public ArchiveStats stats() {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        Map<Integer, Double> ratios = new LinkedHashMap<>();
        Instant oldest = null;
        Instant newest = null;
        for (Map.Entry<Integer, List<MemoryItem>> entry : levels.entrySet()) {
            List<MemoryItem> archived = entry.getValue();
            if (archived.isEmpty()) {
                continue;
            }
            counts.put(entry.getKey(), archived.size());
            ratios.put(entry.getKey(), nominalCompressionRatio(entry.getKey()));
            for (MemoryItem item : archived) {
                Instant createdAt = item.getCreatedAt();
                if (oldest == null || createdAt.isBefore(oldest)) {
                    oldest = createdAt;
                }
                if (newest == null || createdAt.isAfter(newest)) {
                    newest = createdAt;
                }
            }
        }
        return ArchiveStats.builder()
                .totalItems(byId.size())
                .countsByLevel(counts)
                .compressionRatios(ratios)
                .oldest(oldest)
                .newest(newest)
                .build();
    }

    /**
     * Deep copy keyed by level, in level order.
     */
    public Map<Integer, List<MemoryItem>> snapshot() {
        Map<Integer, List<MemoryItem>> copy = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<MemoryItem>> entry : levels.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return copy;
    }

    public void clear() {
        levels.clear();
        byId.clear();
    }

    static double nominalCompressionRatio(int level) {
        return switch (level) {
        case 0 -> 1.0;
        case 1 -> 0.2;
        case 2 -> 0.1;
        case 3 -> 0.05;
        default -> level < 0 ? 1.0 : 0.05 / Math.pow(2, level - 3);
        };
    }
}
