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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Active memory of one conversational entity: the ordered items currently in
 * context plus the budget and thresholds that drive compaction.
 *
 * <p>
 * Pure container. Callers are responsible for the covers and level
 * invariants; the ledger never checks them.
 */
@Getter
public class MemoryLedger {

    private final int budgetMax;
    private final int l1Threshold;
    private final double hierarchicalThreshold;

    @Getter(lombok.AccessLevel.NONE)
    private final List<MemoryItem> items = new ArrayList<>();

    public MemoryLedger(int budgetMax, int l1Threshold, double hierarchicalThreshold) {
        if (budgetMax <= 0) {
            throw new IllegalArgumentException("budgetMax must be positive");
        }
        if (l1Threshold < 1) {
            throw new IllegalArgumentException("l1Threshold must be at least 1");
        }
        if (hierarchicalThreshold <= 0.0 || hierarchicalThreshold >= 1.0) {
            throw new IllegalArgumentException("hierarchicalThreshold must be in (0, 1)");
        }
        this.budgetMax = budgetMax;
        this.l1Threshold = l1Threshold;
        this.hierarchicalThreshold = hierarchicalThreshold;
    }

    public void append(MemoryItem item) {
        items.add(item);
    }

    public void insertAt(int index, MemoryItem item) {
        int bounded = Math.max(0, Math.min(index, items.size()));
        items.add(bounded, item);
    }

    /**
     * Removes every item whose id is in {@code ids}.
     *
     * @return removed items in ledger order
     */
    public List<MemoryItem> removeMany(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<String> targets = new HashSet<>(ids);
        List<MemoryItem> removed = new ArrayList<>();
        items.removeIf(item -> {
            if (targets.contains(item.getId())) {
                removed.add(item);
                return true;
            }
            return false;
        });
        return removed;
    }

    public int indexOf(String id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    public int activeCharTotal() {
        int total = 0;
        for (MemoryItem item : items) {
            total += item.getCharCount();
        }
        return total;
    }

    public double summaryRatio() {
        if (items.isEmpty()) {
            return 0.0;
        }
        return (double) countSummaries() / (double) items.size();
    }

    public List<MemoryItem> items() {
        return Collections.unmodifiableList(items);
    }

    public List<RawItem> rawItems() {
        List<RawItem> raw = new ArrayList<>();
        for (MemoryItem item : items) {
            if (item instanceof RawItem) {
                raw.add((RawItem) item);
            }
        }
        return raw;
    }

    public List<SummaryItem> summariesAt(int level) {
        List<SummaryItem> result = new ArrayList<>();
        for (MemoryItem item : items) {
            if (item instanceof SummaryItem && item.getLevel() == level) {
                result.add((SummaryItem) item);
            }
        }
        return result;
    }

    public int countSummaries() {
        int count = 0;
        for (MemoryItem item : items) {
            if (item.isSummary()) {
                count++;
            }
        }
        return count;
    }

    public int maxLevel() {
        int max = 0;
        for (MemoryItem item : items) {
            max = Math.max(max, item.getLevel());
        }
        return max;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public void clear() {
        items.clear();
    }

    /**
     * Replaces the whole content, used when importing a snapshot.
     */
    public void replaceAll(List<? extends MemoryItem> replacement) {
        items.clear();
        if (replacement != null) {
            items.addAll(replacement);
        }
    }
}
