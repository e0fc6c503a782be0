package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.util.Map;

/**
 * Active ledger statistics.
 */
@Builder
public record MemoryStats(int totalItems, int rawItems, Map<Integer, Integer> countsByLevel, int activeChars,
        int budgetMax, double budgetUsedPercent, double summaryRatio) {
}
