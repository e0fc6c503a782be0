package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Outcome of one fired compaction rule.
 */
@Builder
public record CompressionAction(Type type, List<MemoryItem> produced, List<String> evictedIds, int budgetAfter) {

    public enum Type {
        NONE, CREATE_L1, BUDGET_REPLACE, MERGE_UP
    }

    public CompressionAction {
        type = type != null ? type : Type.NONE;
        produced = produced != null ? List.copyOf(produced) : List.of();
        evictedIds = evictedIds != null ? List.copyOf(evictedIds) : List.of();
    }

    public static CompressionAction none(int budgetAfter) {
        return new CompressionAction(Type.NONE, List.of(), List.of(), budgetAfter);
    }

    public boolean isNone() {
        return type == Type.NONE;
    }
}
