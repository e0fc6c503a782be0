package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Result of walking the covers graph from a summary down to a target level.
 *
 * @param reachedLevel
 *            level of {@code items}, or -1 when the start item is unknown
 * @param path
 *            per-level trace, e.g. {@code "L1: 2 items"}
 */
@Builder
public record DecompressionResult(boolean success, int reachedLevel, List<RecalledItem> items, List<String> path,
        boolean usedFallback) {

    public DecompressionResult {
        items = items != null ? List.copyOf(items) : List.of();
        path = path != null ? List.copyOf(path) : List.of();
    }

    public static DecompressionResult notFound() {
        return new DecompressionResult(false, -1, List.of(), List.of(), false);
    }
}
