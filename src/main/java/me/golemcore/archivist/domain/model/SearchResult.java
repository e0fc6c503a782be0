package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Search hits with the level trace that produced them.
 */
@Builder
public record SearchResult(List<RecalledItem> results, List<String> path, boolean usedFallback) {

    public SearchResult {
        results = results != null ? List.copyOf(results) : List.of();
        path = path != null ? List.copyOf(path) : List.of();
    }

    public static SearchResult empty() {
        return new SearchResult(List.of(), List.of(), false);
    }
}
