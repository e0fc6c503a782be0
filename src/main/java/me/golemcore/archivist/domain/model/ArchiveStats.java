package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Archive counters per level with the oldest and newest creation timestamps.
 */
@Builder
public record ArchiveStats(int totalItems, Map<Integer, Integer> countsByLevel,
        Map<Integer, Double> compressionRatios, Instant oldest, Instant newest) {
}
