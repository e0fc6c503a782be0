package me.golemcore.archivist.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Archive totals as seen by search, plus the time of the last search.
 */
public record SearchStats(int totalArchived, Map<Integer, Integer> archivedByLevel, Instant lastSearchAt) {
}
