package me.golemcore.archivist.testsupport;

import me.golemcore.archivist.domain.model.ItemQuality;
import me.golemcore.archivist.domain.model.ItemRole;
import me.golemcore.archivist.domain.model.RawItem;
import me.golemcore.archivist.domain.model.SummaryItem;

import java.time.Instant;
import java.util.List;

/**
 * Builders for memory items used across tests.
 */
public final class MemoryFixtures {

    public static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");

    private MemoryFixtures() {
    }

    public static RawItem raw(String id, String text) {
        return raw(id, text, List.of());
    }

    public static RawItem raw(String id, String text, List<String> topics) {
        return RawItem.builder()
                .id(id)
                .text(text)
                .topics(topics)
                .createdAt(T0)
                .role(ItemRole.USER)
                .speaker("Lucie")
                .build();
    }

    public static SummaryItem summary(String id, int level, String text, String... covers) {
        return summary(id, level, text, T0, covers);
    }

    public static SummaryItem summary(String id, int level, String text, Instant createdAt, String... covers) {
        return SummaryItem.builder()
                .id(id)
                .level(level)
                .text(text)
                .covers(List.of(covers))
                .createdAt(createdAt)
                .quality(ItemQuality.LEVEL_ONE)
                .build();
    }

    public static String chars(int count) {
        return "x".repeat(count);
    }
}
