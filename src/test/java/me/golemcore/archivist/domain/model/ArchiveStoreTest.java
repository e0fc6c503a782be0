package me.golemcore.archivist.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static me.golemcore.archivist.testsupport.MemoryFixtures.raw;
import static me.golemcore.archivist.testsupport.MemoryFixtures.summary;
import static org.junit.jupiter.api.Assertions.*;

class ArchiveStoreTest {

    @Test
    void shouldIndexItemsByLevelAndId() {
        ArchiveStore archive = new ArchiveStore();
        archive.append(raw("m1", "first"));
        archive.append(raw("m2", "second"));
        archive.append(summary("s1", 1, "summary", "m1", "m2"));

        assertEquals(3, archive.size());
        assertEquals(2, archive.itemsAt(0).size());
        assertEquals(1, archive.itemsAt(1).size());
        assertTrue(archive.itemsAt(2).isEmpty());
        assertEquals("summary", archive.get("s1").orElseThrow().getText());
        assertTrue(archive.get("missing").isEmpty());
        assertTrue(archive.get(null).isEmpty());
        assertEquals(List.of(0, 1), archive.populatedLevels());
        assertEquals(1, archive.maxLevel());
    }

    @Test
    void shouldIgnoreDuplicateIds() {
        ArchiveStore archive = new ArchiveStore();

        assertTrue(archive.append(raw("m1", "first")));
        assertFalse(archive.append(raw("m1", "again")));

        assertEquals(1, archive.size());
        assertEquals("first", archive.get("m1").orElseThrow().getText());
    }

    @Test
    void shouldReportStatsWithNominalRatios() {
        ArchiveStore archive = new ArchiveStore();
        archive.append(raw("m1", "first"));
        archive.append(summary("s1", 1, "one", Instant.parse("2026-01-01T10:00:00Z"), "m1"));
        archive.append(summary("s2", 2, "two", Instant.parse("2026-01-02T10:00:00Z"), "m1"));
        archive.append(summary("s4", 4, "four", Instant.parse("2026-01-03T10:00:00Z"), "m1"));

        ArchiveStats stats = archive.stats();

        assertEquals(4, stats.totalItems());
        assertEquals(Map.of(0, 1, 1, 1, 2, 1, 4, 1), stats.countsByLevel());
        assertEquals(1.0, stats.compressionRatios().get(0));
        assertEquals(0.2, stats.compressionRatios().get(1));
        assertEquals(0.1, stats.compressionRatios().get(2));
        assertEquals(0.025, stats.compressionRatios().get(4), 1e-9);
        assertEquals(Instant.parse("2026-01-03T10:00:00Z"), stats.newest());
    }

    @Test
    void shouldReturnDetachedSnapshot() {
        ArchiveStore archive = new ArchiveStore();
        archive.append(raw("m1", "first"));

        Map<Integer, List<MemoryItem>> snapshot = archive.snapshot();
        archive.append(raw("m2", "second"));

        assertEquals(1, snapshot.get(0).size());
        assertEquals(2, archive.itemsAt(0).size());
    }

    @Test
    void shouldClearEverything() {
        ArchiveStore archive = new ArchiveStore();
        archive.append(raw("m1", "first"));

        archive.clear();

        assertEquals(0, archive.size());
        assertTrue(archive.populatedLevels().isEmpty());
        assertEquals(0, archive.stats().totalItems());
    }
}
