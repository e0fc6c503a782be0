package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.ArchiveStore;
import me.golemcore.archivist.domain.model.DecompressionResult;
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.RecalledItem;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static me.golemcore.archivist.testsupport.MemoryFixtures.raw;
import static me.golemcore.archivist.testsupport.MemoryFixtures.summary;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DecompressionEngineTest {

    private ExternalRecallService externalRecall;
    private DecompressionEngine engine;
    private ArchiveStore archive;

    @BeforeEach
    void setUp() {
        externalRecall = mock(ExternalRecallService.class);
        when(externalRecall.isAvailable()).thenReturn(false);
        engine = new DecompressionEngine(externalRecall, new ArchivistProperties());
        archive = new ArchiveStore();
    }

    @Test
    void shouldReturnExactlyTheCoveredItems() {
        archive.append(raw("m1", "Lucie: first"));
        archive.append(raw("m2", "Lucie: second"));
        archive.append(raw("m3", "Lucie: third"));
        archive.append(raw("m9", "Lucie: unrelated"));
        archive.append(summary("s1", 1, "three messages", "m1", "m2", "m3"));

        DecompressionResult result = engine.decompress(archive, "s1", 0);

        assertTrue(result.success());
        assertEquals(0, result.reachedLevel());
        assertFalse(result.usedFallback());
        assertEquals(List.of("m1", "m2", "m3"), result.items().stream().map(RecalledItem::id).toList());
        assertEquals(List.of("L1: s1", "L0: 3 items"), result.path());
        assertTrue(result.items().stream().allMatch(item -> item.source() == RecalledItem.Source.LOCAL));
    }

    @Test
    void shouldExpandMergedSummaryThroughLevelOneChildren() {
        archive.append(raw("m1", "one"));
        archive.append(raw("m2", "two"));
        archive.append(raw("m3", "three"));
        archive.append(raw("m4", "four"));
        archive.append(summary("a", 1, "first half", "m1", "m2"));
        archive.append(summary("b", 1, "second half", "m3", "m4"));
        archive.append(summary("top", 2, "everything", "m1", "m2", "m3", "m4"));

        DecompressionResult toLevelOne = engine.decompress(archive, "top", 1);
        DecompressionResult toRaw = engine.decompress(archive, "top", 0);

        assertTrue(toLevelOne.success());
        assertFalse(toLevelOne.usedFallback());
        assertEquals(List.of("first half", "second half"),
                toLevelOne.items().stream().map(RecalledItem::text).toList());
        assertEquals(List.of("L2: top", "L1: 2 items"), toLevelOne.path());

        assertEquals(List.of("m1", "m2", "m3", "m4"), toRaw.items().stream().map(RecalledItem::id).toList());
        assertEquals(List.of("L2: top", "L1: 2 items", "L0: 4 items"), toRaw.path());
    }

    @Test
    void shouldExpandSummaryCoveringLevelOneIdsDirectly() {
        archive.append(raw("m1", "one"));
        archive.append(raw("m2", "two"));
        archive.append(summary("a", 1, "first", "m1"));
        archive.append(summary("b", 1, "second", "m2"));
        archive.append(summary("top", 2, "both", "b", "a"));

        DecompressionResult result = engine.decompress(archive, "top", 1);

        assertEquals(List.of("b", "a"), result.items().stream().map(RecalledItem::id).toList());
        assertFalse(result.usedFallback());
    }

    @Test
    void coversShouldMatchArchivedChildrenForEveryLevelOneSummary() {
        for (int i = 1; i <= 6; i++) {
            archive.append(raw("m" + i, "message " + i));
        }
        archive.append(summary("s1", 1, "first", "m1", "m2"));
        archive.append(summary("s2", 1, "second", "m3", "m4", "m5"));
        archive.append(summary("s3", 1, "third", "m6"));

        for (MemoryItem summary : archive.itemsAt(1)) {
            DecompressionResult result = engine.decompress(archive, summary.getId(), 0);
            assertEquals(Set.copyOf(summary.getCovers()),
                    Set.copyOf(result.items().stream().map(RecalledItem::id).toList()));
        }
    }

    @Test
    void shouldUsePlaceholdersWhenChildrenAreMissing() {
        archive.append(summary("s1", 1, "we agreed on the deployment plan", "ghost1", "ghost2"));

        DecompressionResult result = engine.decompress(archive, "s1", 0);

        assertTrue(result.success());
        assertTrue(result.usedFallback());
        assertEquals(0, result.reachedLevel());
        assertEquals(2, result.items().size());
        RecalledItem placeholder = result.items().get(0);
        assertEquals("ghost1", placeholder.id());
        assertEquals(0, placeholder.level());
        assertEquals(RecalledItem.Source.FALLBACK, placeholder.source());
        assertEquals("[Details unavailable, summarized in s1] we agreed on the deployment plan", placeholder.text());
        assertEquals(List.of("L1: s1", "L0: 2 items (fallback)"), result.path());
    }

    @Test
    void shouldMixLocalChildrenAndPlaceholders() {
        archive.append(raw("m1", "present"));
        archive.append(summary("s1", 1, "summary", "m1", "ghost"));

        DecompressionResult result = engine.decompress(archive, "s1", 0);

        assertEquals(List.of("m1", "ghost"), result.items().stream().map(RecalledItem::id).toList());
        assertEquals(List.of("L1: s1", "L0: 1 item", "L0: 1 item (fallback)"), result.path());
        assertTrue(result.usedFallback());
    }

    @Test
    void shouldTruncatePlaceholderExcerpt() {
        archive.append(summary("s1", 1, "y".repeat(200), "ghost"));

        RecalledItem placeholder = engine.decompress(archive, "s1", 0).items().get(0);

        assertTrue(placeholder.text().endsWith("y".repeat(120) + "..."));
    }

    @Test
    void shouldCarryPlaceholdersDownAsLeaves() {
        archive.append(summary("top", 2, "lost history", "gone1", "gone2"));

        DecompressionResult result = engine.decompress(archive, "top", 0);

        assertTrue(result.success());
        assertEquals(0, result.reachedLevel());
        assertEquals(2, result.items().size());
        assertEquals(List.of("L2: top", "L1: 2 items (fallback)"), result.path());
    }

    @Test
    void shouldPreferExternalRecallOverPlaceholders() {
        when(externalRecall.isAvailable()).thenReturn(true);
        when(externalRecall.recall(anyString(), anyInt())).thenReturn(List.of(RecalledItem.builder()
                .id("ext-1")
                .level(RecalledItem.EXTERNAL_LEVEL)
                .text("the plan was blue/green")
                .relevance(0.9)
                .source(RecalledItem.Source.FALLBACK)
                .build()));
        archive.append(summary("s1", 1, "deployment plan", "ghost1"));
        archive.append(summary("s2", 1, "other plan", "ghost2"));
        archive.append(summary("top", 2, "plans", "s1", "s2"));

        DecompressionResult result = engine.decompress(archive, "top", 0);

        assertTrue(result.usedFallback());
        assertEquals(List.of("ext-1", "ghost2"), result.items().stream().map(RecalledItem::id).toList());
        assertEquals(RecalledItem.Source.FALLBACK, result.items().get(0).source());
        assertEquals(RecalledItem.EXTERNAL_LEVEL, result.items().get(0).level());
        assertEquals(RecalledItem.Source.FALLBACK, result.items().get(1).source());
        assertEquals(0, result.items().get(1).level());
        verify(externalRecall, times(1)).recall("deployment plan", 5);
    }

    @Test
    void shouldFallBackToPlaceholdersWhenExternalRecallIsEmpty() {
        when(externalRecall.isAvailable()).thenReturn(true);
        when(externalRecall.recall(anyString(), anyInt())).thenReturn(List.of());
        archive.append(summary("s1", 1, "summary", "ghost"));

        DecompressionResult result = engine.decompress(archive, "s1", 0);

        assertEquals(RecalledItem.Source.FALLBACK, result.items().get(0).source());
    }

    @Test
    void shouldReportUnknownItem() {
        DecompressionResult result = engine.decompress(archive, "missing", 0);

        assertFalse(result.success());
        assertEquals(-1, result.reachedLevel());
        assertTrue(result.items().isEmpty());
    }

    @Test
    void shouldReturnItemItselfWhenAlreadyAtTarget() {
        archive.append(raw("m1", "hello"));
        archive.append(summary("s1", 1, "greeting", "m1"));

        DecompressionResult result = engine.decompress(archive, "s1", 1);

        assertTrue(result.success());
        assertEquals(1, result.reachedLevel());
        assertEquals(List.of("s1"), result.items().stream().map(RecalledItem::id).toList());
        assertEquals(List.of("L1: s1"), result.path());
    }

    @Test
    void shouldPluralizeItems() {
        assertEquals("1 item", DecompressionEngine.plural(1, "item"));
        assertEquals("0 items", DecompressionEngine.plural(0, "item"));
        assertEquals("3 results", DecompressionEngine.plural(3, "result"));
    }
}
