package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.CompressionAction;
import me.golemcore.archivist.domain.model.IngestResult;
import me.golemcore.archivist.domain.model.ItemRole;
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.MemorySnapshot;
import me.golemcore.archivist.domain.model.StateImportResult;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.SnapshotSinkPort;
import me.golemcore.archivist.port.outbound.SummarizationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static me.golemcore.archivist.testsupport.MemoryFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConversationMemoryRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private SnapshotSinkPort snapshotSink;
    private ConversationMemoryRegistry registry;

    @BeforeEach
    void setUp() {
        ArchivistProperties properties = new ArchivistProperties();
        properties.getMemory().setL1Threshold(2);
        properties.getSummarization().setTimeoutMs(1000);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        SummarizationPort summarizationPort = mock(SummarizationPort.class);
        when(summarizationPort.summarize(anyList(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("short summary"));
        snapshotSink = mock(SnapshotSinkPort.class);
        when(snapshotSink.loadLatest(anyString())).thenReturn(Optional.empty());

        TopicExtractor topicExtractor = new TopicExtractor();
        ExternalRecallService externalRecall = mock(ExternalRecallService.class);
        registry = new ConversationMemoryRegistry(properties,
                new CompressionPolicyEngine(summarizationPort, topicExtractor, properties, clock),
                new DecompressionEngine(externalRecall, properties),
                new ProactiveSearchEngine(topicExtractor, externalRecall, properties),
                topicExtractor, snapshotSink, clock);
    }

    @Test
    void shouldNotPersistWhenNothingWasCompacted() {
        IngestResult result = registry.ingest("lucie", "hello", ItemRole.USER, "Lucie");

        assertTrue(result.accepted());
        verify(snapshotSink, never()).snapshot(anyString(), any());
        verify(snapshotSink, never()).recordAction(anyString(), any());
    }

    @Test
    void shouldPersistAfterCompaction() {
        List<IngestResult> results = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            results.add(registry.ingest("lucie", "message " + i, ItemRole.USER, "Lucie"));
        }

        CompressionAction action = results.get(3).actions().get(0);
        verify(snapshotSink).recordAction("lucie", action);
        verify(snapshotSink, times(1)).snapshot(eq("lucie"), any(MemorySnapshot.class));
    }

    @Test
    void shouldSaveSnapshotsInIngestionOrderWhenIngestsRace() throws Exception {
        CountDownLatch firstSaveStarted = new CountDownLatch(1);
        CountDownLatch releaseFirstSave = new CountDownLatch(1);
        List<MemorySnapshot> saved = Collections.synchronizedList(new ArrayList<>());
        doAnswer(invocation -> {
            saved.add(invocation.getArgument(1));
            if (saved.size() == 1) {
                firstSaveStarted.countDown();
                assertTrue(releaseFirstSave.await(5, TimeUnit.SECONDS));
            }
            return null;
        }).when(snapshotSink).snapshot(anyString(), any(MemorySnapshot.class));
        for (int i = 1; i <= 3; i++) {
            registry.ingest("lucie", "message " + i, ItemRole.USER, "Lucie");
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<IngestResult> first = executor
                    .submit(() -> registry.ingest("lucie", "message 4", ItemRole.USER, "Lucie"));
            assertTrue(firstSaveStarted.await(5, TimeUnit.SECONDS));
            Future<?> second = executor.submit(() -> {
                registry.ingest("lucie", "message 5", ItemRole.USER, "Lucie");
                registry.ingest("lucie", "message 6", ItemRole.USER, "Lucie");
            });
            assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));

            releaseFirstSave.countDown();
            assertFalse(first.get(5, TimeUnit.SECONDS).actions().isEmpty());
            second.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(2, saved.size());
        Map<Integer, List<MemoryItem>> live = registry.getOrCreate("lucie").archiveSnapshot();
        MemorySnapshot last = saved.get(saved.size() - 1);
        assertEquals(8, countItems(live));
        assertEquals(countItems(live), countItems(last.getArchive()));
        assertEquals(2, last.getArchive().get(1).size());
    }

    @Test
    void shouldRestorePersistedSnapshotOnFirstAccess() {
        MemorySnapshot persisted = MemorySnapshot.builder()
                .entityId("bob")
                .budgetMax(10_000)
                .l1Threshold(5)
                .hierarchicalThreshold(0.5)
                .ledger(new ArrayList<>(List.of(raw("m1", "Bob: remembered"))))
                .build();
        when(snapshotSink.loadLatest("bob")).thenReturn(Optional.of(persisted));

        Optional<ConversationMemory> memory = registry.find("bob");

        assertTrue(memory.isPresent());
        assertEquals("Bob: remembered", memory.get().ledgerSnapshot().get(0).getText());
        assertSame(memory.get(), registry.getOrCreate("bob"));
        verify(snapshotSink, times(1)).loadLatest("bob");
    }

    @Test
    void shouldNotCreateMemoryOnFind() {
        assertTrue(registry.find("nobody").isEmpty());
        assertTrue(registry.entityIds().isEmpty());
    }

    @Test
    void shouldRejectUnsafeEntityIds() {
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate("../etc"));
        assertThrows(IllegalArgumentException.class, () -> registry.find(""));
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate(null));
        assertTrue(ConversationMemoryRegistry.isValidEntityId("user-42.chat_1"));
        assertFalse(ConversationMemoryRegistry.isValidEntityId("a".repeat(65)));
    }

    @Test
    void shouldPersistSuccessfulImport() {
        MemorySnapshot snapshot = MemorySnapshot.builder()
                .budgetMax(10_000)
                .l1Threshold(5)
                .hierarchicalThreshold(0.5)
                .ledger(new ArrayList<>(List.of(raw("m1", "Lucie: hi"))))
                .build();

        StateImportResult result = registry.importState("lucie", snapshot);

        assertTrue(result.success());
        assertEquals(1, result.ledgerItems());
        verify(snapshotSink).snapshot(eq("lucie"), any(MemorySnapshot.class));
    }

    @Test
    void shouldNotPersistFailedImport() {
        MemorySnapshot snapshot = MemorySnapshot.builder()
                .budgetMax(10_000)
                .l1Threshold(5)
                .hierarchicalThreshold(0.5)
                .ledger(null)
                .build();

        assertFalse(registry.importState("lucie", snapshot).success());
        verify(snapshotSink, never()).snapshot(anyString(), any());
    }

    @Test
    void shouldClearAndDeletePersistedState() {
        registry.ingest("lucie", "hello", ItemRole.USER, "Lucie");

        assertTrue(registry.clear("lucie"));
        assertTrue(registry.getOrCreate("lucie").ledgerSnapshot().isEmpty());
        verify(snapshotSink).delete("lucie");
        assertFalse(registry.clear("unknown"));
    }

    private static int countItems(Map<Integer, List<MemoryItem>> archive) {
        return archive.values().stream().mapToInt(List::size).sum();
    }
}
