package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.ExternalMemoryHit;
import me.golemcore.archivist.domain.model.RecalledItem;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.ExternalMemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ExternalRecallServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private ExternalMemoryPort port;
    private ExternalRecallService service;

    @BeforeEach
    void setUp() {
        port = mock(ExternalMemoryPort.class);
        when(port.isAvailable()).thenReturn(true);
        service = new ExternalRecallService(port, new ArchivistProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldMapHitsToExternalItems() {
        when(port.search("deployment", 3)).thenReturn(CompletableFuture.completedFuture(List.of(
                new ExternalMemoryHit("h1", "blue/green rollout", 0.92),
                new ExternalMemoryHit(null, "canary first", 1.7),
                new ExternalMemoryHit("h3", " ", 0.5))));

        List<RecalledItem> recalled = service.recall("deployment", 3);

        assertEquals(2, recalled.size());
        assertEquals("h1", recalled.get(0).id());
        assertEquals(RecalledItem.EXTERNAL_LEVEL, recalled.get(0).level());
        assertEquals(RecalledItem.Source.FALLBACK, recalled.get(0).source());
        assertEquals(NOW, recalled.get(0).createdAt());
        assertEquals("ext_1", recalled.get(1).id());
        assertEquals(1.0, recalled.get(1).relevance());
    }

    @Test
    void shouldReturnEmptyWhenUnavailable() {
        when(port.isAvailable()).thenReturn(false);

        assertTrue(service.recall("deployment", 3).isEmpty());
        verify(port, never()).search(anyString(), anyInt());
    }

    @Test
    void shouldSwallowPortFailures() {
        when(port.search(anyString(), anyInt()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertTrue(service.recall("deployment", 3).isEmpty());
    }

    @Test
    void shouldSwallowSynchronousPortErrors() {
        when(port.search(anyString(), anyInt())).thenThrow(new IllegalStateException("down"));

        assertTrue(service.recall("deployment", 3).isEmpty());
    }

    @Test
    void shouldIgnoreBlankQueries() {
        assertTrue(service.recall(" ", 3).isEmpty());
        assertTrue(service.recall("deployment", 0).isEmpty());
        verify(port, never()).search(anyString(), anyInt());
    }
}
