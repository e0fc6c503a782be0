package me.golemcore.archivist.domain.service;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.archivist.domain.model.ExternalMemoryHit;
import me.golemcore.archivist.domain.model.RecalledItem;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.ExternalMemoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking access to the external memory service for the decompression and
 * search fallbacks. Never throws: an unavailable, failing or slow service
 * yields an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExternalRecallService {

    private final ExternalMemoryPort externalMemoryPort;
    private final ArchivistProperties properties;
    private final Clock clock;

    public boolean isAvailable() {
        return externalMemoryPort != null && externalMemoryPort.isAvailable();
    }

    public List<RecalledItem> recall(String query, int limit) {
        if (!isAvailable() || query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        long timeoutMs = TimeUnit.SECONDS.toMillis(properties.getExternalMemory().getTimeoutSeconds());
        CompletableFuture<List<ExternalMemoryHit>> future = null;
        List<ExternalMemoryHit> hits;
        try {
            future = externalMemoryPort.search(query, limit);
            hits = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ExternalMemory] Lookup interrupted: {}", e.getMessage());
            return List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ExternalMemory] Lookup timed out after {}ms", timeoutMs);
            return List.of();
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[ExternalMemory] Lookup failed: {}", e.getMessage());
            return List.of();
        }
        if (hits == null || hits.isEmpty()) {
            return List.of();
        }

        List<RecalledItem> recalled = new ArrayList<>();
        for (ExternalMemoryHit hit : hits) {
            if (recalled.size() >= limit) {
                break;
            }
            if (hit == null || hit.content() == null || hit.content().isBlank()) {
                continue;
            }
            recalled.add(RecalledItem.builder()
                    .id(hit.id() != null ? hit.id() : "ext_" + recalled.size())
                    .level(RecalledItem.EXTERNAL_LEVEL)
                    .text(hit.content())
                    .createdAt(clock.instant())
                    .relevance(Math.max(0.0, Math.min(1.0, hit.score())))
                    .source(RecalledItem.Source.FALLBACK)
                    .build());
        }
        log.debug("[ExternalMemory] {} hits for '{}'", recalled.size(), query);
        return recalled;
    }
}
