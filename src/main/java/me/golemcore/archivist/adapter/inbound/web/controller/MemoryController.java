package me.golemcore.archivist.adapter.inbound.web.controller;


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

import me.golemcore.archivist.adapter.inbound.web.dto.CompressionActionDto;
import me.golemcore.archivist.adapter.inbound.web.dto.IngestResponse;
import me.golemcore.archivist.domain.model.ArchiveStats;
import me.golemcore.archivist.domain.model.CompressionAction;
import me.golemcore.archivist.domain.model.DecompressionResult;
import me.golemcore.archivist.domain.model.IngestResult;
import me.golemcore.archivist.domain.model.ItemRole;
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.MemorySnapshot;
import me.golemcore.archivist.domain.model.MemoryStats;
import me.golemcore.archivist.domain.model.SearchOptions;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.model.SearchStats;
import me.golemcore.archivist.domain.model.StateImportResult;
import me.golemcore.archivist.domain.service.ConversationMemory;
import me.golemcore.archivist.domain.service.ConversationMemoryRegistry;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Memory endpoints for the conversation layer, one resource per entity.
 */
@RestController
@RequestMapping("/api/memory/{entityId}")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private static final int DEFAULT_CONTEXT_CHARS = 4000;

    private final ConversationMemoryRegistry registry;
    private final ArchivistProperties properties;

    @PostMapping("/messages")
    public Mono<ResponseEntity<IngestResponse>> ingest(
            @PathVariable String entityId,
            @RequestBody IngestRequest request) {
        validateEntityId(entityId);
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "'text' is required");
        }

        return Mono.fromCallable(() -> {
            IngestResult result = registry.ingest(entityId, request.text(), ItemRole.fromString(request.role()),
                    request.speaker());
            if (!result.accepted()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, result.rejectionReason());
            }
            return ResponseEntity.ok(IngestResponse.builder()
                    .entityId(entityId)
                    .itemId(result.itemId())
                    .actions(result.actions().stream().map(MemoryController::toDto).toList())
                    .build());
        });
    }

    @GetMapping("/context")
    public Mono<ResponseEntity<ContextResponse>> getContext(
            @PathVariable String entityId,
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Integer maxChars) {
        int limit = maxChars != null ? maxChars : DEFAULT_CONTEXT_CHARS;
        if (limit < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "maxChars must not be negative");
        }
        String context = requireMemory(entityId).buildContext(query, limit);
        return Mono.just(ResponseEntity.ok(new ContextResponse(entityId, context, context.length())));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<MemoryStats>> getStats(@PathVariable String entityId) {
        return Mono.just(ResponseEntity.ok(requireMemory(entityId).stats()));
    }

    @GetMapping("/archive/stats")
    public Mono<ResponseEntity<ArchiveStats>> getArchiveStats(@PathVariable String entityId) {
        return Mono.just(ResponseEntity.ok(requireMemory(entityId).archiveStats()));
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<SearchResult>> search(
            @PathVariable String entityId,
            @RequestParam String query,
            @RequestParam(required = false) Integer maxLevel) {
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "'query' is required");
        }
        ConversationMemory memory = requireMemory(entityId);
        int level = maxLevel != null ? maxLevel : properties.getSearch().getDefaultMaxLevel();
        return Mono.fromCallable(() -> ResponseEntity.ok(memory.search(query, level)));
    }

    @PostMapping("/search/advanced")
    public Mono<ResponseEntity<SearchResult>> advancedSearch(
            @PathVariable String entityId,
            @RequestBody SearchOptions options) {
        if (options == null || options.getQuery() == null || options.getQuery().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "'query' is required");
        }
        ConversationMemory memory = requireMemory(entityId);
        return Mono.fromCallable(() -> ResponseEntity.ok(memory.advancedSearch(options)));
    }

    @GetMapping("/search/stats")
    public Mono<ResponseEntity<SearchStats>> getSearchStats(@PathVariable String entityId) {
        return Mono.just(ResponseEntity.ok(requireMemory(entityId).searchStats()));
    }

    @GetMapping("/items/{itemId}/decompress")
    public Mono<ResponseEntity<DecompressionResult>> decompress(
            @PathVariable String entityId,
            @PathVariable String itemId,
            @RequestParam(defaultValue = "0") int targetLevel) {
        ConversationMemory memory = requireMemory(entityId);
        return Mono.fromCallable(() -> {
            DecompressionResult result = memory.decompress(itemId, targetLevel);
            if (result.reachedLevel() < 0) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Item not found: " + itemId);
            }
            return ResponseEntity.ok(result);
        });
    }

    @GetMapping("/export")
    public Mono<ResponseEntity<MemorySnapshot>> exportState(@PathVariable String entityId) {
        return Mono.just(ResponseEntity.ok(requireMemory(entityId).exportState()));
    }

    @PostMapping("/import")
    public Mono<ResponseEntity<StateImportResult>> importState(
            @PathVariable String entityId,
            @RequestBody MemorySnapshot snapshot) {
        validateEntityId(entityId);
        StateImportResult result = registry.importState(entityId, snapshot);
        if (!result.success()) {
            return Mono.just(ResponseEntity.badRequest().body(result));
        }
        return Mono.just(ResponseEntity.ok(result));
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> clear(@PathVariable String entityId) {
        validateEntityId(entityId);
        if (!registry.clear(entityId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown entity: " + entityId);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    private ConversationMemory requireMemory(String entityId) {
        validateEntityId(entityId);
        return registry.find(entityId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown entity: " + entityId));
    }

    private static void validateEntityId(String entityId) {
        if (!ConversationMemoryRegistry.isValidEntityId(entityId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid entity id: " + entityId);
        }
    }

    private static CompressionActionDto toDto(CompressionAction action) {
        List<MemoryItem> produced = action.produced();
        return CompressionActionDto.builder()
                .type(action.type().name())
                .producedIds(produced.stream().map(MemoryItem::getId).toList())
                .producedLevels(produced.stream().map(MemoryItem::getLevel).toList())
                .evictedIds(action.evictedIds())
                .budgetAfter(action.budgetAfter())
                .build();
    }

    public record IngestRequest(String text, String role, String speaker) {
    }

    public record ContextResponse(String entityId, String context, int chars) {
    }
}
