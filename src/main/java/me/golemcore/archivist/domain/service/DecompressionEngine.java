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

import me.golemcore.archivist.domain.model.ArchiveStore;
import me.golemcore.archivist.domain.model.DecompressionResult;
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.RecalledItem;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the covers graph of an archived summary down to a target level.
 *
 * <p>
 * Going from level {@code k} to {@code k-1}, the children of a summary are:
 * <ul>
 * <li>archived level {@code k-1} items whose id is listed in its covers, in
 * covers order</li>
 * <li>archived level {@code k-1} summaries whose own covers are a subset of its
 * covers, ordered by first covered id (merged summaries list leaf ids)</li>
 * </ul>
 * Cover ids reached by neither are missing. Missing content is recalled from
 * the external memory service once per call, then replaced by placeholders.
 * Recalled and placeholder items are leaves and are carried down unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecompressionEngine {

    private static final int PLACEHOLDER_EXCERPT_CHARS = 120;

    private final ExternalRecallService externalRecall;
    private final ArchivistProperties properties;

    public DecompressionResult decompress(ArchiveStore archive, String itemId, int targetLevel) {
        Optional<MemoryItem> start = archive.get(itemId);
        if (start.isEmpty()) {
            log.debug("[Decompression] Unknown item: {}", itemId);
            return DecompressionResult.notFound();
        }
        MemoryItem root = start.get();
        int target = Math.max(0, targetLevel);
        List<String> path = new ArrayList<>();
        path.add("L" + root.getLevel() + ": " + root.getId());

        List<RecalledItem> working = List.of(RecalledItem.of(root));
        int current = root.getLevel();
        Walk walk = new Walk();

        while (current > target && !working.isEmpty()) {
            int next = current - 1;
            List<RecalledItem> nextSet = new ArrayList<>();
            int localCount = 0;
            int fallbackCount = 0;
            for (RecalledItem parent : working) {
                if (parent.isFallback() || parent.covers().isEmpty()) {
                    nextSet.add(parent);
                    continue;
                }
                Expansion expansion = expand(archive, parent, next);
                nextSet.addAll(expansion.children());
                localCount += expansion.children().size();
                if (!expansion.missing().isEmpty()) {
                    List<RecalledItem> substitutes = fallback(parent, expansion.missing(), next, walk);
                    nextSet.addAll(substitutes);
                    fallbackCount += substitutes.size();
                }
            }
            if (localCount > 0) {
                path.add("L" + next + ": " + plural(localCount, "item"));
            }
            if (fallbackCount > 0) {
                path.add("L" + next + ": " + plural(fallbackCount, "item") + " (fallback)");
            }
            working = nextSet;
            current = next;
        }

        boolean success = !working.isEmpty();
        log.debug("[Decompression] {} L{} -> L{}: {} items, fallback={}",
                itemId, root.getLevel(), current, working.size(), walk.usedFallback);
        return DecompressionResult.builder()
                .success(success)
                .reachedLevel(current)
                .items(working)
                .path(path)
                .usedFallback(walk.usedFallback)
                .build();
    }

    private Expansion expand(ArchiveStore archive, RecalledItem parent, int level) {
        List<String> covers = parent.covers();
        Set<String> accounted = new HashSet<>();
        Set<String> childIds = new LinkedHashSet<>();
        List<RecalledItem> children = new ArrayList<>();

        for (String coveredId : covers) {
            Optional<MemoryItem> child = archive.get(coveredId);
            if (child.isPresent() && child.get().getLevel() == level && childIds.add(coveredId)) {
                children.add(RecalledItem.of(child.get()));
                accounted.add(coveredId);
            }
        }

        if (level >= 1) {
            Set<String> parentCovers = new HashSet<>(covers);
            List<MemoryItem> nested = new ArrayList<>();
            for (MemoryItem candidate : archive.itemsAt(level)) {
                List<String> candidateCovers = candidate.getCovers();
                if (!candidateCovers.isEmpty() && !childIds.contains(candidate.getId())
                        && !candidate.getId().equals(parent.id())
                        && parentCovers.containsAll(candidateCovers)) {
                    nested.add(candidate);
                }
            }
            nested.sort(Comparator.comparingInt(candidate -> covers.indexOf(candidate.getCovers().get(0))));
            for (MemoryItem candidate : nested) {
                if (accounted.containsAll(candidate.getCovers())) {
                    continue;
                }
                childIds.add(candidate.getId());
                children.add(RecalledItem.of(candidate));
                accounted.addAll(candidate.getCovers());
            }
        }

        List<String> missing = new ArrayList<>();
        for (String coveredId : covers) {
            if (!accounted.contains(coveredId)) {
                missing.add(coveredId);
            }
        }
        return new Expansion(children, missing);
    }

    private List<RecalledItem> fallback(RecalledItem parent, List<String> missing, int level, Walk walk) {
        walk.usedFallback = true;
        if (!walk.externalConsulted && externalRecall.isAvailable()) {
            walk.externalConsulted = true;
            List<RecalledItem> recalled = externalRecall.recall(parent.text(),
                    properties.getExternalMemory().getMaxResults());
            if (!recalled.isEmpty()) {
                log.info("[Decompression] {} missing under {}, recalled {} external items",
                        missing.size(), parent.id(), recalled.size());
                return recalled;
            }
        }

        log.info("[Decompression] {} missing under {}, using placeholders", missing.size(), parent.id());
        String excerpt = parent.text().length() > PLACEHOLDER_EXCERPT_CHARS
                ? parent.text().substring(0, PLACEHOLDER_EXCERPT_CHARS) + "..."
                : parent.text();
        List<RecalledItem> placeholders = new ArrayList<>(missing.size());
        for (String missingId : missing) {
            placeholders.add(RecalledItem.builder()
                    .id(missingId)
                    .level(level)
                    .text("[Details unavailable, summarized in " + parent.id() + "] " + excerpt)
                    .topics(parent.topics())
                    .createdAt(parent.createdAt())
                    .relevance(0.0)
                    .source(RecalledItem.Source.FALLBACK)
                    .build());
        }
        return placeholders;
    }

    static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    private record Expansion(List<RecalledItem> children, List<String> missing) {
    }

    private static final class Walk {
        private boolean usedFallback;
        private boolean externalConsulted;
    }
}
