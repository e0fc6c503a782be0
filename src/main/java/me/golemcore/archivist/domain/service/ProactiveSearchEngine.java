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
import me.golemcore.archivist.domain.model.MemoryItem;
import me.golemcore.archivist.domain.model.RecalledItem;
import me.golemcore.archivist.domain.model.SearchOptions;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Lexical search over the archive, most abstract level first.
 *
 * <p>
 * {@link #search} stops at the first level with a match so broad summaries win
 * over the raw detail they cover. {@link #advancedSearch} scores every
 * candidate of the selected levels instead. Both fall back to the external
 * memory service when the archive has too little to offer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProactiveSearchEngine {

    private static final double PHRASE_SCORE = 0.8;
    private static final double KEYWORD_SCORE = 0.3;
    private static final double TOPIC_SCORE = 0.2;
    private static final double LEVEL_BONUS = 0.1;
    private static final int LEVEL_BONUS_CEILING = 4;

    private final TopicExtractor topicExtractor;
    private final ExternalRecallService externalRecall;
    private final ArchivistProperties properties;

    public SearchResult search(ArchiveStore archive, String query, int maxLevel) {
        if (query == null || query.isBlank()) {
            return SearchResult.empty();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<String> keywords = topicExtractor.keywords(query);
        int top = Math.min(maxLevel, archive.maxLevel());

        for (int level = top; level >= 0; level--) {
            List<RecalledItem> matches = new ArrayList<>();
            for (MemoryItem item : archive.itemsAt(level)) {
                if (containsIgnoreCase(item, needle)) {
                    matches.add(RecalledItem.of(item).toBuilder()
                            .relevance(score(item, needle, keywords))
                            .build());
                }
            }
            if (!matches.isEmpty()) {
                log.debug("[Search] '{}' matched {} items at L{}", query, matches.size(), level);
                return SearchResult.builder()
                        .results(matches)
                        .path(List.of("L" + level + ": " + DecompressionEngine.plural(matches.size(), "result")))
                        .usedFallback(false)
                        .build();
            }
        }

        if (!externalRecall.isAvailable()) {
            log.debug("[Search] '{}' matched nothing locally", query);
            return SearchResult.empty();
        }
        List<RecalledItem> external = externalRecall.recall(query,
                properties.getSearch().getDefaultMaxResults());
        return SearchResult.builder()
                .results(external)
                .path(List.of("external: " + DecompressionEngine.plural(external.size(), "result")))
                .usedFallback(!external.isEmpty())
                .build();
    }

    public SearchResult advancedSearch(ArchiveStore archive, SearchOptions options) {
        if (options == null || options.getQuery() == null || options.getQuery().isBlank()) {
            return SearchResult.empty();
        }
        ArchivistProperties.SearchProperties defaults = properties.getSearch();
        double minRelevance = options.getMinRelevance() != null
                ? options.getMinRelevance()
                : defaults.getDefaultMinRelevance();
        int maxResults = options.getMaxResults() != null && options.getMaxResults() > 0
                ? options.getMaxResults()
                : defaults.getDefaultMaxResults();
        String needle = options.getQuery().trim().toLowerCase(Locale.ROOT);
        List<String> keywords = topicExtractor.keywords(options.getQuery());

        List<RecalledItem> local = new ArrayList<>();
        List<String> path = new ArrayList<>();
        for (int level : levelsToScan(archive, options.getLevels())) {
            int found = 0;
            for (MemoryItem item : archive.itemsAt(level)) {
                double relevance = score(item, needle, keywords);
                if (relevance > 0.0 && relevance >= minRelevance) {
                    local.add(RecalledItem.of(item).toBuilder().relevance(relevance).build());
                    found++;
                }
            }
            if (found > 0) {
                path.add("L" + level + ": " + DecompressionEngine.plural(found, "result"));
            }
        }
        local.sort(Comparator.comparingDouble(RecalledItem::relevance).reversed());
        List<RecalledItem> results = new ArrayList<>(local.subList(0, Math.min(maxResults, local.size())));

        boolean usedFallback = false;
        if (options.isIncludeFallback() && results.size() < maxResults && externalRecall.isAvailable()) {
            List<RecalledItem> external = externalRecall.recall(options.getQuery(), maxResults - results.size());
            path.add("external: " + DecompressionEngine.plural(external.size(), "result"));
            for (RecalledItem item : external) {
                if (item.relevance() >= minRelevance && results.size() < maxResults) {
                    results.add(item);
                    usedFallback = true;
                }
            }
        }
        log.debug("[Search] advanced '{}': {} results, fallback={}", options.getQuery(), results.size(),
                usedFallback);
        return SearchResult.builder()
                .results(results)
                .path(path)
                .usedFallback(usedFallback)
                .build();
    }

    /**
     * Lexical relevance in [0, 1]. Zero when neither the phrase, a keyword nor a
     * topic matches, whatever the level.
     */
    double score(MemoryItem item, String needle, List<String> keywords) {
        String text = item.getText().toLowerCase(Locale.ROOT);
        double score = 0.0;
        if (text.contains(needle)) {
            score += PHRASE_SCORE;
        }
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                score += KEYWORD_SCORE;
            }
        }
        for (String topic : item.getTopics()) {
            String normalized = topic.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (normalized.contains(keyword)) {
                    score += TOPIC_SCORE;
                    break;
                }
            }
        }
        if (score == 0.0) {
            return 0.0;
        }
        score += Math.max(0, LEVEL_BONUS_CEILING - item.getLevel()) * LEVEL_BONUS;
        return Math.min(1.0, score);
    }

    private List<Integer> levelsToScan(ArchiveStore archive, List<Integer> requested) {
        if (requested != null && !requested.isEmpty()) {
            return requested.stream().distinct().toList();
        }
        List<Integer> levels = new ArrayList<>(archive.populatedLevels());
        levels.sort(Comparator.reverseOrder());
        return levels;
    }

    private static boolean containsIgnoreCase(MemoryItem item, String needle) {
        if (item.getText().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        for (String topic : item.getTopics()) {
            if (topic.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
