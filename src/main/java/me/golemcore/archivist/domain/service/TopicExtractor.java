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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Frequency-based keyword extraction used to tag memory items and to split
 * search queries into keywords.
 *
 * <p>
 * Words longer than {@value #CONCEPT_MIN_LENGTH} characters count as concepts
 * and are preferred; when fewer than {@value #MIN_CONCEPTS} concepts exist the
 * most frequent remaining words fill the list.
 */
@Component
public class TopicExtractor {

    private static final int TOPIC_MIN_LENGTH = 4;
    private static final int CONCEPT_MIN_LENGTH = 7;
    private static final int MAX_CONCEPTS = 4;
    private static final int MIN_CONCEPTS = 3;
    private static final int KEYWORD_MIN_LENGTH = 3;
    private static final int MAX_KEYWORDS = 5;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final Set<String> STOP_WORDS = Set.of(
            // en
            "the", "and", "for", "with", "that", "this", "these", "those", "from", "into", "about",
            "what", "when", "where", "which", "while", "who", "whom", "why", "how", "are", "was",
            "were", "been", "being", "have", "has", "had", "but", "not", "you", "your", "they",
            "them", "their", "there", "then", "than", "also", "just", "very", "some", "more",
            "most", "much", "will", "would", "could", "should", "can", "did", "does", "our",
            // fr
            "comme", "sont", "plus", "pour", "avec", "dans", "sur", "par", "que", "qui", "quoi",
            "comment", "pourquoi", "quand", "où", "donc", "mais", "alors", "aussi", "bien",
            "très", "tout", "tous", "toute", "toutes", "cette", "ces", "cet", "ceux", "celles",
            "les", "des", "une", "est", "cependant", "néanmoins");

    /**
     * Extracts at most {@code maxTopics} distinct topics from the given texts.
     */
    public List<String> extract(Collection<String> texts, int maxTopics) {
        if (texts == null || texts.isEmpty() || maxTopics <= 0) {
            return List.of();
        }
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String text : texts) {
            for (String word : tokenize(text)) {
                if (word.length() >= TOPIC_MIN_LENGTH && !STOP_WORDS.contains(word)
                        && !NUMBER.matcher(word).matches()) {
                    frequencies.merge(word, 1, Integer::sum);
                }
            }
        }
        if (frequencies.isEmpty()) {
            return List.of();
        }

        List<String> byFrequency = sortByFrequency(frequencies);
        Set<String> topics = new LinkedHashSet<>();
        int conceptLimit = Math.min(MAX_CONCEPTS, maxTopics);
        for (String word : byFrequency) {
            if (topics.size() >= conceptLimit) {
                break;
            }
            if (word.length() >= CONCEPT_MIN_LENGTH) {
                topics.add(word);
            }
        }
        if (topics.size() < MIN_CONCEPTS) {
            for (String word : byFrequency) {
                if (topics.size() >= maxTopics) {
                    break;
                }
                topics.add(word);
            }
        }
        return List.copyOf(topics);
    }

    /**
     * Significant words of a search query, in query order.
     */
    public List<String> keywords(String query) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : tokenize(query)) {
            if (keywords.size() >= MAX_KEYWORDS) {
                break;
            }
            if (word.length() >= KEYWORD_MIN_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return List.copyOf(keywords);
    }

    /**
     * Union of topic lists preserving first occurrence, capped at
     * {@code maxTopics}.
     */
    public List<String> union(Collection<? extends Collection<String>> topicLists, int maxTopics) {
        Set<String> merged = new LinkedHashSet<>();
        for (Collection<String> topics : topicLists) {
            for (String topic : topics) {
                if (merged.size() >= maxTopics) {
                    return List.copyOf(merged);
                }
                merged.add(topic);
            }
        }
        return List.copyOf(merged);
    }

    private List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(cleaned));
    }

    private static List<String> sortByFrequency(Map<String, Integer> frequencies) {
        // stable sort keeps first-seen order among equal counts
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(frequencies.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> words = new ArrayList<>(entries.size());
        for (Map.Entry<String, Integer> entry : entries) {
            words.add(entry.getKey());
        }
        return words;
    }
}
