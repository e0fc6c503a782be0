package me.golemcore.archivist.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Item returned by decompression or search. Unlike {@link MemoryItem} it may
 * be a synthetic placeholder or an external memory hit. Both are tagged
 * {@link Source#FALLBACK}; external hits sit at {@link #EXTERNAL_LEVEL}.
 */
@Builder(toBuilder = true)
public record RecalledItem(String id, int level, String text, List<String> topics, List<String> covers,
        Instant createdAt, double relevance, Source source) {

    /**
     * Level used for hits returned by the external memory service.
     */
    public static final int EXTERNAL_LEVEL = -1;

    public enum Source {
        LOCAL, FALLBACK
    }

    public RecalledItem {
        topics = topics != null ? List.copyOf(topics) : List.of();
        covers = covers != null ? List.copyOf(covers) : List.of();
        source = source != null ? source : Source.LOCAL;
    }

    public static RecalledItem of(MemoryItem item) {
        return RecalledItem.builder()
                .id(item.getId())
                .level(item.getLevel())
                .text(item.getText())
                .topics(item.getTopics())
                .covers(item.getCovers())
                .createdAt(item.getCreatedAt())
                .relevance(0.0)
                .source(Source.LOCAL)
                .build();
    }

    public boolean isFallback() {
        return source != Source.LOCAL;
    }
}
