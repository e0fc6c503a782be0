package me.golemcore.archivist.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Abstractive synthesis of lower-level items. Level is at least 1 and covers
 * is never empty.
 */
@ToString(callSuper = true)
public final class SummaryItem extends MemoryItem {

    private final int level;
    private final List<String> covers;

    @Builder
    @JsonCreator
    public SummaryItem(
            @JsonProperty("id") String id,
            @JsonProperty("level") int level,
            @JsonProperty("text") String text,
            @JsonProperty("topics") List<String> topics,
            @JsonProperty("covers") List<String> covers,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("quality") ItemQuality quality) {
        super(id, text, topics, createdAt, quality);
        if (level < 1) {
            throw new IllegalArgumentException("Summary level must be >= 1, got " + level + " for " + id);
        }
        List<String> normalizedCovers = copyCovers(covers);
        if (normalizedCovers.isEmpty()) {
            throw new IllegalArgumentException("Summary must cover at least one item: " + id);
        }
        this.level = level;
        this.covers = normalizedCovers;
    }

    @Override
    public Kind getKind() {
        return Kind.SUMMARY;
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public List<String> getCovers() {
        return covers;
    }
}
