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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry of the hierarchical memory: either a raw conversation turn (level 0)
 * or a summary (level 1..N).
 *
 * <p>
 * Items are immutable. The two variants are {@link RawItem} and
 * {@link SummaryItem}; level-specific fields such as {@code covers} are only
 * accepted by the variant that owns them, so a summary without covers cannot
 * be constructed.
 *
 * <p>
 * Serialized with a {@code kind} discriminator ({@code RAW} or
 * {@code SUMMARY}).
 */
@Getter
@ToString
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RawItem.class, name = "RAW"),
        @JsonSubTypes.Type(value = SummaryItem.class, name = "SUMMARY")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class MemoryItem {

    public enum Kind {
        RAW, SUMMARY
    }

    private final String id;
    private final String text;
    private final int charCount;
    private final List<String> topics;
    private final Instant createdAt;
    private final ItemQuality quality;

    protected MemoryItem(String id, String text, List<String> topics, Instant createdAt, ItemQuality quality) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Memory item id must not be blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("Memory item text must not be null: " + id);
        }
        this.id = id;
        this.text = text;
        this.charCount = text.length();
        this.topics = topics != null ? List.copyOf(new LinkedHashSet<>(topics)) : List.of();
        this.createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        this.quality = quality != null ? quality : ItemQuality.DEFAULT;
    }

    @JsonIgnore
    public abstract Kind getKind();

    public abstract int getLevel();

    /**
     * Ids this item was produced from, empty for raw items.
     */
    public abstract List<String> getCovers();

    @JsonIgnore
    public boolean isSummary() {
        return getKind() == Kind.SUMMARY;
    }

    @JsonIgnore
    public boolean isRaw() {
        return getKind() == Kind.RAW;
    }

    protected static List<String> copyCovers(List<String> covers) {
        if (covers == null) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(new LinkedHashSet<>(covers));
        copy.removeIf(id -> id == null || id.isBlank());
        return List.copyOf(copy);
    }
}
