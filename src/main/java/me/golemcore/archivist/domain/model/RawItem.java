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
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Unsummarized conversation turn, always level 0.
 */
@Getter
@ToString(callSuper = true)
public final class RawItem extends MemoryItem {

    private final ItemRole role;
    private final String speaker;

    @Builder
    @JsonCreator
    public RawItem(
            @JsonProperty("id") String id,
            @JsonProperty("text") String text,
            @JsonProperty("topics") List<String> topics,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("quality") ItemQuality quality,
            @JsonProperty("role") ItemRole role,
            @JsonProperty("speaker") String speaker) {
        super(id, text, topics, createdAt, quality);
        this.role = role != null ? role : ItemRole.USER;
        this.speaker = speaker;
    }

    @Override
    public Kind getKind() {
        return Kind.RAW;
    }

    @Override
    public int getLevel() {
        return 0;
    }

    @Override
    public List<String> getCovers() {
        return List.of();
    }
}
