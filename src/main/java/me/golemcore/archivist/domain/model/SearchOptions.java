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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parameters of an advanced archive search. Null fields fall back to the
 * configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchOptions {

    private String query;

    /**
     * Levels to scan, in the given order. Empty means every archived level from
     * the highest down to 0.
     */
    private List<Integer> levels;

    private Double minRelevance;
    private Integer maxResults;

    @Builder.Default
    private boolean includeFallback = true;
}
