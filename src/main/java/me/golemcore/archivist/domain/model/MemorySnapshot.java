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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable state of one entity: active ledger plus full archive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemorySnapshot {

    public static final int SCHEMA_VERSION = 1;

    @Builder.Default
    private int schemaVersion = SCHEMA_VERSION;

    private String entityId;
    private Instant exportedAt;

    private int budgetMax;
    private int l1Threshold;
    private double hierarchicalThreshold;

    @Builder.Default
    private List<MemoryItem> ledger = new ArrayList<>();

    @Builder.Default
    private Map<Integer, List<MemoryItem>> archive = new LinkedHashMap<>();
}
