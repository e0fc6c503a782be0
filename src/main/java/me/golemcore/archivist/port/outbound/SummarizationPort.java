package me.golemcore.archivist.port.outbound;


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

import me.golemcore.archivist.domain.model.MemoryItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Abstractive summarization backend used by compaction.
 *
 * <p>
 * Implementations must not mutate the given items. A failed or unusable
 * generation completes the future exceptionally; an empty string is never a
 * valid result.
 */
public interface SummarizationPort {

    /**
     * Produces a bounded-length summary of consecutive items, written from the
     * persona's point of view and naming {@code speakerLabel}.
     */
    CompletableFuture<String> summarize(List<MemoryItem> items, String speakerLabel);

    /**
     * Produces a shorter synthesis of same-level summaries for
     * {@code targetLevel}.
     */
    CompletableFuture<String> merge(List<MemoryItem> summaries, int targetLevel, String speakerLabel);
}
