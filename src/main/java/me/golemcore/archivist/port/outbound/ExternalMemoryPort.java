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

import me.golemcore.archivist.domain.model.ExternalMemoryHit;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Semantic memory service consulted when the local archive cannot answer a
 * decompression or search. Hits are ranked by the service, best first.
 *
 * <p>
 * Implementations report failures by completing with an empty list.
 */
public interface ExternalMemoryPort {

    CompletableFuture<List<ExternalMemoryHit>> search(String query, int limit);

    boolean isAvailable();
}
