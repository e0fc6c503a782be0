package me.golemcore.archivist;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hierarchical conversation memory service.
 *
 * <p>
 * Keeps a bounded active context per conversational entity, compacts old turns
 * into layered summaries through an LLM and archives every level so that
 * detail can be recovered or searched later.
 *
 * <pre>
 * Inbound        → MemoryController
 * Domain         → ConversationMemoryRegistry, policy/decompression/search engines
 * Infrastructure → langchain4j, external memory over OkHttp, local snapshots
 * </pre>
 */
@SpringBootApplication
public class ArchivistApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchivistApplication.class, args);
    }
}
