package me.golemcore.archivist.infrastructure.config;


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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties bound from {@code archivist.*}.
 *
 * <p>
 * Groups:
 * <ul>
 * <li>{@link MemoryProperties} - ledger budget and compaction thresholds</li>
 * <li>{@link SummarizationProperties} - prompts, persona and timeouts</li>
 * <li>{@link LlmProperties} - langchain4j providers</li>
 * <li>{@link ExternalMemoryProperties} - semantic memory fallback service</li>
 * <li>{@link StorageProperties} - snapshot workspace</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "archivist")
@Data
public class ArchivistProperties {

    private MemoryProperties memory = new MemoryProperties();
    private SummarizationProperties summarization = new SummarizationProperties();
    private LlmProperties llm = new LlmProperties();
    private ExternalMemoryProperties externalMemory = new ExternalMemoryProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private SearchProperties search = new SearchProperties();

    @Data
    public static class MemoryProperties {
        private int budgetMax = 10000;
        private int l1Threshold = 5;
        private double hierarchicalThreshold = 0.5;
        /**
         * Most recent raw items never selected for summarization.
         */
        private int protectedRecentRaw = 2;
        private int budgetBlockSize = 3;
        private int maxIngestChars = 20000;
        private int maxTopics = 6;
        private String assistantLabel = "Assistant";
    }

    @Data
    public static class SummarizationProperties {
        private long timeoutMs = 15000;
        private int maxSummaryWords = 150;
        private int maxMergeWords = 80;
        private String persona = "the assistant";
        private String model;
        private double temperature = 0.3;
    }

    @Data
    public static class LlmProperties {
        private String defaultModel = "openai/gpt-4o-mini";
        private long timeoutMs = 60000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class ExternalMemoryProperties {
        private boolean enabled = false;
        private String url = "http://localhost:8765";
        private String apiKey;
        private int timeoutSeconds = 10;
        private int maxResults = 5;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/archivist";
        private String snapshotDirectory = "entities";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class SearchProperties {
        private int defaultMaxLevel = 3;
        private double defaultMinRelevance = 0.1;
        private int defaultMaxResults = 10;
    }
}
