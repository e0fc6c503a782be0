package me.golemcore.archivist.adapter.outbound.memory;


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
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.ExternalMemoryPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * External semantic memory over HTTP.
 *
 * <p>
 * Calls {@code POST {url}/search} with {@code {"query", "limit"}} and accepts
 * {@code {"results": [{"id", "memory" | "content", "score"}]}}. A bare JSON
 * array of the same objects is accepted too.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code archivist.external-memory.enabled}</li>
 * <li>{@code archivist.external-memory.url}</li>
 * <li>{@code archivist.external-memory.api-key} - optional bearer token</li>
 * <li>{@code archivist.external-memory.timeout-seconds}</li>
 * </ul>
 */
@Component
@Slf4j
public class RemoteMemoryAdapter implements ExternalMemoryPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final ArchivistProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemoteMemoryAdapter(ArchivistProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getExternalMemory().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<List<ExternalMemoryHit>> search(String query, int limit) {
        if (!isAvailable() || query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                String url = trimTrailingSlash(properties.getExternalMemory().getUrl()) + "/search";
                String body = objectMapper.writeValueAsString(new SearchRequest(query, limit));

                Request.Builder requestBuilder = new Request.Builder()
                        .url(url)
                        .post(RequestBody.create(body, JSON));
                addApiKeyHeader(requestBuilder);

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    ResponseBody responseBody = response.body();
                    if (!response.isSuccessful() || responseBody == null) {
                        log.warn("[ExternalMemory] Search failed: HTTP {}", response.code());
                        return List.<ExternalMemoryHit>of();
                    }
                    return parseResults(responseBody.string(), limit);
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("[ExternalMemory] Search error: {}", e.getMessage());
                return List.<ExternalMemoryHit>of();
            }
        });
    }

    @Override
    public boolean isAvailable() {
        ArchivistProperties.ExternalMemoryProperties config = properties.getExternalMemory();
        return config.isEnabled() && config.getUrl() != null && !config.getUrl().isBlank();
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getExternalMemory().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private List<ExternalMemoryHit> parseResults(String responseBody, int limit) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode results = root != null && root.isArray() ? root : root != null ? root.path("results") : null;
        if (results == null || !results.isArray()) {
            log.debug("[ExternalMemory] Response has no results array");
            return List.of();
        }
        List<ExternalMemoryHit> hits = new ArrayList<>();
        for (JsonNode node : results) {
            if (hits.size() >= limit) {
                break;
            }
            String content = node.hasNonNull("memory")
                    ? node.get("memory").asText()
                    : node.path("content").asText("");
            if (content.isBlank()) {
                continue;
            }
            String id = node.hasNonNull("id") ? node.get("id").asText() : null;
            hits.add(new ExternalMemoryHit(id, content, node.path("score").asDouble(0.0)));
        }
        return hits;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    record SearchRequest(String query, int limit) {
    }
}
