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

import me.golemcore.archivist.port.outbound.ExternalMemoryPort;
import me.golemcore.archivist.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared beans and startup diagnostics.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ArchivistProperties properties;
    private final LlmPort llmPort;
    private final ExternalMemoryPort externalMemoryPort;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        ArchivistProperties.MemoryProperties memory = properties.getMemory();
        log.info("GolemCore Archivist starting...");
        log.info("Budget: {} chars, L1 threshold: {}, hierarchical threshold: {}",
                memory.getBudgetMax(), memory.getL1Threshold(), memory.getHierarchicalThreshold());
        log.info("Summarization model: {} (available: {})", llmPort.getCurrentModel(), llmPort.isAvailable());
        log.info("External memory: {}", externalMemoryPort.isAvailable()
                ? properties.getExternalMemory().getUrl()
                : "disabled");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
    }
}
