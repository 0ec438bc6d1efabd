package me.golemcore.courseqa.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.adapter.outbound.content.HttpCourseContentAdapter;
import me.golemcore.courseqa.domain.service.ToolRegistry;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup diagnostics.
 *
 * <p>
 * Logs the configured model, round budget and registered tools on startup, and
 * warns when the model provider has no credentials or the content service does
 * not answer its health check.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CourseQaProperties properties;
    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final HttpCourseContentAdapter contentAdapter;

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
        log.info("Course Q&A assistant starting...");
        log.info("Model: {} via {}", llmPort.getCurrentModel(), llmPort.getProviderId());
        log.info("Max tool rounds: {}, deadline: {}ms", properties.getToolLoop().getMaxRounds(),
                properties.getToolLoop().getDeadlineMs());
        log.info("Content service: {} (enabled: {})", properties.getContent().getUrl(),
                properties.getContent().isEnabled());
        if (contentAdapter.isAvailable() && !contentAdapter.isHealthy()) {
            log.warn("Content service at {} is not reachable, course tools will report errors",
                    properties.getContent().getUrl());
        }
        log.info("Registered tools: {}", toolRegistry.getToolNames());
        if (!llmPort.isAvailable()) {
            log.warn("No API key configured for model {}, queries will fail", llmPort.getCurrentModel());
        }
    }
}
