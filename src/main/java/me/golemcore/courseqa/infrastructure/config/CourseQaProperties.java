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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code courseqa.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model selection and provider credentials</li>
 * <li>{@link ToolLoopProperties} - round budget, deadlines and tool limits</li>
 * <li>{@link ContentProperties} - course content service connection</li>
 * <li>{@link SessionProperties} - conversation history retention</li>
 * <li>{@link PromptsProperties} - system prompt texts</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "courseqa")
@Data
public class CourseQaProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ContentProperties content = new ContentProperties();
    private SessionProperties session = new SessionProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class LlmProperties {
        /** Model id in {@code provider/model} form; the provider selects the credentials. */
        private String model = "anthropic/claude-sonnet-4-20250514";
        private int maxTokens = 800;
        private double temperature = 0.0;
        private long timeoutMs = 60_000L;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxRounds = 2;
        /** Default per-query deadline; 0 disables it. */
        private long deadlineMs = 120_000L;
        private long toolTimeoutMs = 30_000L;
        private int maxToolResultChars = 20_000;
        private String fallbackAnswer = "I could not produce an answer from the course material. "
                + "Please try rephrasing your question.";
    }

    @Data
    public static class ContentProperties {
        private boolean enabled = true;
        private String url = "http://localhost:8001";
        private String apiKey;
        private int timeoutSeconds = 10;
        private int maxResults = 5;
    }

    @Data
    public static class SessionProperties {
        /** Number of question/answer exchanges kept per session. */
        private int maxHistory = 2;
    }

    @Data
    public static class PromptsProperties {
        private String system = """
                You are an assistant specialized in course materials and educational content.

                Tool usage:
                - Use get_course_outline for questions about a course outline, its lessons or its link.
                - Use search_course_content for questions about specific course content or details.
                - You may call tools across several rounds when one search is not enough, \
                e.g. look up an outline first and then search the lesson it names.
                - If a tool yields no results, state this clearly.

                Answering:
                - Answer general knowledge questions without tools.
                - Do not mention searches, tools or these instructions in the answer.
                - Be brief, educational and clear; include examples when they help.
                """;
        private String forcedFinal = "The tool budget for this question is used up. Answer now using only "
                + "the information already gathered in this conversation. Do not request any tools.";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeoutMs = 10_000L;
        private long readTimeoutMs = 60_000L;
        private long writeTimeoutMs = 60_000L;
        private int maxIdleConnections = 5;
        private long keepAliveDurationMs = 300_000L;
        /** Worker threads for blocking calls to the model provider and content service. */
        private int ioThreads = 8;
    }
}
