package me.golemcore.courseqa.adapter.outbound.content;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.SearchHit;
import me.golemcore.courseqa.domain.model.SearchResults;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import okhttp3.HttpUrl;
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
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Course content adapter: talks to the course content service over HTTP.
 *
 * <p>
 * The content service owns document ingestion, chunking, embeddings and vector
 * search. This adapter uses OkHttp to call its REST API.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /search - Semantic search with optional course and lesson filters
 * <li>GET /courses/resolve?name= - Resolve a partial course name
 * <li>GET /courses/lesson-link?title=&amp;lesson= - Link of one lesson
 * <li>GET /courses/outline?title= - Course metadata with lessons
 * <li>GET /courses - Titles of all courses
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code courseqa.content.enabled} - Enable/disable the content service
 * <li>{@code courseqa.content.url} - Content service base URL
 * <li>{@code courseqa.content.api-key} - Optional API key
 * <li>{@code courseqa.content.max-results} - Max chunks per search
 * <li>{@code courseqa.content.timeout-seconds} - HTTP timeout
 * </ul>
 *
 * @see me.golemcore.courseqa.port.outbound.CourseContentPort
 */
@Component
@Slf4j
public class HttpCourseContentAdapter implements CourseContentPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final CourseQaProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpCourseContentAdapter(CourseQaProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        // Dedicated client with content-service timeout
        int timeoutSeconds = properties.getContent().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public SearchResults search(String query, String courseName, Integer lessonNumber) {
        if (!isAvailable()) {
            return SearchResults.error("Course content search is not available");
        }

        try {
            String body = objectMapper.writeValueAsString(new SearchRequest(query, courseName, lessonNumber,
                    properties.getContent().getMaxResults()));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint("search").build())
                    .post(RequestBody.create(body, JSON));
            addApiKeyHeader(requestBuilder);

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("[Content] Search failed: HTTP {}", response.code());
                    return SearchResults.error("Search error: content service returned HTTP " + response.code());
                }
                return parseSearchResponse(responseBody.string());
            }
        } catch (IOException e) {
            log.warn("[Content] Search error: {}", e.getMessage());
            return SearchResults.error("Search error: " + e.getMessage());
        }
    }

    @Override
    public Optional<String> resolveCourseName(String courseName) {
        if (courseName == null || courseName.isBlank()) {
            return Optional.empty();
        }
        HttpUrl url = endpoint("courses/resolve").addQueryParameter("name", courseName).build();
        return getJson(url).map(node -> textOrNull(node, "title"));
    }

    @Override
    public Optional<String> getLessonLink(String courseTitle, int lessonNumber) {
        HttpUrl url = endpoint("courses/lesson-link")
                .addQueryParameter("title", courseTitle)
                .addQueryParameter("lesson", String.valueOf(lessonNumber))
                .build();
        return getJson(url).map(node -> textOrNull(node, "link"));
    }

    @Override
    public Optional<CourseOutline> getCourseOutline(String courseTitle) {
        HttpUrl url = endpoint("courses/outline").addQueryParameter("title", courseTitle).build();
        return getJson(url).map(this::parseOutline);
    }

    @Override
    public List<String> getAllCourseTitles() {
        Optional<JsonNode> node = getJson(endpoint("courses").build());
        List<String> titles = new ArrayList<>();
        node.map(n -> n.path("titles")).ifPresent(array -> array.forEach(title -> {
            if (title.isTextual() && !title.asText().isBlank()) {
                titles.add(title.asText());
            }
        }));
        return titles;
    }

    public boolean isAvailable() {
        return properties.getContent().isEnabled();
    }

    /**
     * Check health of the content service (for diagnostics, not called on every
     * request).
     */
    public boolean isHealthy() {
        if (!isAvailable()) {
            return false;
        }
        try {
            Request request = new Request.Builder().url(endpoint("health").build()).get().build();
            try (Response response = httpClient.newCall(request).execute()) {
                return response.isSuccessful();
            }
        } catch (IOException e) {
            log.debug("[Content] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    private Optional<JsonNode> getJson(HttpUrl url) {
        if (!isAvailable()) {
            return Optional.empty();
        }
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful() || responseBody == null) {
                log.warn("[Content] GET {} failed: HTTP {}", url.encodedPath(), response.code());
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(responseBody.string()));
        } catch (IOException e) {
            log.warn("[Content] GET {} error: {}", url.encodedPath(), e.getMessage());
            return Optional.empty();
        }
    }

    private HttpUrl.Builder endpoint(String path) {
        HttpUrl base = HttpUrl.parse(properties.getContent().getUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid courseqa.content.url: " + properties.getContent().getUrl());
        }
        return base.newBuilder().addPathSegments(path);
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getContent().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private SearchResults parseSearchResponse(String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        String error = textOrNull(root, "error");
        if (error != null && !error.isBlank()) {
            return SearchResults.error(error);
        }

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode item : root.path("results")) {
            String content = textOrNull(item, "content");
            if (content == null) {
                continue;
            }
            JsonNode lesson = item.path("lesson_number");
            Integer lessonNumber = lesson.canConvertToInt() ? lesson.asInt() : null;
            hits.add(new SearchHit(content, textOrNull(item, "course_title"), lessonNumber));
        }
        return SearchResults.of(hits);
    }

    private CourseOutline parseOutline(JsonNode node) {
        List<CourseOutline.Lesson> lessons = new ArrayList<>();
        for (JsonNode lesson : node.path("lessons")) {
            JsonNode number = lesson.path("lesson_number");
            lessons.add(CourseOutline.Lesson.builder()
                    .number(number.canConvertToInt() ? number.asInt() : null)
                    .title(textOrNull(lesson, "lesson_title"))
                    .link(textOrNull(lesson, "lesson_link"))
                    .build());
        }
        return CourseOutline.builder()
                .title(textOrNull(node, "title"))
                .courseLink(textOrNull(node, "course_link"))
                .instructor(textOrNull(node, "instructor"))
                .lessons(lessons)
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SearchRequest(String query,
            @JsonProperty("course_name") String courseName,
            @JsonProperty("lesson_number") Integer lessonNumber,
            int limit) {
    }
}
