package me.golemcore.courseqa.tools;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.component.ToolComponent;
import me.golemcore.courseqa.domain.component.ToolExecutionException;
import me.golemcore.courseqa.domain.model.SearchHit;
import me.golemcore.courseqa.domain.model.SearchResults;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tool for searching course content with course name matching and lesson
 * filtering.
 *
 * <p>
 * Each matched chunk is rendered under a {@code [Course - Lesson N]} header and
 * reported as a source, linked to the lesson when the content store knows the
 * lesson link. Store errors and empty results are returned as plain text so the
 * model can react to them; they carry no sources.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CourseSearchTool implements ToolComponent {

    public static final String TOOL_NAME = "search_course_content";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COURSE_NAME = "course_name";
    private static final String PARAM_LESSON_NUMBER = "lesson_number";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String UNKNOWN_COURSE = "unknown";

    private final CourseContentPort courseContentPort;
    private final ExecutorService ioExecutor;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Search course materials with smart course name matching and lesson filtering")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "What to search for in the course content"),
                                PARAM_COURSE_NAME, Map.of(
                                        "type", TYPE_STRING,
                                        "description",
                                        "Course title (partial matches work, e.g. 'MCP', 'Introduction')"),
                                PARAM_LESSON_NUMBER, Map.of(
                                        "type", TYPE_INTEGER,
                                        "description", "Specific lesson number to search within (e.g. 1, 2, 3)")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String query = ToolArguments.string(parameters, PARAM_QUERY);
            if (query == null || query.isBlank()) {
                throw new ToolExecutionException("Search query is required");
            }
            String courseName = ToolArguments.string(parameters, PARAM_COURSE_NAME);
            Integer lessonNumber = ToolArguments.integer(parameters, PARAM_LESSON_NUMBER);

            log.debug("[Tools] search_course_content query='{}', course={}, lesson={}", query, courseName,
                    lessonNumber);
            SearchResults results = courseContentPort.search(query, courseName, lessonNumber);

            if (results.hasError()) {
                return ToolOutput.text(results.error());
            }
            if (results.isEmpty()) {
                return ToolOutput.text(noResultsMessage(courseName, lessonNumber));
            }
            return formatResults(results);
        }, ioExecutor);
    }

    private String noResultsMessage(String courseName, Integer lessonNumber) {
        StringBuilder filterInfo = new StringBuilder();
        if (courseName != null && !courseName.isBlank()) {
            filterInfo.append(" in course '").append(courseName).append('\'');
        }
        if (lessonNumber != null) {
            filterInfo.append(" in lesson ").append(lessonNumber);
        }
        return "No relevant content found" + filterInfo + ".";
    }

    private ToolOutput formatResults(SearchResults results) {
        List<String> blocks = new ArrayList<>();
        List<Source> sources = new ArrayList<>();

        for (SearchHit hit : results.hits()) {
            String courseTitle = hit.courseTitle() != null ? hit.courseTitle() : UNKNOWN_COURSE;
            Integer lessonNumber = hit.lessonNumber();

            String label = lessonNumber != null ? courseTitle + " - Lesson " + lessonNumber : courseTitle;

            String link = null;
            if (lessonNumber != null && !UNKNOWN_COURSE.equals(courseTitle)) {
                link = courseContentPort.getLessonLink(courseTitle, lessonNumber).orElse(null);
            }

            sources.add(Source.of(label, link));
            blocks.add("[" + label + "]\n" + hit.content());
        }

        return ToolOutput.attributed(String.join("\n\n", blocks), sources);
    }
}
