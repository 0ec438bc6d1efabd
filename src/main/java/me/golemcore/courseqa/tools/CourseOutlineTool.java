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
import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tool returning a course outline: title, course link and the numbered list of
 * lessons.
 *
 * <p>
 * The requested title may be partial; it is resolved through the content store
 * first. Outlines are navigation aids and carry no sources; only retrieved
 * lesson content is attributed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CourseOutlineTool implements ToolComponent {

    public static final String TOOL_NAME = "get_course_outline";

    private static final String PARAM_COURSE_TITLE = "course_title";

    private final CourseContentPort courseContentPort;
    private final ExecutorService ioExecutor;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Get course outline showing title, link, and all lessons with their numbers and titles")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COURSE_TITLE, Map.of(
                                        "type", "string",
                                        "description",
                                        "Course title (partial matches work, e.g. 'MCP', 'Introduction')")),
                        "required", List.of(PARAM_COURSE_TITLE)))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String courseTitle = ToolArguments.string(parameters, PARAM_COURSE_TITLE);
            if (courseTitle == null || courseTitle.isBlank()) {
                throw new ToolExecutionException("Course title is required");
            }

            Optional<String> resolved = courseContentPort.resolveCourseName(courseTitle);
            if (resolved.isEmpty()) {
                return ToolOutput.text("No course found matching '" + courseTitle + "'");
            }

            String resolvedTitle = resolved.get();
            log.debug("[Tools] get_course_outline '{}' resolved to '{}'", courseTitle, resolvedTitle);
            return courseContentPort.getCourseOutline(resolvedTitle)
                    .map(this::formatOutline)
                    .orElseGet(() -> ToolOutput.text("Course '" + resolvedTitle + "' not found in metadata"));
        }, ioExecutor);
    }

    private ToolOutput formatOutline(CourseOutline course) {
        String title = course.getTitle() != null ? course.getTitle() : "Unknown Course";
        String courseLink = course.getCourseLink();

        List<String> lines = new ArrayList<>();
        lines.add("**" + title + "**");
        if (courseLink != null && !courseLink.isBlank()) {
            lines.add("Course Link: " + courseLink);
        }

        List<CourseOutline.Lesson> lessons = course.getLessons() != null ? course.getLessons() : List.of();
        if (lessons.isEmpty()) {
            lines.add("\nNo lessons found for this course.");
        } else {
            lines.add("\n**Lessons:**");
            lessons.stream()
                    .sorted(Comparator.comparingInt(
                            (CourseOutline.Lesson lesson) -> lesson.getNumber() != null ? lesson.getNumber() : 0))
                    .forEach(lesson -> lines.add(lesson.getNumber() + ". "
                            + (lesson.getTitle() != null ? lesson.getTitle() : "Untitled")));
        }

        return ToolOutput.text(String.join("\n", lines));
    }
}
