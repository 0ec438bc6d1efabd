package me.golemcore.courseqa.tools;

import me.golemcore.courseqa.domain.component.ToolExecutionException;
import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CourseOutlineToolTest {

    private static final String TITLE = "Building Towards Computer Use with Anthropic";
    private static final String COURSE_LINK = "https://learn.example.com/computer-use";

    private CourseContentPort contentPort;
    private ExecutorService executor;
    private CourseOutlineTool tool;

    @BeforeEach
    void setUp() {
        contentPort = mock(CourseContentPort.class);
        executor = Executors.newSingleThreadExecutor();
        tool = new CourseOutlineTool(contentPort, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldFormatOutlineWithLessonsSortedByNumber() throws Exception {
        when(contentPort.resolveCourseName("Computer Use")).thenReturn(Optional.of(TITLE));
        when(contentPort.getCourseOutline(TITLE)).thenReturn(Optional.of(CourseOutline.builder()
                .title(TITLE)
                .courseLink(COURSE_LINK)
                .lessons(List.of(
                        CourseOutline.Lesson.builder().number(2).title("Tool Use").build(),
                        CourseOutline.Lesson.builder().number(0).title("Introduction").build(),
                        CourseOutline.Lesson.builder().number(1).title("API Basics").build()))
                .build()));

        ToolOutput output = tool.execute(Map.of("course_title", "Computer Use")).get();

        assertEquals("**" + TITLE + "**\n"
                + "Course Link: " + COURSE_LINK + "\n"
                + "\n**Lessons:**\n"
                + "0. Introduction\n"
                + "1. API Basics\n"
                + "2. Tool Use", output.content());
        assertTrue(output.attributions().isEmpty());
    }

    @Test
    void shouldReportCourseWithoutLessons() throws Exception {
        when(contentPort.resolveCourseName(any())).thenReturn(Optional.of(TITLE));
        when(contentPort.getCourseOutline(TITLE)).thenReturn(Optional.of(CourseOutline.builder()
                .title(TITLE)
                .lessons(List.of())
                .build()));

        ToolOutput output = tool.execute(Map.of("course_title", "Computer")).get();

        assertEquals("**" + TITLE + "**\n\nNo lessons found for this course.", output.content());
        assertTrue(output.attributions().isEmpty());
    }

    @Test
    void shouldReportUnresolvedCourse() throws Exception {
        when(contentPort.resolveCourseName("Cooking")).thenReturn(Optional.empty());

        ToolOutput output = tool.execute(Map.of("course_title", "Cooking")).get();

        assertEquals("No course found matching 'Cooking'", output.content());
        assertTrue(output.attributions().isEmpty());
        verify(contentPort, never()).getCourseOutline(any());
    }

    @Test
    void shouldReportMissingMetadata() throws Exception {
        when(contentPort.resolveCourseName(any())).thenReturn(Optional.of(TITLE));
        when(contentPort.getCourseOutline(TITLE)).thenReturn(Optional.empty());

        ToolOutput output = tool.execute(Map.of("course_title", "Computer")).get();

        assertEquals("Course '" + TITLE + "' not found in metadata", output.content());
    }

    @Test
    void shouldFailWithoutTitle() {
        ExecutionException ex = assertThrows(ExecutionException.class, () -> tool.execute(Map.of()).get());

        assertInstanceOf(ToolExecutionException.class, ex.getCause());
    }
}
