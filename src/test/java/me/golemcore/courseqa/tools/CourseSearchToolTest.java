package me.golemcore.courseqa.tools;

import me.golemcore.courseqa.domain.component.ToolExecutionException;
import me.golemcore.courseqa.domain.model.SearchHit;
import me.golemcore.courseqa.domain.model.SearchResults;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CourseSearchToolTest {

    private static final String COURSE = "Introduction to MCP";

    private CourseContentPort contentPort;
    private ExecutorService executor;
    private CourseSearchTool tool;

    @BeforeEach
    void setUp() {
        contentPort = mock(CourseContentPort.class);
        executor = Executors.newSingleThreadExecutor();
        tool = new CourseSearchTool(contentPort, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldExposeDefinitionWithRequiredQuery() {
        var definition = tool.getDefinition();

        assertEquals("search_course_content", definition.getName());
        assertEquals("search_course_content", tool.getToolName());
        assertEquals(List.of("query"), definition.getInputSchema().get("required"));
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) definition.getInputSchema().get("properties");
        assertTrue(properties.containsKey("course_name"));
        assertTrue(properties.containsKey("lesson_number"));
    }

    @Test
    void shouldFormatHitsWithHeadersAndSources() throws Exception {
        when(contentPort.search("servers", "MCP", null)).thenReturn(SearchResults.of(List.of(
                new SearchHit("Servers expose tools.", COURSE, 1),
                new SearchHit("Overview text.", COURSE, null))));
        when(contentPort.getLessonLink(COURSE, 1)).thenReturn(Optional.of("https://learn.example.com/mcp/1"));

        ToolOutput output = tool.execute(Map.of("query", "servers", "course_name", "MCP")).get();

        assertEquals("[Introduction to MCP - Lesson 1]\nServers expose tools.\n\n"
                + "[Introduction to MCP]\nOverview text.", output.content());
        assertEquals(List.of(
                Source.of("Introduction to MCP - Lesson 1", "https://learn.example.com/mcp/1"),
                Source.of("Introduction to MCP", null)), output.attributions());
        verify(contentPort, never()).getLessonLink(COURSE, 0);
    }

    @Test
    void shouldAcceptLessonNumberAsString() throws Exception {
        when(contentPort.search("q", null, 3)).thenReturn(SearchResults.of(List.of()));

        ToolOutput output = tool.execute(Map.of("query", "q", "lesson_number", "3")).get();

        assertEquals("No relevant content found in lesson 3.", output.content());
    }

    @Test
    void shouldDescribeFiltersWhenNothingFound() throws Exception {
        when(contentPort.search(any(), any(), any())).thenReturn(SearchResults.of(List.of()));

        assertEquals("No relevant content found.", tool.execute(Map.of("query", "q")).get().content());
        assertEquals("No relevant content found in course 'MCP' in lesson 2.",
                tool.execute(Map.of("query", "q", "course_name", "MCP", "lesson_number", 2)).get().content());
    }

    @Test
    void shouldReturnStoreErrorAsText() throws Exception {
        when(contentPort.search(any(), any(), any())).thenReturn(SearchResults.error("No course found matching 'X'"));

        ToolOutput output = tool.execute(Map.of("query", "q", "course_name", "X")).get();

        assertEquals("No course found matching 'X'", output.content());
        assertTrue(output.attributions().isEmpty());
    }

    @Test
    void shouldNotLookUpLinksForUnknownCourse() throws Exception {
        when(contentPort.search(any(), any(), any())).thenReturn(SearchResults.of(List.of(
                new SearchHit("orphan chunk", null, 4))));

        ToolOutput output = tool.execute(Map.of("query", "q")).get();

        assertEquals("[unknown - Lesson 4]\norphan chunk", output.content());
        verify(contentPort, never()).getLessonLink(any(), anyInt());
    }

    @Test
    void shouldFailWithoutQuery() {
        Map<String, Object> params = new HashMap<>();
        params.put("course_name", "MCP");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> tool.execute(params).get());

        assertInstanceOf(ToolExecutionException.class, ex.getCause());
    }

    @Test
    void shouldQueryContentStoreOnSuppliedExecutor() throws Exception {
        Thread workerThread = executor.submit(Thread::currentThread).get();
        AtomicReference<Thread> searchThread = new AtomicReference<>();
        when(contentPort.search(any(), any(), any())).thenAnswer(invocation -> {
            searchThread.set(Thread.currentThread());
            return SearchResults.of(List.of());
        });

        tool.execute(Map.of("query", "tool use")).get();

        assertSame(workerThread, searchThread.get());
    }
}
