package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.component.ToolComponent;
import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.Message;
import me.golemcore.courseqa.domain.model.ModelRequest;
import me.golemcore.courseqa.domain.model.ModelResponse;
import me.golemcore.courseqa.domain.model.SearchHit;
import me.golemcore.courseqa.domain.model.SearchResults;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.model.ToolInvocationRequest;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.domain.model.ToolResult;
import me.golemcore.courseqa.domain.service.SourceAggregator;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.domain.service.ToolRegistry;
import me.golemcore.courseqa.domain.system.toolloop.view.DefaultConversationViewBuilder;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import me.golemcore.courseqa.port.outbound.LlmPort;
import me.golemcore.courseqa.testsupport.tools.StubTool;
import me.golemcore.courseqa.tools.CourseOutlineTool;
import me.golemcore.courseqa.tools.CourseSearchTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultRoundControllerTest {

    private static final String OUTLINE_TOOL = "get_course_outline";
    private static final String SEARCH_TOOL = "search_course_content";
    private static final String QUERY = "What does lesson 4 of course X cover, and where else is it taught?";
    private static final Source LESSON_SOURCE = Source.of("Course Y, Lesson 2", "https://learn.example.com/y/2");

    @Mock
    private LlmPort llmPort;

    private StubTool outlineTool;
    private StubTool searchTool;
    private CourseQaProperties properties;
    private Clock clock;
    private DefaultRoundController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        properties = new CourseQaProperties();
        properties.getToolLoop().setFallbackAnswer("FALLBACK");

        outlineTool = StubTool.returning(OUTLINE_TOOL, ToolOutput.text("lesson4: Recursion"));
        searchTool = StubTool.returning(SEARCH_TOOL,
                ToolOutput.attributed("Recursion is a function calling itself.", List.of(LESSON_SOURCE)));
        controller = controllerWith(outlineTool, searchTool);
    }

    private DefaultRoundController controllerWith(ToolComponent... tools) {
        ToolRegistry registry = new ToolRegistry(List.of(tools));
        return new DefaultRoundController(llmPort, registry, new ToolDispatcher(registry, properties),
                new SourceAggregator(), new DefaultConversationViewBuilder(properties.getPrompts()),
                properties.getLlm(), properties.getToolLoop(), clock);
    }

    private static CompletableFuture<ModelResponse> finalAnswer(String text) {
        return CompletableFuture.completedFuture(ModelResponse.finalAnswer(text));
    }

    private static CompletableFuture<ModelResponse> toolCall(String id, String tool, Map<String, Object> args) {
        return CompletableFuture.completedFuture(ModelResponse.toolRequest(
                List.of(new ToolInvocationRequest(id, tool, args)), "raw-" + id, null));
    }

    private List<ModelRequest> captureRequests(int expectedCalls) {
        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(llmPort, times(expectedCalls)).chat(captor.capture());
        return captor.getAllValues();
    }

    // ==================== Direct answers ====================

    @Test
    void shouldReturnDirectAnswerWithSingleModelCall() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("Paris"));

        RoundControllerResult result = controller.run("Capital of France?", null, 2, null);

        assertEquals("Paris", result.text());
        assertTrue(result.sources().isEmpty());
        assertEquals(1, result.modelCalls());
        assertEquals(0, result.roundsExecuted());
        assertFalse(result.forcedFinal());
        assertTrue(outlineTool.getInvocations().isEmpty());
    }

    @Test
    void shouldAdvertiseRegisteredToolsWhileBudgetRemains() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("ok"));

        controller.run(QUERY, null, 2, null);

        ModelRequest request = captureRequests(1).get(0);
        assertEquals(List.of(OUTLINE_TOOL, SEARCH_TOOL),
                request.getTools().stream().map(t -> t.getName()).toList());
        assertEquals(800, request.getMaxTokens());
        assertEquals(0.0, request.getTemperature());
        assertEquals(1, request.getMessages().size());
        assertEquals(QUERY, request.getMessages().get(0).getContent());
    }

    @Test
    void shouldPlaceHistoryInSystemPrompt() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("ok"));

        controller.run(QUERY, "User: hi\nAssistant: hello", 2, null);

        String systemPrompt = captureRequests(1).get(0).getSystemPrompt();
        assertTrue(systemPrompt.contains("Previous conversation:\nUser: hi\nAssistant: hello"));
    }

    // ==================== Multi-round ====================

    @Test
    void shouldChainTwoToolRoundsAndAggregateSources() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", OUTLINE_TOOL, Map.of("course_title", "X")),
                toolCall("c2", SEARCH_TOOL, Map.of("query", "Recursion")),
                finalAnswer("Lesson 4 covers recursion; Course Y lesson 2 also covers it."));

        RoundControllerResult result = controller.run(QUERY, null, 2, null);

        assertEquals("Lesson 4 covers recursion; Course Y lesson 2 also covers it.", result.text());
        assertEquals(List.of(LESSON_SOURCE), result.sources());
        assertEquals(3, result.modelCalls());
        assertEquals(2, result.roundsExecuted());
        assertTrue(result.forcedFinal());
        assertEquals(List.of(Map.of("course_title", "X")), outlineTool.getInvocations());
        assertEquals(List.of(Map.of("query", "Recursion")), searchTool.getInvocations());
    }

    @Test
    void shouldAttributeOnlySearchResultsWhenOutlineAndSearchAreChained() {
        CourseContentPort contentPort = mock(CourseContentPort.class);
        when(contentPort.resolveCourseName("X")).thenReturn(Optional.of("Course X"));
        when(contentPort.getCourseOutline("Course X")).thenReturn(Optional.of(CourseOutline.builder()
                .title("Course X")
                .courseLink("https://learn.example.com/x")
                .lessons(List.of(CourseOutline.Lesson.builder().number(4).title("Recursion").build()))
                .build()));
        when(contentPort.search("Recursion", null, null)).thenReturn(SearchResults.of(List.of(
                new SearchHit("Recursion is a function calling itself.", "Course Y", 2))));
        when(contentPort.getLessonLink("Course Y", 2)).thenReturn(Optional.of("https://learn.example.com/y/2"));
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", OUTLINE_TOOL, Map.of("course_title", "X")),
                toolCall("c2", SEARCH_TOOL, Map.of("query", "Recursion")),
                finalAnswer("Lesson 4 of Course X is Recursion; Course Y lesson 2 covers it too."));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            DefaultRoundController realTools = controllerWith(
                    new CourseOutlineTool(contentPort, executor), new CourseSearchTool(contentPort, executor));

            RoundControllerResult result = realTools.run(QUERY, null, 2, null);

            assertEquals(List.of(Source.of("Course Y - Lesson 2", "https://learn.example.com/y/2")),
                    result.sources());
            assertEquals(3, result.modelCalls());
            assertTrue(captureRequests(3).get(1).getMessages().get(2).getToolResults().get(0).content()
                    .contains("4. Recursion"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldReplayEarlierRoundsInLaterRequests() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", OUTLINE_TOOL, Map.of("course_title", "X")),
                finalAnswer("done"));

        controller.run(QUERY, null, 2, null);

        List<ModelRequest> requests = captureRequests(2);
        List<Message> second = requests.get(1).getMessages();
        assertEquals(3, second.size());
        assertTrue(second.get(0).isUserMessage());
        assertTrue(second.get(1).isAssistantMessage());
        assertEquals("raw-c1", second.get(1).getRawContent());
        assertEquals("c1", second.get(1).getToolCalls().get(0).invocationId());
        assertTrue(second.get(2).isToolMessage());
        ToolResult toolResult = second.get(2).getToolResults().get(0);
        assertEquals("c1", toolResult.invocationId());
        assertEquals("lesson4: Recursion", toolResult.content());
        assertTrue(toolResult.succeeded());
    }

    // ==================== Forced final call ====================

    @Test
    void shouldWithholdToolsOnForcedFinalCall() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", OUTLINE_TOOL, Map.of("course_title", "X")),
                finalAnswer("answer from gathered context"));

        RoundControllerResult result = controller.run(QUERY, null, 1, null);

        List<ModelRequest> requests = captureRequests(2);
        assertFalse(requests.get(0).getTools().isEmpty());
        assertTrue(requests.get(1).getTools().isEmpty());
        assertTrue(requests.get(1).getSystemPrompt().contains(properties.getPrompts().getForcedFinal()));
        assertFalse(requests.get(0).getSystemPrompt().contains(properties.getPrompts().getForcedFinal()));
        assertEquals("answer from gathered context", result.text());
        assertTrue(result.forcedFinal());
    }

    @Test
    void shouldCoerceToolRequestOnForcedCallToText() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", OUTLINE_TOOL, Map.of("course_title", "X")),
                CompletableFuture.completedFuture(ModelResponse.toolRequest(
                        List.of(new ToolInvocationRequest("c2", SEARCH_TOOL, Map.of("query", "more"))),
                        "raw-c2", "Partial answer before the tool call")));

        RoundControllerResult result = controller.run(QUERY, null, 1, null);

        assertEquals("Partial answer before the tool call", result.text());
        assertEquals(2, result.modelCalls());
        assertEquals(1, result.roundsExecuted());
        assertTrue(searchTool.getInvocations().isEmpty());
    }

    @Test
    void shouldNeverExceedBudgetPlusOneModelCalls() {
        when(llmPort.chat(any())).thenAnswer(invocation -> toolCall("c", SEARCH_TOOL, Map.of("query", "q")));

        for (int maxRounds = 1; maxRounds <= 4; maxRounds++) {
            StubTool tool = StubTool.returning(SEARCH_TOOL, ToolOutput.text("chunk"));
            RoundControllerResult result = controllerWith(tool).run(QUERY, null, maxRounds, null);

            assertEquals(maxRounds + 1, result.modelCalls());
            assertEquals(maxRounds, result.roundsExecuted());
            assertEquals(maxRounds, tool.getInvocations().size());
            assertEquals("FALLBACK", result.text());
        }
    }

    @Test
    void shouldRejectNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> controller.run(QUERY, null, 0, null));
        verify(llmPort, never()).chat(any());
    }

    // ==================== Tool failures ====================

    @Test
    void shouldContinueAfterUnknownTool() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", "no_such_tool", Map.of()),
                finalAnswer("I could not look that up."));

        RoundControllerResult result = controller.run(QUERY, null, 2, null);

        assertEquals("I could not look that up.", result.text());
        assertEquals(2, result.modelCalls());
        ToolResult failure = captureRequests(2).get(1).getMessages().get(2).getToolResults().get(0);
        assertFalse(failure.succeeded());
        assertTrue(failure.content().contains("no_such_tool"));
        assertTrue(failure.content().contains(OUTLINE_TOOL));
    }

    @Test
    void shouldAnswerWithoutSourcesWhenToolAlwaysFails() {
        StubTool broken = StubTool.failingWith(SEARCH_TOOL, new IllegalStateException("store offline"));
        controller = controllerWith(broken);
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", SEARCH_TOOL, Map.of("query", "a")),
                toolCall("c2", SEARCH_TOOL, Map.of("query", "b")),
                finalAnswer("The course store is unavailable right now."));

        RoundControllerResult result = controller.run(QUERY, null, 2, null);

        assertEquals("The course store is unavailable right now.", result.text());
        assertTrue(result.sources().isEmpty());
        assertEquals(2, broken.getInvocations().size());
    }

    // ==================== Blank answers ====================

    @Test
    void shouldUseFallbackForBlankAnswer() {
        when(llmPort.chat(any())).thenReturn(finalAnswer("  "));

        RoundControllerResult result = controller.run(QUERY, null, 2, null);

        assertEquals("FALLBACK", result.text());
    }

    // ==================== Model failures ====================

    @Test
    void shouldRaiseModelCommunicationExceptionOnFailedFuture() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("401")));

        ModelCommunicationException ex = assertThrows(ModelCommunicationException.class,
                () -> controller.run(QUERY, null, 2, null));
        assertTrue(ex.getMessage().contains("401"));
    }

    @Test
    void shouldRaiseModelCommunicationExceptionOnSynchronousThrow() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("not configured"));

        assertThrows(ModelCommunicationException.class, () -> controller.run(QUERY, null, 2, null));
    }

    @Test
    void shouldRaiseModelCommunicationExceptionOnNullResponse() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(null));

        assertThrows(ModelCommunicationException.class, () -> controller.run(QUERY, null, 2, null));
    }

    @Test
    void shouldFailMidLoopWhenModelFailsAfterToolRound() {
        when(llmPort.chat(any())).thenReturn(
                toolCall("c1", OUTLINE_TOOL, Map.of("course_title", "X")),
                CompletableFuture.failedFuture(new IllegalStateException("connection reset")));

        assertThrows(ModelCommunicationException.class, () -> controller.run(QUERY, null, 2, null));
        assertEquals(1, outlineTool.getInvocations().size());
    }

    // ==================== Deadline ====================

    @Test
    void shouldFailImmediatelyWhenDeadlineAlreadyPassed() {
        DeadlineExceededException ex = assertThrows(DeadlineExceededException.class,
                () -> controller.run(QUERY, null, 2, clock.instant()));

        assertEquals(RoundState.AWAITING_MODEL, ex.getState());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldCancelModelCallWhenDeadlineExpires() {
        CompletableFuture<ModelResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(pending);

        DeadlineExceededException ex = assertThrows(DeadlineExceededException.class,
                () -> controller.run(QUERY, null, 2, clock.instant().plusMillis(50)));

        assertEquals(RoundState.AWAITING_MODEL, ex.getState());
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldStopWaitingForToolsWhenDeadlineExpires() {
        StubTool hanging = StubTool.of(SEARCH_TOOL, params -> new CompletableFuture<>());
        controller = controllerWith(hanging);
        when(llmPort.chat(any())).thenReturn(toolCall("c1", SEARCH_TOOL, Map.of("query", "q")));

        DeadlineExceededException ex = assertThrows(DeadlineExceededException.class,
                () -> controller.run(QUERY, null, 2, clock.instant().plusMillis(50)));

        assertEquals(RoundState.DISPATCHING_TOOLS, ex.getState());
        verify(llmPort, times(1)).chat(any());
    }
}
