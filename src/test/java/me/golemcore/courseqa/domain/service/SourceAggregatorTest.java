package me.golemcore.courseqa.domain.service;

import me.golemcore.courseqa.domain.model.RoundRecord;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.model.ToolFailureKind;
import me.golemcore.courseqa.domain.model.ToolInvocationRequest;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceAggregatorTest {

    private static final Source LESSON_1 = Source.of("Course A - Lesson 1", "https://learn.example.com/a/1");
    private static final Source LESSON_2 = Source.of("Course A - Lesson 2", "https://learn.example.com/a/2");
    private static final Source NO_LINK = Source.of("Course B - Lesson 5", null);

    private final SourceAggregator aggregator = new SourceAggregator();

    private static RoundRecord round(ToolResult... results) {
        return new RoundRecord("raw", List.of(), Arrays.asList(results));
    }

    private static ToolResult success(String id, Source... sources) {
        ToolInvocationRequest request = new ToolInvocationRequest(id, "search_course_content", Map.of());
        return ToolResult.success(request, ToolOutput.attributed("content", Arrays.asList(sources)));
    }

    @Test
    void shouldReturnEmptyForNoRounds() {
        assertTrue(aggregator.aggregate(List.of()).isEmpty());
        assertTrue(aggregator.aggregate(null).isEmpty());
    }

    @Test
    void shouldKeepFirstSeenOrderAcrossRounds() {
        List<RoundRecord> log = List.of(
                round(success("a", LESSON_2), success("b", NO_LINK)),
                round(success("c", LESSON_1)));

        assertEquals(List.of(LESSON_2, NO_LINK, LESSON_1), aggregator.aggregate(log));
    }

    @Test
    void shouldDeduplicateIdenticalSources() {
        Source sameAsLesson1 = Source.of("Course A - Lesson 1", "https://learn.example.com/a/1");
        List<RoundRecord> log = List.of(
                round(success("a", LESSON_1, LESSON_2)),
                round(success("b", sameAsLesson1)));

        assertEquals(List.of(LESSON_1, LESSON_2), aggregator.aggregate(log));
    }

    @Test
    void shouldBeIdempotent() {
        List<RoundRecord> log = List.of(round(success("a", LESSON_1, LESSON_1, LESSON_2)));

        List<Source> once = aggregator.aggregate(log);
        List<Source> twice = aggregator.aggregate(log);

        assertEquals(once, twice);
        assertEquals(2, once.size());
    }

    @Test
    void shouldIgnoreFailedResults() {
        ToolInvocationRequest request = new ToolInvocationRequest("x", "search_course_content", Map.of());
        ToolResult failed = new ToolResult("x", "search_course_content", "boom", false,
                ToolFailureKind.EXECUTION_FAILED, List.of(LESSON_1));

        assertTrue(aggregator.aggregate(List.of(round(failed))).isEmpty());
        assertTrue(aggregator.aggregate(List.of(round(
                ToolResult.failure(request, ToolFailureKind.TIMEOUT, "timed out")))).isEmpty());
    }

    @Test
    void shouldSkipMalformedEntries() {
        Source blank = new Source("  ", null);
        List<RoundRecord> log = new ArrayList<>();
        log.add(null);
        log.add(round(success("a", blank, null, LESSON_1)));

        assertEquals(List.of(LESSON_1), aggregator.aggregate(log));
    }
}
