package me.golemcore.courseqa.domain.system.toolloop;

import java.time.Instant;

/**
 * Drives a bounded, sequential conversation between the model and the
 * registered tools for one question.
 */
public interface RoundController {

    /**
     * Answers {@code query}, letting the model call tools for up to
     * {@code maxRounds} rounds.
     *
     * @param query
     *            user question
     * @param historySummary
     *            pre-formatted prior exchanges, may be {@code null}
     * @param maxRounds
     *            tool round budget, at least 1
     * @param deadline
     *            instant after which the query is abandoned, {@code null} for the
     *            configured default
     * @return final text and sources
     * @throws ModelCommunicationException
     *             if the model cannot be reached
     * @throws DeadlineExceededException
     *             if the deadline elapses first
     */
    RoundControllerResult run(String query, String historySummary, int maxRounds, Instant deadline);
}
