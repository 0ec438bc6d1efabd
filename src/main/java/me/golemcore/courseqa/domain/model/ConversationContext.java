package me.golemcore.courseqa.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable per-query state of the tool loop.
 *
 * <p>
 * Contexts are derived, never mutated: {@link #advance(RoundRecord)} returns a
 * new instance with the round appended and the budget reduced by exactly one,
 * leaving earlier contexts intact for inspection.
 *
 * @param originalQuery
 *            the user question
 * @param historySummary
 *            pre-formatted prior exchanges, or {@code null}
 * @param roundsRemaining
 *            tool rounds still allowed, never negative
 * @param roundLog
 *            completed rounds in execution order
 */
public record ConversationContext(String originalQuery, String historySummary, int roundsRemaining,
        List<RoundRecord> roundLog) {

    public ConversationContext {
        if (originalQuery == null) {
            throw new IllegalArgumentException("originalQuery must not be null");
        }
        if (roundsRemaining < 0) {
            throw new IllegalArgumentException("roundsRemaining must be >= 0, got " + roundsRemaining);
        }
        roundLog = roundLog == null ? List.of() : List.copyOf(roundLog);
    }

    /**
     * Creates the context a query starts from.
     */
    public static ConversationContext initial(String query, String historySummary, int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be >= 1, got " + maxRounds);
        }
        String history = historySummary == null || historySummary.isBlank() ? null : historySummary;
        return new ConversationContext(query, history, maxRounds, List.of());
    }

    public boolean hasRoundsRemaining() {
        return roundsRemaining > 0;
    }

    public boolean hasHistory() {
        return historySummary != null;
    }

    public int roundsExecuted() {
        return roundLog.size();
    }

    /**
     * Derives the next context after a completed round.
     *
     * @throws IllegalStateException
     *             if the round budget is already exhausted
     */
    public ConversationContext advance(RoundRecord round) {
        if (roundsRemaining == 0) {
            throw new IllegalStateException("Round budget exhausted, cannot record another tool round");
        }
        List<RoundRecord> log = new ArrayList<>(roundLog.size() + 1);
        log.addAll(roundLog);
        log.add(round);
        return new ConversationContext(originalQuery, historySummary, roundsRemaining - 1, log);
    }
}
