package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.model.Source;

import java.util.List;

/**
 * Outcome of a completed query.
 *
 * @param text
 *            final answer, never blank
 * @param sources
 *            attributions gathered across all executed rounds
 * @param modelCalls
 *            number of model calls made, at most {@code maxRounds + 1}
 * @param roundsExecuted
 *            number of tool rounds dispatched
 * @param forcedFinal
 *            whether the answer came from the tool-free final call
 */
public record RoundControllerResult(String text, List<Source> sources, int modelCalls, int roundsExecuted,
        boolean forcedFinal) {

    public RoundControllerResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
