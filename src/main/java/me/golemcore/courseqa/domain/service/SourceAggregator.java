package me.golemcore.courseqa.domain.service;

import me.golemcore.courseqa.domain.model.RoundRecord;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the attributions of all tool results of a query.
 *
 * <p>
 * Rounds and results are visited in order; the first occurrence of a
 * {@code (displayText, link)} pair wins. Failed results and malformed entries
 * (null, blank display text) contribute nothing. Pure function of its input.
 */
@Component
public class SourceAggregator {

    public List<Source> aggregate(List<RoundRecord> roundLog) {
        if (roundLog == null || roundLog.isEmpty()) {
            return List.of();
        }

        Set<Source> seen = new LinkedHashSet<>();
        for (RoundRecord round : roundLog) {
            if (round == null) {
                continue;
            }
            for (ToolResult result : round.toolResults()) {
                if (result == null || !result.succeeded()) {
                    continue;
                }
                for (Source source : result.attributions()) {
                    if (source != null && source.displayText() != null && !source.displayText().isBlank()) {
                        seen.add(source);
                    }
                }
            }
        }
        return List.copyOf(seen);
    }
}
