package me.golemcore.courseqa.domain.model;

import java.util.List;

/**
 * One completed round: the model turn that requested tools and the results of
 * executing them. Immutable once created.
 *
 * @param modelRequestPayload
 *            provider-specific assistant turn, replayed verbatim on the next
 *            request and never inspected by the loop
 * @param invocations
 *            tool invocations the model requested in this round
 * @param toolResults
 *            one result per invocation, in request order
 */
public record RoundRecord(Object modelRequestPayload, List<ToolInvocationRequest> invocations,
        List<ToolResult> toolResults) {

    public RoundRecord {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }
}
