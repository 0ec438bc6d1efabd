package me.golemcore.courseqa.domain.model;

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

import java.util.List;
import java.util.Objects;

/**
 * Result of one tool invocation. The content is either the success payload or a
 * human-readable error description; both are sent back to the model as the
 * tool turn of the conversation.
 *
 * @param invocationId
 *            id of the {@link ToolInvocationRequest} this result answers
 * @param toolName
 *            tool name as requested by the model
 * @param content
 *            success payload or error text
 * @param succeeded
 *            whether the executor produced a payload
 * @param failureKind
 *            failure classification, {@code null} on success
 * @param attributions
 *            attribution records reported by the tool; always empty on failure
 */
public record ToolResult(String invocationId, String toolName, String content, boolean succeeded,
        ToolFailureKind failureKind, List<Source> attributions) {

    public ToolResult {
        attributions = attributions == null ? List.of()
                : attributions.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Creates a successful result from executor output.
     */
    public static ToolResult success(ToolInvocationRequest request, ToolOutput output) {
        return new ToolResult(request.invocationId(), request.toolName(), output.content(), true, null,
                output.attributions());
    }

    /**
     * Creates a failed result carrying an explanatory message.
     */
    public static ToolResult failure(ToolInvocationRequest request, ToolFailureKind kind, String message) {
        return new ToolResult(request.invocationId(), request.toolName(), message, false, kind, List.of());
    }

    public ToolResult withContent(String newContent) {
        return new ToolResult(invocationId, toolName, newContent, succeeded, failureKind, attributions);
    }
}
