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

/**
 * Response from the language model: either a final answer or one or more tool
 * invocation requests.
 *
 * @param kind
 *            response discriminator
 * @param text
 *            answer text for {@link Kind#FINAL}; any accompanying text for
 *            {@link Kind#TOOL_REQUEST}, may be {@code null}
 * @param invocations
 *            requested invocations, empty for final answers
 * @param rawContent
 *            provider-specific assistant turn, opaque to the domain
 */
public record ModelResponse(Kind kind, String text, List<ToolInvocationRequest> invocations, Object rawContent) {

    public enum Kind {
        FINAL, TOOL_REQUEST
    }

    public ModelResponse {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        if (kind == Kind.TOOL_REQUEST && invocations.isEmpty()) {
            throw new IllegalArgumentException("tool request response must carry at least one invocation");
        }
    }

    public static ModelResponse finalAnswer(String text) {
        return new ModelResponse(Kind.FINAL, text, List.of(), null);
    }

    public static ModelResponse toolRequest(List<ToolInvocationRequest> invocations, Object rawContent,
            String text) {
        return new ModelResponse(Kind.TOOL_REQUEST, text, invocations, rawContent);
    }

    public boolean hasToolRequests() {
        return kind == Kind.TOOL_REQUEST;
    }
}
