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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A single turn of the request-time conversation sent to the model.
 *
 * <p>
 * Assistant turns that requested tools keep the provider payload in
 * {@code rawContent} so adapters can replay it unmodified; tool turns carry all
 * results of one round.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;
    private Object rawContent;
    private List<ToolInvocationRequest> toolCalls;
    private List<ToolResult> toolResults;

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistantToolCalls(Object rawContent, List<ToolInvocationRequest> toolCalls) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .rawContent(rawContent)
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    public static Message toolResults(List<ToolResult> results) {
        return Message.builder().role(ROLE_TOOL).toolResults(List.copyOf(results)).build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
