package me.golemcore.courseqa.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.component.ToolComponent;
import me.golemcore.courseqa.domain.model.ToolFailureKind;
import me.golemcore.courseqa.domain.model.ToolInvocationRequest;
import me.golemcore.courseqa.domain.model.ToolOutput;
import me.golemcore.courseqa.domain.model.ToolResult;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes the tool invocations of one round against the {@link ToolRegistry}.
 *
 * <p>
 * Total: every request yields exactly one {@link ToolResult}, in request order.
 * Unknown tools, disabled tools, executor exceptions, failed futures and
 * timeouts all become {@code succeeded=false} results whose content explains
 * the failure to the model; a failing tool never prevents the remaining
 * requests of the round from running.
 *
 * <p>
 * All executors are started before any of them is awaited, so independent
 * lookups run concurrently. Stateless apart from configuration; shared across
 * rounds and concurrent queries.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private final ToolRegistry toolRegistry;
    private final CourseQaProperties properties;

    public ToolDispatcher(ToolRegistry toolRegistry, CourseQaProperties properties) {
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    /**
     * Executes all requests and blocks until every result has settled.
     *
     * @return one result per request, same order as {@code requests}
     */
    public List<ToolResult> executeAll(List<ToolInvocationRequest> requests) {
        return dispatch(requests).join();
    }

    /**
     * Starts all requests and returns a future of the ordered results. The
     * future never completes exceptionally on its own account; it can only be
     * cancelled by the caller.
     */
    public CompletableFuture<List<ToolResult>> dispatch(List<ToolInvocationRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<CompletableFuture<ToolResult>> pending = new ArrayList<>(requests.size());
        for (ToolInvocationRequest request : requests) {
            pending.add(start(request));
        }

        return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<ToolResult> results = new ArrayList<>(pending.size());
                    for (CompletableFuture<ToolResult> future : pending) {
                        results.add(future.join());
                    }
                    return List.copyOf(results);
                });
    }

    private CompletableFuture<ToolResult> start(ToolInvocationRequest request) {
        String toolName = sanitizeToolName(request.toolName());
        Optional<ToolComponent> found = toolRegistry.find(toolName);

        if (found.isEmpty()) {
            String available = String.join(", ", toolRegistry.getToolNames());
            log.warn("[Tools] Unknown tool requested: '{}'", request.toolName());
            return CompletableFuture.completedFuture(ToolResult.failure(request, ToolFailureKind.UNKNOWN_TOOL,
                    "Tool '" + request.toolName() + "' not found. Available tools: " + available));
        }

        ToolComponent tool = found.get();
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(ToolResult.failure(request, ToolFailureKind.DISABLED,
                    "Tool '" + toolName + "' is disabled"));
        }

        log.debug("[Tools] Executing '{}' ({}) with {}", toolName, request.invocationId(), request.arguments());
        CompletableFuture<ToolOutput> execution;
        try {
            execution = tool.execute(request.arguments());
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.failedFuture(new IllegalStateException("tool returned no result"));
        }

        return execution
                .orTimeout(properties.getToolLoop().getToolTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((output, error) -> toResult(request, toolName, output, error));
    }

    private ToolResult toResult(ToolInvocationRequest request, String toolName, ToolOutput output,
            Throwable error) {
        if (error != null) {
            Throwable cause = rootCause(error);
            if (cause instanceof TimeoutException) {
                log.warn("[Tools] '{}' timed out after {} ms", toolName, properties.getToolLoop().getToolTimeoutMs());
                return ToolResult.failure(request, ToolFailureKind.TIMEOUT,
                        "Tool '" + toolName + "' timed out");
            }
            log.warn("[Tools] '{}' failed: {}", toolName, safeCauseMessage(cause));
            return ToolResult.failure(request, ToolFailureKind.EXECUTION_FAILED,
                    "Tool '" + toolName + "' failed: " + safeCauseMessage(cause));
        }
        if (output == null) {
            return ToolResult.failure(request, ToolFailureKind.EXECUTION_FAILED,
                    "Tool '" + toolName + "' failed: no output");
        }
        ToolResult result = ToolResult.success(request, output);
        return result.withContent(truncateToolResult(result.content(), toolName));
    }

    private static Throwable rootCause(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        return cursor;
    }

    private static String safeCauseMessage(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = properties.getToolLoop().getMaxToolResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Try a more specific query or a lesson filter.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
