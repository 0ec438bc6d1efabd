package me.golemcore.courseqa.domain.component;

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

import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.model.ToolOutput;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executable tool that can be invoked by the model. Tools expose their JSON
 * Schema definition to the model via function calling and implement the
 * execution logic, e.g. course content search and course outline lookup.
 *
 * <p>
 * Implementations report expected failures by completing the future
 * exceptionally (typically with {@link ToolExecutionException}); the dispatcher
 * turns every failure into an error-bearing result for the model.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the arguments supplied by the model.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool output
     */
    CompletableFuture<ToolOutput> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Checks whether this tool is enabled. Disabled tools are not advertised.
     */
    default boolean isEnabled() {
        return true;
    }
}
