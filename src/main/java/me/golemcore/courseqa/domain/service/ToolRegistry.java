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
import me.golemcore.courseqa.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the tools the model may call, keyed by tool name.
 *
 * <p>
 * Tools are registered once at startup; registration order is kept and is the
 * order in which definitions are advertised to the model. Reads are safe from
 * any number of concurrent queries.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = Collections.synchronizedMap(new LinkedHashMap<>());

    public ToolRegistry(List<ToolComponent> toolComponents) {
        if (toolComponents != null) {
            toolComponents.forEach(this::register);
        }
        log.info("[Tools] Registered {} tool(s): {}", tools.size(), getToolNames());
    }

    /**
     * Registers a tool under its definition name.
     *
     * @throws DuplicateToolException
     *             if a tool with the same name is already registered
     * @throws IllegalArgumentException
     *             if the tool definition has no name
     */
    public void register(ToolComponent tool) {
        ToolDefinition definition = tool.getDefinition();
        String name = definition != null ? definition.getName() : null;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool must have a 'name' in its definition: "
                    + tool.getClass().getName());
        }
        synchronized (tools) {
            if (tools.containsKey(name)) {
                throw new DuplicateToolException(name);
            }
            tools.put(name, tool);
        }
        log.debug("[Tools] Registered '{}'", name);
    }

    /**
     * Returns the tool registered under {@code name}.
     *
     * @throws UnknownToolException
     *             if no such tool exists
     */
    public ToolComponent lookup(String name) {
        return find(name).orElseThrow(() -> new UnknownToolException(name));
    }

    public Optional<ToolComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Returns the definitions of enabled tools in registration order.
     */
    public List<ToolDefinition> exportDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        synchronized (tools) {
            for (ToolComponent tool : tools.values()) {
                if (tool.isEnabled()) {
                    definitions.add(tool.getDefinition());
                }
            }
        }
        return Collections.unmodifiableList(definitions);
    }

    public Set<String> getToolNames() {
        synchronized (tools) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(tools.keySet()));
        }
    }

    /** Raised when two tools claim the same name. Fatal at startup. */
    public static class DuplicateToolException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public DuplicateToolException(String toolName) {
            super("Tool already registered: " + toolName);
        }
    }

    /** Raised when a tool name is looked up that was never registered. */
    public static class UnknownToolException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public UnknownToolException(String toolName) {
            super("Unknown tool: " + toolName);
        }
    }
}
