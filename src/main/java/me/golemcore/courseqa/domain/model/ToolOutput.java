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
 * Successful payload produced by a tool executor: the text fed back to the
 * model plus the attributions that text is based on.
 */
public record ToolOutput(String content, List<Source> attributions) {

    public ToolOutput {
        attributions = attributions == null ? List.of()
                : attributions.stream().filter(Objects::nonNull).toList();
    }

    public static ToolOutput text(String content) {
        return new ToolOutput(content, List.of());
    }

    public static ToolOutput attributed(String content, List<Source> attributions) {
        return new ToolOutput(content, attributions);
    }
}
