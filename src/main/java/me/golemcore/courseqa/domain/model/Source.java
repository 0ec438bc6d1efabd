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

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Displayable attribution for material that justified part of an answer. Lives
 * only for the duration of a single top-level query.
 *
 * @param displayText
 *            human readable label, e.g. {@code "MCP Course - Lesson 2"}
 * @param link
 *            optional link to the lesson or course, {@code null} when unknown
 */
public record Source(String displayText, URI link) {

    /**
     * Creates a source from a raw link string. Blank or malformed links are
     * dropped rather than rejected.
     */
    public static Source of(String displayText, String link) {
        return new Source(displayText, parseLink(link));
    }

    public boolean hasLink() {
        return link != null;
    }

    private static URI parseLink(String link) {
        if (link == null || link.isBlank()) {
            return null;
        }
        try {
            return new URI(link.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
