package me.golemcore.courseqa.adapter.outbound.session;

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
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.SessionHistoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory session history. Keeps the last {@code courseqa.session.max-history}
 * exchanges per session and formats them as {@code User:} / {@code Assistant:}
 * lines. History is lost on restart.
 */
@Component
@Slf4j
public class InMemorySessionHistoryAdapter implements SessionHistoryPort {

    private static final String ROLE_USER = "User";
    private static final String ROLE_ASSISTANT = "Assistant";

    private final CourseQaProperties properties;
    private final Map<String, List<Entry>> sessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionCounter = new AtomicLong();

    public InMemorySessionHistoryAdapter(CourseQaProperties properties) {
        this.properties = properties;
    }

    @Override
    public String createSession() {
        String sessionId = "session_" + sessionCounter.incrementAndGet();
        sessions.put(sessionId, new ArrayList<>());
        log.debug("[Session] Created {}", sessionId);
        return sessionId;
    }

    @Override
    public void addExchange(String sessionId, String userMessage, String assistantMessage) {
        if (sessionId == null) {
            return;
        }
        List<Entry> entries = sessions.computeIfAbsent(sessionId, id -> new ArrayList<>());
        synchronized (entries) {
            entries.add(new Entry(ROLE_USER, userMessage));
            entries.add(new Entry(ROLE_ASSISTANT, assistantMessage));

            int maxEntries = Math.max(0, properties.getSession().getMaxHistory()) * 2;
            while (entries.size() > maxEntries) {
                entries.remove(0);
            }
        }
    }

    @Override
    public Optional<String> getHistorySummary(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        List<Entry> entries = sessions.get(sessionId);
        if (entries == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            if (entries.isEmpty()) {
                return Optional.empty();
            }
            StringBuilder sb = new StringBuilder();
            for (Entry entry : entries) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(entry.role()).append(": ").append(entry.content());
            }
            return Optional.of(sb.toString());
        }
    }

    @Override
    public void clearSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        List<Entry> entries = sessions.get(sessionId);
        if (entries != null) {
            synchronized (entries) {
                entries.clear();
            }
            log.debug("[Session] Cleared {}", sessionId);
        }
    }

    private record Entry(String role, String content) {
    }
}
