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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.CourseAnalytics;
import me.golemcore.courseqa.domain.model.QueryAnswer;
import me.golemcore.courseqa.domain.system.toolloop.RoundController;
import me.golemcore.courseqa.domain.system.toolloop.RoundControllerResult;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.CourseContentPort;
import me.golemcore.courseqa.port.outbound.SessionHistoryPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Entry point for answering user questions about the course corpus.
 *
 * <p>
 * Resolves the session, feeds its history summary to the
 * {@link RoundController}, and records the exchange once an answer exists. A
 * failed query records nothing and propagates the controller error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourseQueryService {

    private final RoundController roundController;
    private final SessionHistoryPort sessionHistoryPort;
    private final CourseContentPort courseContentPort;
    private final CourseQaProperties properties;

    public QueryAnswer query(String question, String sessionId) {
        return query(question, sessionId, null);
    }

    /**
     * Answers a question within a session.
     *
     * @param question
     *            user question
     * @param sessionId
     *            existing session id, or {@code null} to start a new session
     * @param deadline
     *            optional deadline, {@code null} for the configured default
     */
    public QueryAnswer query(String question, String sessionId, Instant deadline) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        String session = sessionId != null ? sessionId : sessionHistoryPort.createSession();
        String history = sessionHistoryPort.getHistorySummary(session).orElse(null);

        log.debug("[Query] Session {}: answering with{} history", session, history != null ? "" : "out");
        RoundControllerResult result = roundController.run(question, history,
                properties.getToolLoop().getMaxRounds(), deadline);

        sessionHistoryPort.addExchange(session, question, result.text());
        return new QueryAnswer(result.text(), result.sources(), session);
    }

    /**
     * Drops the history of a session the caller is done with.
     */
    public void endSession(String sessionId) {
        if (sessionId != null) {
            sessionHistoryPort.clearSession(sessionId);
            log.debug("[Query] Session {} ended", sessionId);
        }
    }

    /**
     * Returns course catalog statistics.
     */
    public CourseAnalytics getCourseAnalytics() {
        List<String> titles = courseContentPort.getAllCourseTitles();
        return new CourseAnalytics(titles.size(), titles);
    }
}
