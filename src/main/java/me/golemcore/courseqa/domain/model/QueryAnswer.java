package me.golemcore.courseqa.domain.model;

import java.util.List;

/** Answer to a user question, with attributions and the session it was recorded in. */
public record QueryAnswer(String text, List<Source> sources, String sessionId) {

    public QueryAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
