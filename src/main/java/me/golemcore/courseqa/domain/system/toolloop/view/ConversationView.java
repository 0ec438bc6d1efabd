package me.golemcore.courseqa.domain.system.toolloop.view;

import me.golemcore.courseqa.domain.model.Message;

import java.util.List;

/**
 * Request-time projection of a query's conversation.
 *
 * <p>
 * The round log must never be mutated. Anything a model call needs is
 * represented as a view built from it.
 */
public record ConversationView(String systemPrompt, List<Message> messages) {

    public ConversationView {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
