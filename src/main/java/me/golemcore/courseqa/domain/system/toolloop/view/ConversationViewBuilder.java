package me.golemcore.courseqa.domain.system.toolloop.view;

import me.golemcore.courseqa.domain.model.ConversationContext;

/**
 * Builds the request-time conversation view for the next model call.
 */
public interface ConversationViewBuilder {

    /**
     * @param context
     *            current query context
     * @param forcedFinal
     *            whether this is the tool-free call that must produce the answer
     */
    ConversationView buildView(ConversationContext context, boolean forcedFinal);
}
