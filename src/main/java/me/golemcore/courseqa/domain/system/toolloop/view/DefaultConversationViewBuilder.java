package me.golemcore.courseqa.domain.system.toolloop.view;

import me.golemcore.courseqa.domain.model.ConversationContext;
import me.golemcore.courseqa.domain.model.Message;
import me.golemcore.courseqa.domain.model.RoundRecord;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Default request-time conversation view builder.
 *
 * <p>
 * System prompt: base prompt, then the history summary under a
 * {@code Previous conversation:} heading, then the forced-final instruction
 * when tools are withheld. Messages: the user query, then for every completed
 * round the assistant turn (raw provider payload) followed by the round's tool
 * results.
 */
public class DefaultConversationViewBuilder implements ConversationViewBuilder {

    static final String HISTORY_HEADING = "Previous conversation:\n";

    private final CourseQaProperties.PromptsProperties prompts;

    public DefaultConversationViewBuilder(CourseQaProperties.PromptsProperties prompts) {
        this.prompts = prompts;
    }

    @Override
    public ConversationView buildView(ConversationContext context, boolean forcedFinal) {
        List<Message> messages = new ArrayList<>(1 + context.roundLog().size() * 2);
        messages.add(Message.user(context.originalQuery()));
        for (RoundRecord round : context.roundLog()) {
            messages.add(Message.assistantToolCalls(round.modelRequestPayload(), round.invocations()));
            messages.add(Message.toolResults(round.toolResults()));
        }
        return new ConversationView(buildSystemPrompt(context, forcedFinal), messages);
    }

    private String buildSystemPrompt(ConversationContext context, boolean forcedFinal) {
        StringBuilder sb = new StringBuilder();
        if (prompts.getSystem() != null) {
            sb.append(prompts.getSystem().strip());
        }
        if (context.hasHistory()) {
            appendSection(sb, HISTORY_HEADING + context.historySummary());
        }
        if (forcedFinal && prompts.getForcedFinal() != null && !prompts.getForcedFinal().isBlank()) {
            appendSection(sb, prompts.getForcedFinal().strip());
        }
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String section) {
        if (sb.length() > 0) {
            sb.append("\n\n");
        }
        sb.append(section);
    }
}
