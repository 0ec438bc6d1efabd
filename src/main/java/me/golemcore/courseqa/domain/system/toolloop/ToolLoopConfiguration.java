package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.service.SourceAggregator;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.domain.service.ToolRegistry;
import me.golemcore.courseqa.domain.system.toolloop.view.ConversationViewBuilder;
import me.golemcore.courseqa.domain.system.toolloop.view.DefaultConversationViewBuilder;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the round controller (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ConversationViewBuilder conversationViewBuilder(CourseQaProperties properties) {
        return new DefaultConversationViewBuilder(properties.getPrompts());
    }

    @Bean
    public RoundController roundController(LlmPort llmPort, ToolRegistry toolRegistry,
            ToolDispatcher toolDispatcher, SourceAggregator sourceAggregator, ConversationViewBuilder viewBuilder,
            CourseQaProperties properties, Clock clock) {
        return new DefaultRoundController(llmPort, toolRegistry, toolDispatcher, sourceAggregator, viewBuilder,
                properties.getLlm(), properties.getToolLoop(), clock);
    }
}
