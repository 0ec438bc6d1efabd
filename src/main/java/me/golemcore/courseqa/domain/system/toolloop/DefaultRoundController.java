package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.model.ConversationContext;
import me.golemcore.courseqa.domain.model.ModelRequest;
import me.golemcore.courseqa.domain.model.ModelResponse;
import me.golemcore.courseqa.domain.model.RoundRecord;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.model.ToolResult;
import me.golemcore.courseqa.domain.service.SourceAggregator;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.domain.service.ToolRegistry;
import me.golemcore.courseqa.domain.system.toolloop.view.ConversationView;
import me.golemcore.courseqa.domain.system.toolloop.view.ConversationViewBuilder;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sequential tool-calling round controller.
 *
 * <p>
 * State machine: {@code AWAITING_MODEL -> DISPATCHING_TOOLS -> AWAITING_MODEL
 * ... -> TERMINATED}. While rounds remain, every model call advertises the
 * registered tools. Once the budget is spent, the next call is the forced final
 * call: tool definitions are withheld and whatever comes back is taken as the
 * answer. The model is therefore called at most {@code maxRounds + 1} times.
 *
 * <p>
 * Each round derives a new {@link ConversationContext}; sources are aggregated
 * once at termination over the whole round log.
 */
public class DefaultRoundController implements RoundController {

    private static final Logger log = LoggerFactory.getLogger(DefaultRoundController.class);

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;
    private final SourceAggregator sourceAggregator;
    private final ConversationViewBuilder viewBuilder;
    private final CourseQaProperties.LlmProperties llmSettings;
    private final CourseQaProperties.ToolLoopProperties settings;
    private final Clock clock;

    public DefaultRoundController(LlmPort llmPort, ToolRegistry toolRegistry, ToolDispatcher toolDispatcher,
            SourceAggregator sourceAggregator, ConversationViewBuilder viewBuilder,
            CourseQaProperties.LlmProperties llmSettings, CourseQaProperties.ToolLoopProperties settings) {
        this(llmPort, toolRegistry, toolDispatcher, sourceAggregator, viewBuilder, llmSettings, settings,
                Clock.systemUTC());
    }

    // Visible for testing
    public DefaultRoundController(LlmPort llmPort, ToolRegistry toolRegistry, ToolDispatcher toolDispatcher,
            SourceAggregator sourceAggregator, ConversationViewBuilder viewBuilder,
            CourseQaProperties.LlmProperties llmSettings, CourseQaProperties.ToolLoopProperties settings,
            Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.toolDispatcher = toolDispatcher;
        this.sourceAggregator = sourceAggregator;
        this.viewBuilder = viewBuilder;
        this.llmSettings = llmSettings;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public RoundControllerResult run(String query, String historySummary, int maxRounds, Instant deadline) {
        ConversationContext context = ConversationContext.initial(query, historySummary, maxRounds);
        Instant effectiveDeadline = deadline != null ? deadline : defaultDeadline();

        RoundState state = RoundState.AWAITING_MODEL;
        ModelResponse pending = null;
        RoundControllerResult result = null;
        int modelCalls = 0;

        while (state != RoundState.TERMINATED) {
            ensureBeforeDeadline(effectiveDeadline, state);

            switch (state) {
            case AWAITING_MODEL -> {
                boolean forcedFinal = !context.hasRoundsRemaining();
                ModelResponse response = callModel(context, forcedFinal, effectiveDeadline);
                modelCalls++;

                if (forcedFinal) {
                    if (response.hasToolRequests()) {
                        log.warn("[ToolLoop] Ignoring {} tool request(s) on forced final call",
                                response.invocations().size());
                    }
                    result = terminate(context, response.text(), modelCalls, true);
                    state = RoundState.TERMINATED;
                } else if (!response.hasToolRequests()) {
                    result = terminate(context, response.text(), modelCalls, false);
                    state = RoundState.TERMINATED;
                } else {
                    pending = response;
                    state = RoundState.DISPATCHING_TOOLS;
                }
            }
            case DISPATCHING_TOOLS -> {
                log.info("[ToolLoop] Round {}: dispatching {} tool call(s)",
                        context.roundsExecuted() + 1, pending.invocations().size());
                List<ToolResult> results = dispatchTools(pending, effectiveDeadline);
                context = context.advance(new RoundRecord(pending.rawContent(), pending.invocations(), results));
                log.debug("[ToolLoop] Round {} recorded, {} round(s) remaining",
                        context.roundsExecuted(), context.roundsRemaining());
                pending = null;
                state = RoundState.AWAITING_MODEL;
            }
            default -> throw new IllegalStateException("Unexpected state: " + state);
            }
        }
        return result;
    }

    private ModelResponse callModel(ConversationContext context, boolean forcedFinal, Instant deadline) {
        ModelRequest request = buildRequest(context, forcedFinal);
        log.debug("[ToolLoop] Calling model ({} messages, {} tools{})", request.getMessages().size(),
                request.getTools().size(), forcedFinal ? ", forced final" : "");

        CompletableFuture<ModelResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            throw new ModelCommunicationException("Model call failed: " + e.getMessage(), e);
        }
        if (future == null) {
            throw new ModelCommunicationException("Model call returned no response");
        }

        ModelResponse response;
        try {
            response = await(future, deadline, RoundState.AWAITING_MODEL);
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModelCommunicationException("Model call failed: " + cause.getMessage(), cause);
        }
        if (response == null) {
            throw new ModelCommunicationException("Model returned an empty response");
        }
        return response;
    }

    private ModelRequest buildRequest(ConversationContext context, boolean forcedFinal) {
        ConversationView view = viewBuilder.buildView(context, forcedFinal);
        List<ToolDefinition> tools = forcedFinal ? List.of() : toolRegistry.exportDefinitions();

        return ModelRequest.builder()
                .systemPrompt(view.systemPrompt())
                .messages(view.messages())
                .tools(tools)
                .temperature(llmSettings.getTemperature())
                .maxTokens(llmSettings.getMaxTokens())
                .build();
    }

    private List<ToolResult> dispatchTools(ModelResponse response, Instant deadline) {
        CompletableFuture<List<ToolResult>> future = toolDispatcher.dispatch(response.invocations());
        try {
            return await(future, deadline, RoundState.DISPATCHING_TOOLS);
        } catch (ExecutionException | CancellationException e) {
            // dispatch() absorbs tool failures, so this is a bug rather than a tool error
            throw new RoundControllerException("Tool dispatch failed unexpectedly", e);
        }
    }

    private <T> T await(CompletableFuture<T> future, Instant deadline, RoundState state)
            throws ExecutionException {
        try {
            if (deadline == null) {
                return future.get();
            }
            long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
            if (remainingMs <= 0) {
                future.cancel(true);
                throw new DeadlineExceededException(state);
            }
            return future.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ToolLoop] Deadline exceeded in state {}", state);
            throw new DeadlineExceededException(state);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RoundControllerException("Interrupted in state " + state, e);
        }
    }

    private void ensureBeforeDeadline(Instant deadline, RoundState state) {
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            log.warn("[ToolLoop] Deadline passed before entering state {}", state);
            throw new DeadlineExceededException(state);
        }
    }

    private RoundControllerResult terminate(ConversationContext context, String text, int modelCalls,
            boolean forcedFinal) {
        String answer = text;
        if (answer == null || answer.isBlank()) {
            log.warn("[ToolLoop] Model returned a blank answer, using fallback");
            answer = settings.getFallbackAnswer();
        }
        List<Source> sources = sourceAggregator.aggregate(context.roundLog());
        log.info("[ToolLoop] Terminated after {} model call(s), {} round(s){}, {} source(s)",
                modelCalls, context.roundsExecuted(), forcedFinal ? " (forced final)" : "", sources.size());
        return new RoundControllerResult(answer, sources, modelCalls, context.roundsExecuted(), forcedFinal);
    }

    private Instant defaultDeadline() {
        long deadlineMs = settings != null ? settings.getDeadlineMs() : 0L;
        return deadlineMs > 0 ? clock.instant().plusMillis(deadlineMs) : null;
    }
}
