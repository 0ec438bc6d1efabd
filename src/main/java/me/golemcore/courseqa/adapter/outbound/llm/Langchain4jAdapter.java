package me.golemcore.courseqa.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.Message;
import me.golemcore.courseqa.domain.model.ModelRequest;
import me.golemcore.courseqa.domain.model.ModelResponse;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.model.ToolInvocationRequest;
import me.golemcore.courseqa.domain.model.ToolResult;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic (Claude models) and any OpenAI-compatible endpoint. The
 * provider is taken from the {@code provider/model} prefix of
 * {@code courseqa.llm.model}; credentials come from
 * {@code courseqa.llm.providers.<provider>.*}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Function calling (tool use) support
 * <li>Automatic retry with exponential backoff for rate limits, 5xx responses
 * and timeouts
 * <li>Tool exchanges flattened to plain text when a request carries no tools
 * </ul>
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    /**
     * Max retry attempts for transient provider errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CourseQaProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;
    private final ExecutorService ioExecutor;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jAdapter(CourseQaProperties properties, ObjectMapper objectMapper,
            ExecutorService ioExecutor) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        this.chatModel = createModel(settings.getModel());
        initialized = true;
        log.info("Langchain4j adapter initialized with model: {}", settings.getModel());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    String getProvider(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private CourseQaProperties.ProviderProperties getProviderConfig(String providerName) {
        CourseQaProperties.ProviderProperties config = settings.getProviders().get(providerName);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add courseqa.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    private ChatModel createModel(String model) {
        String provider = getProvider(model);
        CourseQaProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName, config);
        }
        // All non-Anthropic providers use OpenAI-compatible API
        return createOpenAiModel(modelName, config);
    }

    private ChatModel createAnthropicModel(String modelName, CourseQaProperties.ProviderProperties config) {
        AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(settings.getMaxTokens())
                .temperature(settings.getTemperature())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, CourseQaProperties.ProviderProperties config) {
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(settings.getMaxTokens())
                .temperature(settings.getTemperature())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<ModelResponse> chat(ModelRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatRequest chatRequest = toChatRequest(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(chatModel.chat(chatRequest));
                } catch (RuntimeException e) {
                    if (isTransientError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Transient error (attempt {}/{}): {}, retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, e.getMessage(), backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.error("LLM chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        }, ioExecutor);
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    /**
     * Rate limits, server-side failures (HTTP 5xx, Anthropic "overloaded") and
     * timeouts are worth another attempt; anything else fails fast.
     */
    boolean isTransientError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException || current instanceof SocketTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current instanceof HttpException httpException && httpException.statusCode() >= 500) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("overloaded_error"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public String getCurrentModel() {
        return settings.getModel();
    }

    @Override
    public boolean isAvailable() {
        CourseQaProperties.ProviderProperties config = settings.getProviders().get(getProvider(settings.getModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    ChatRequest toChatRequest(ModelRequest request) {
        List<ToolSpecification> tools = convertTools(request);
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request, !tools.isEmpty()))
                .temperature(request.getTemperature())
                .maxOutputTokens(request.getMaxTokens());
        if (!tools.isEmpty()) {
            log.trace("Calling LLM with {} tools", tools.size());
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    /**
     * Converts the conversation. Without tool definitions in the request,
     * providers reject native tool-call blocks, so earlier exchanges are passed
     * as plain text instead.
     */
    List<ChatMessage> convertMessages(ModelRequest request, boolean nativeToolMessages) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> messages.add(nativeToolMessages
                    ? toAiMessage(msg)
                    : AiMessage.from(flattenToolCalls(msg)));
            case Message.ROLE_TOOL -> {
                if (nativeToolMessages) {
                    for (ToolResult result : msg.getToolResults()) {
                        messages.add(ToolExecutionResultMessage.from(result.invocationId(), result.toolName(),
                                result.content()));
                    }
                } else {
                    messages.add(UserMessage.from(flattenToolResults(msg.getToolResults())));
                }
            }
            default -> log.warn("Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private AiMessage toAiMessage(Message msg) {
        if (msg.getRawContent() instanceof AiMessage aiMessage) {
            return aiMessage;
        }
        if (!msg.hasToolCalls()) {
            return AiMessage.from(msg.getContent() != null ? msg.getContent() : "");
        }
        List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                .map(call -> ToolExecutionRequest.builder()
                        .id(call.invocationId())
                        .name(call.toolName())
                        .arguments(convertArgsToJson(call.arguments()))
                        .build())
                .toList();
        return AiMessage.from(toolRequests);
    }

    private String flattenToolCalls(Message msg) {
        if (!msg.hasToolCalls()) {
            return msg.getContent() != null ? msg.getContent() : "";
        }
        StringBuilder sb = new StringBuilder();
        for (ToolInvocationRequest call : msg.getToolCalls()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("[Called tool ").append(call.toolName()).append(" with ")
                    .append(convertArgsToJson(call.arguments())).append(']');
        }
        return sb.toString();
    }

    private String flattenToolResults(List<ToolResult> results) {
        StringBuilder sb = new StringBuilder();
        for (ToolResult result : results) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("[Result of ").append(result.toolName()).append("]\n").append(result.content());
        }
        return sb.toString();
    }

    private List<ToolSpecification> convertTools(ModelRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean hasDescription = description != null && !description.isBlank();

        // Enum values take priority
        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // Strings and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    ModelResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        if (aiMessage == null) {
            return ModelResponse.finalAnswer(null);
        }
        if (!aiMessage.hasToolExecutionRequests()) {
            return ModelResponse.finalAnswer(aiMessage.text());
        }

        List<ToolInvocationRequest> invocations = aiMessage.toolExecutionRequests().stream()
                .map(ter -> new ToolInvocationRequest(ter.id(), ter.name(), parseJsonArgs(ter.arguments())))
                .toList();
        log.trace("Parsed {} tool calls from response", invocations.size());
        return ModelResponse.toolRequest(invocations, aiMessage, aiMessage.text());
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
