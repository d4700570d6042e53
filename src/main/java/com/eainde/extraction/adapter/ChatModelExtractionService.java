package com.eainde.extraction.adapter;

import com.eainde.extraction.segment.SegmentCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * {@link ExtractionService} backed by a langchain4j {@link ChatModel}.
 *
 * <p>The pass instructions become the system message; the user message carries
 * the segment id, page hint, prior-pass context as JSON, and the segment text.
 * The response format is a JSON schema, so models that support structured
 * output return the payload directly.</p>
 *
 * <p>langchain4j {@link RetriableException}s, I/O failures and remote timeouts
 * are reported as transient; everything else as permanent.</p>
 */
@Slf4j
public class ChatModelExtractionService implements ExtractionService {

    private static final List<String> CATEGORY_KEYS = substantiveCategoryKeys();

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Map<Set<String>, JsonSchema> schemas = new ConcurrentHashMap<>();

    public ChatModelExtractionService(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public String extract(ExtractionRequest request) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(List.of(
                        SystemMessage.from(request.instructions()),
                        UserMessage.from(userPrompt(request))))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schemaFor(request.allowedFields()))
                        .build())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest);
        } catch (RetriableException e) {
            throw new ExtractionServiceException("Transient model failure for " + subject(request)
                    + ": " + e.getMessage(), true, e);
        } catch (RuntimeException e) {
            boolean transientFailure = isTransient(e);
            throw new ExtractionServiceException("Model call failed for " + subject(request)
                    + ": " + e.getMessage(), transientFailure, e);
        }

        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null ? null : message.text();
        log.debug("Model answered {} with {} chars", subject(request), text == null ? 0 : text.length());
        return text == null ? "" : text;
    }

    String userPrompt(ExtractionRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Segment ").append(request.segmentId());
        if (request.pageHint() != null) prompt.append(" (").append(request.pageHint()).append(')');
        prompt.append("\n\n");
        if (!request.priorContext().isEmpty()) {
            prompt.append("Context from earlier passes (JSON):\n")
                    .append(toJson(request.priorContext()))
                    .append("\n\n");
        }
        if (!request.allowedFields().isEmpty()) {
            prompt.append("Only return these fields: ")
                    .append(String.join(", ", new TreeSet<>(request.allowedFields())))
                    .append("\n\n");
        }
        prompt.append("Segment text:\n").append(request.text());
        return prompt.toString();
    }

    private JsonSchema schemaFor(Set<String> allowedFields) {
        return schemas.computeIfAbsent(allowedFields, fields -> JsonSchemaConverter.toLangChainSchema(
                JsonSchemaConverter.RESPONSE_SCHEMA_NAME,
                JsonSchemaConverter.extractionResponseSchema(new TreeSet<>(fields), CATEGORY_KEYS)));
    }

    private String toJson(Map<String, String> context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prior context", e);
        }
    }

    private static boolean isTransient(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof RetriableException || cause instanceof IOException
                    || cause instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String subject(ExtractionRequest request) {
        return request.segmentId() + "/" + request.passName();
    }

    private static List<String> substantiveCategoryKeys() {
        List<String> keys = new ArrayList<>();
        for (SegmentCategory category : EnumSet.complementOf(
                EnumSet.of(SegmentCategory.SIGNATURE, SegmentCategory.UNCLASSIFIED))) {
            keys.add(category.key());
        }
        return List.copyOf(keys);
    }
}
