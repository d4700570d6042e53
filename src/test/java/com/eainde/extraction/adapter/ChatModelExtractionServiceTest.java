package com.eainde.extraction.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelExtractionServiceTest {

    @Mock private ChatModel chatModel;

    private ChatModelExtractionService service;

    @BeforeEach
    void setUp() {
        service = new ChatModelExtractionService(chatModel, new ObjectMapper());
    }

    private static ExtractionRequest request(Map<String, String> context) {
        return new ExtractionRequest("S-004", "cross_reference_resolution", "Resolve references.",
                "Rent is as set out in Exhibit C.", context, Set.of("base_rent"), "pp.4-5", Duration.ofSeconds(30));
    }

    private static ChatResponse answer(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    // =========================================================================
    //  Request shape
    // =========================================================================

    @Nested
    @DisplayName("request shape")
    class RequestShape {

        @Test
        @DisplayName("sends instructions as system message and segment details as user message")
        void messages() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(answer("{\"fields\": []}"));

            String raw = service.extract(request(Map.of("landlord", "Harbor Properties LLC")));

            assertThat(raw).isEqualTo("{\"fields\": []}");
            ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
            verify(chatModel).chat(captor.capture());
            ChatRequest sent = captor.getValue();

            assertThat(sent.messages()).hasSize(2);
            assertThat(((SystemMessage) sent.messages().get(0)).text()).isEqualTo("Resolve references.");
            String user = ((UserMessage) sent.messages().get(1)).singleText();
            assertThat(user).contains("Segment S-004 (pp.4-5)")
                    .contains("\"landlord\":\"Harbor Properties LLC\"")
                    .contains("Only return these fields: base_rent")
                    .endsWith("Rent is as set out in Exhibit C.");
            assertThat(sent.responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
            assertThat(sent.responseFormat().jsonSchema().name()).isEqualTo(JsonSchemaConverter.RESPONSE_SCHEMA_NAME);
        }

        @Test
        @DisplayName("omits the context block when there is no prior context")
        void noContext() {
            String prompt = service.userPrompt(request(Map.of()));

            assertThat(prompt).doesNotContain("Context from earlier passes");
        }

        @Test
        @DisplayName("a response without a message is returned as empty text")
        void nullMessage() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(null);

            assertThat(service.extract(request(Map.of()))).isEmpty();
        }
    }

    // =========================================================================
    //  Failure classification
    // =========================================================================

    @Nested
    @DisplayName("failure classification")
    class Failures {

        @Test
        @DisplayName("retriable model exceptions are transient")
        void retriable() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RetriableException("rate limited"));

            assertThatThrownBy(() -> service.extract(request(Map.of())))
                    .isInstanceOfSatisfying(ExtractionServiceException.class,
                            e -> assertThat(e.isTransientFailure()).isTrue())
                    .hasMessageContaining("S-004/cross_reference_resolution");
        }

        @Test
        @DisplayName("I/O failures in the cause chain are transient")
        void ioCause() {
            when(chatModel.chat(any(ChatRequest.class)))
                    .thenThrow(new IllegalStateException("call failed", new IOException("connection reset")));

            assertThatThrownBy(() -> service.extract(request(Map.of())))
                    .isInstanceOfSatisfying(ExtractionServiceException.class,
                            e -> assertThat(e.isTransientFailure()).isTrue());
        }

        @Test
        @DisplayName("other failures are permanent")
        void permanent() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalArgumentException("bad request"));

            assertThatThrownBy(() -> service.extract(request(Map.of())))
                    .isInstanceOfSatisfying(ExtractionServiceException.class,
                            e -> assertThat(e.isTransientFailure()).isFalse());
        }
    }
}
