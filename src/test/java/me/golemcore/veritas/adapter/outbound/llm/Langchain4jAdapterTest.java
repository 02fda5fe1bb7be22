package me.golemcore.veritas.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.veritas.domain.model.LlmProviderException;
import me.golemcore.veritas.domain.model.LlmRequest;
import me.golemcore.veritas.domain.model.LlmResponse;
import me.golemcore.veritas.infrastructure.config.VeritasProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jAdapterTest {

    private VeritasProperties properties;
    private ChatModel chatModel;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new VeritasProperties();
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jAdapter(properties) {
            @Override
            protected ChatModel createModel() {
                return chatModel;
            }
        };
    }

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals("gpt-4o-mini", adapter.getCurrentModel());
    }

    @Test
    void shouldRequireApiKey() {
        assertFalse(adapter.isAvailable());

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.chat(LlmRequest.builder().prompt("hi").build()).join());
        assertInstanceOf(LlmProviderException.class, ex.getCause());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendPromptAsUserMessage() {
        properties.getLlm().getLangchain4j().setApiKey("sk-test");
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Answer"))
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder().prompt("Question").build()).join();

        assertEquals("Answer", response.getContent());
        assertEquals("gpt-4o-mini", response.getModel());
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(1, captor.getValue().size());
        assertEquals("Question", ((UserMessage) captor.getValue().get(0)).singleText());
    }

    @Test
    void shouldWrapModelFailures() {
        properties.getLlm().getLangchain4j().setApiKey("sk-test");
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("rate limited"));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.chat(LlmRequest.builder().prompt("hi").build()).join());

        assertInstanceOf(LlmProviderException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("rate limited"));
    }
}
