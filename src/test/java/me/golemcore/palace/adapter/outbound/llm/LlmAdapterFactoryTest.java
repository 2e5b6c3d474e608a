package me.golemcore.palace.adapter.outbound.llm;

import me.golemcore.palace.domain.model.LlmRequest;
import me.golemcore.palace.domain.model.LlmResponse;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private PalaceProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PalaceProperties();
    }

    // ===== init() =====

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        verify(langchain4j).initialize();
        verify(noop, never()).initialize();
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
    }

    @Test
    void shouldFallbackToFirstAdapterWhenNoopNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom));
        factory.init();

        assertEquals("custom", factory.getProviderId());
    }

    @Test
    void shouldReturnNoneWhenNoAdapters() {
        properties.getLlm().setProvider("nonexistent");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertEquals("none", factory.getCurrentModel());
        assertFalse(factory.isAvailable());
    }

    // ===== LlmPort delegation =====

    @Test
    void shouldDelegateChatToActiveAdapter() {
        properties.getLlm().setProvider("test");
        LlmProviderAdapter adapter = createMockAdapter("test", true);
        LlmRequest request = LlmRequest.builder().build();
        LlmResponse expectedResponse = LlmResponse.builder().content("hello").build();
        when(adapter.chat(request)).thenReturn(CompletableFuture.completedFuture(expectedResponse));

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(adapter));
        factory.init();

        assertEquals("hello", factory.chat(request).join().getContent());
    }

    @Test
    void shouldFailChatWhenNoActiveAdapter() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        CompletableFuture<LlmResponse> result = factory.chat(LlmRequest.builder().build());

        CompletionException ex = assertThrows(CompletionException.class, result::join);
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    void shouldDelegateGetCurrentModel() {
        properties.getLlm().setProvider("test");
        LlmProviderAdapter adapter = createMockAdapter("test", true);
        when(adapter.getCurrentModel()).thenReturn("openai/gpt-4o-mini");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(adapter));
        factory.init();

        assertEquals("openai/gpt-4o-mini", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
    }

    // ===== Helper =====

    private LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        return adapter;
    }
}
