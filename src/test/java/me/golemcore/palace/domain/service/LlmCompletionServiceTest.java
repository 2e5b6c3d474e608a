package me.golemcore.palace.domain.service;

import me.golemcore.palace.domain.model.ExtractionError;
import me.golemcore.palace.domain.model.LlmRequest;
import me.golemcore.palace.domain.model.LlmResponse;
import me.golemcore.palace.domain.model.ParseResult;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import me.golemcore.palace.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmCompletionServiceTest {

    private LlmPort llmPort;
    private PalaceProperties properties;
    private LlmCompletionService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new PalaceProperties();
        properties.getLlm().setTimeoutMs(200);
        service = new LlmCompletionService(llmPort, properties);
    }

    @Test
    void shouldReturnCompletionContent() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("[]").build()));

        ParseResult<String> result = service.complete("system", "prompt", 0.3);

        assertTrue(result.isSuccess());
        assertEquals("[]", result.value());
    }

    @Test
    void shouldSendSingleUserMessageWithConfiguredModelAndTemperature() {
        properties.getLlm().setModel("anthropic/claude-sonnet");
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("ok").build()));

        service.complete("system", "prompt", 0.2);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals("anthropic/claude-sonnet", request.getModel());
        assertEquals("system", request.getSystemPrompt());
        assertEquals(0.2, request.getTemperature(), 1e-9);
        assertEquals(1, request.getMessages().size());
        assertEquals("user", request.getMessages().get(0).getRole());
        assertEquals("prompt", request.getMessages().get(0).getContent());
    }

    @Test
    void shouldReportTimeoutWhenNoResponseArrives() {
        CompletableFuture<LlmResponse> never = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(never);

        ParseResult<String> result = service.complete("system", "prompt", 0.3);

        assertEquals(ExtractionError.TIMEOUT, result.error());
        assertTrue(never.isCancelled());
    }

    @Test
    void shouldReportEmptyCompletion() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("  ").build()));

        assertEquals(ExtractionError.EMPTY_COMPLETION, service.complete("system", "prompt", 0.3).error());
    }

    @Test
    void shouldReportFailedFuture() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("503")));

        ParseResult<String> result = service.complete("system", "prompt", 0.3);

        assertEquals(ExtractionError.COMPLETION_FAILED, result.error());
        assertEquals("503", result.detail());
    }

    @Test
    void shouldReportSynchronousFailure() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("no adapter"));

        assertEquals(ExtractionError.COMPLETION_FAILED, service.complete("system", "prompt", 0.3).error());
    }

    @Test
    void shouldStripCodeFences() {
        assertEquals("[1]", LlmCompletionService.stripCodeFences("```json\n[1]\n```"));
        assertEquals("{}", LlmCompletionService.stripCodeFences("  {}  "));
        assertEquals("", LlmCompletionService.stripCodeFences(null));
    }
}
