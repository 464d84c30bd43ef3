package com.medscript.safety;

import com.medscript.dto.ChatCompletionDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completions client for the inference endpoint.
 *
 * Performs one blocking call per {@link #invoke(String)} and returns the first
 * completion's message content untouched. Retries and fallback belong to the caller.
 */
@Service
public class InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(InferenceClient.class);

    private final WebClient webClient;
    private final SafetyAnalysisSettings settings;

    public InferenceClient(WebClient.Builder webClientBuilder, SafetyAnalysisSettings settings) {
        this.webClient = webClientBuilder.build();
        this.settings = settings;
    }

    public boolean isConfigured() {
        return settings.hasApiKey();
    }

    /**
     * Fail fast when no credential is available.
     */
    public void checkConfigured() {
        if (!isConfigured()) {
            throw new ConfigurationException("Inference API key not configured");
        }
    }

    /**
     * Send the prompt and return the raw completion text.
     */
    public String invoke(String prompt) {
        checkConfigured();

        ChatCompletionDTO.Response response;
        try {
            response = webClient.post()
                .uri(settings.getBaseUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(this::applyHeaders)
                .bodyValue(buildRequest(prompt))
                .retrieve()
                .bodyToMono(ChatCompletionDTO.Response.class)
                .timeout(settings.getTimeout())
                .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is2xxSuccessful()) {
                throw new ProtocolException("Malformed inference response envelope: " + e.getMessage(), e);
            }
            log.warn("Inference endpoint returned HTTP {}", e.getStatusCode().value());
            throw new ProtocolException("Inference endpoint returned HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            log.warn("Inference request failed: {}", e.getMessage());
            throw new TransportException("Inference request failed: " + e.getMessage(), e);
        } catch (CodecException e) {
            throw new ProtocolException("Malformed inference response envelope: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw translate(e);
        }

        return extractContent(response);
    }

    ChatCompletionDTO.Request buildRequest(String prompt) {
        return ChatCompletionDTO.Request.builder()
            .model(settings.getModel())
            .messages(List.of(
                ChatCompletionDTO.Message.system(settings.getSystemPrompt()),
                ChatCompletionDTO.Message.user(prompt)))
            .maxTokens(settings.getMaxTokens())
            .temperature(settings.getTemperature())
            .build();
    }

    private void applyHeaders(HttpHeaders headers) {
        headers.setBearerAuth(settings.getApiKey());
        if (settings.getReferer() != null && !settings.getReferer().isBlank()) {
            headers.set("HTTP-Referer", settings.getReferer());
        }
        if (settings.getTitle() != null && !settings.getTitle().isBlank()) {
            headers.set("X-Title", settings.getTitle());
        }
    }

    private String extractContent(ChatCompletionDTO.Response response) {
        if (response == null) {
            throw new ProtocolException("Inference endpoint returned an empty body");
        }
        List<ChatCompletionDTO.Choice> choices = response.getChoices();
        if (choices == null || choices.isEmpty()) {
            throw new ProtocolException("Inference response has no choices");
        }
        ChatCompletionDTO.Message message = choices.get(0).getMessage();
        if (message == null || message.getContent() == null) {
            throw new ProtocolException("Inference response has no message content");
        }
        return message.getContent();
    }

    private InferenceException translate(RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TimeoutException) {
            log.warn("Inference request timed out after {} ms", settings.getTimeout().toMillis());
            return new TransportException("Inference request timed out after "
                + settings.getTimeout().toMillis() + " ms", cause);
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new TransportException("Inference request interrupted", cause);
        }
        if (cause instanceof CodecException) {
            return new ProtocolException("Malformed inference response envelope: " + cause.getMessage(), cause);
        }
        log.warn("Inference request failed: {}", cause.getMessage());
        return new TransportException("Inference request failed: " + cause.getMessage(), cause);
    }
}
