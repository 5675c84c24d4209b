package com.yugabyte.monitor.client;

import com.yugabyte.monitor.exception.LlmException;
import com.yugabyte.monitor.model.CompletionRequest;
import com.yugabyte.monitor.model.CompletionResponse;
import com.yugabyte.monitor.model.LlmRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Client for an OpenAI-compatible chat-completions endpoint.
 * <p>
 * Timeouts, 429 and 5xx answers are retried with a linear backoff; anything else fails at once.
 * With no API key configured every call fails fast with {@link LlmException#DISABLED}.
 */
@Component
@Slf4j
public class LlmClient {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final int maxRetries;
    private final long retryBackoffMillis;

    @Autowired
    public LlmClient(WebClient.Builder webClientBuilder,
                     @Value("${llm.base-url:https://api.openai.com/v1}") String baseUrl,
                     @Value("${llm.api-key:}") String apiKey,
                     @Value("${llm.model:gpt-4o-mini}") String model,
                     @Value("${llm.timeout:30000}") long timeoutMillis,
                     @Value("${llm.max-retries:2}") int maxRetries,
                     @Value("${llm.retry-backoff:1000}") long retryBackoffMillis) {
        this.webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = Duration.ofMillis(timeoutMillis);
        this.maxRetries = maxRetries;
        this.retryBackoffMillis = retryBackoffMillis;
        if (!isEnabled()) {
            log.warn("llm.api-key is not set: language-model calls are disabled, deterministic fallbacks apply");
        }
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Run one completion and return the trimmed answer text.
     *
     * @throws LlmException when disabled, or when every attempt failed
     */
    public String complete(LlmRequest request) {
        if (!isEnabled()) {
            throw new LlmException(LlmException.DISABLED, "Language model is not configured");
        }
        CompletionRequest body = new CompletionRequest(model, List.of(
                new CompletionRequest.CompletionMessage("system", request.getSystemInstruction()),
                new CompletionRequest.CompletionMessage("user", request.getPrompt())),
                request.getMaxTokens(), request.getTemperature());

        LlmException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                log.warn("Retry attempt {} for completion after {}", attempt, last.getErrorCode());
                pause(attempt);
            }
            try {
                String answer = send(body);
                log.debug("Completion returned {} characters on attempt {}", answer.length(), attempt + 1);
                return answer;
            } catch (LlmException e) {
                last = e;
                if (!isRetryable(e)) {
                    throw e;
                }
            }
        }
        throw new LlmException(last.getErrorCode(),
                "Completion failed after " + (maxRetries + 1) + " attempts: " + last.getMessage(), last);
    }

    private String send(CompletionRequest body) {
        CompletionResponse response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(CompletionResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 429) {
                throw new LlmException(LlmException.RATE_LIMITED, "Rate limited by language model", e);
            }
            throw new LlmException(e.getStatusCode().is5xxServerError() ? LlmException.ERROR : "LLM_HTTP_" + status,
                    "Language model returned HTTP " + status, e);
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                throw new LlmException(LlmException.TIMEOUT, "Language model timed out after " + timeout.toMillis() + "ms", e);
            }
            throw new LlmException(LlmException.ERROR, "Language model call failed: " + e.getMessage(), e);
        }
        String content = response != null ? response.firstContent() : null;
        if (content == null || content.isBlank()) {
            throw new LlmException(LlmException.EMPTY_RESPONSE, "Language model returned no content");
        }
        return content.trim();
    }

    private static boolean isRetryable(LlmException e) {
        String code = e.getErrorCode();
        return LlmException.TIMEOUT.equals(code)
                || LlmException.RATE_LIMITED.equals(code)
                || LlmException.ERROR.equals(code)
                || LlmException.EMPTY_RESPONSE.equals(code);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private void pause(int attempt) {
        if (retryBackoffMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(retryBackoffMillis * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmException(LlmException.ERROR, "Interrupted while waiting to retry", ie);
        }
    }

    /**
     * Cheap reachability check against the model listing endpoint.
     */
    public boolean checkHealth() {
        if (!isEnabled()) {
            return false;
        }
        try {
            String response = webClient.get()
                    .uri("/models")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(5))
                    .block();
            return response != null;
        } catch (Exception e) {
            log.warn("Language model health check failed: {}", e.getMessage());
            return false;
        }
    }
}
