package com.yugabyte.monitor.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.yugabyte.monitor.exception.BackendQueryException;
import com.yugabyte.monitor.model.ConnectorHealth;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Shared plumbing for HTTP-backed connectors: blocking JSON calls with a timeout and
 * conversion of every failure into a {@link ConnectorOutcome}.
 */
@Slf4j
@Getter
public abstract class AbstractConnector implements MonitoringConnector {

    private final String name;
    private final Duration timeout;
    private final Duration healthTimeout;
    protected final WebClient webClient;
    protected final Clock clock;

    protected AbstractConnector(String name, WebClient webClient, Duration timeout,
                                Duration healthTimeout, Clock clock) {
        this.name = name;
        this.webClient = webClient;
        this.timeout = timeout;
        this.healthTimeout = healthTimeout;
        this.clock = clock;
    }

    @Override
    public ConnectorHealth checkHealth() {
        boolean reachable;
        try {
            reachable = probe();
        } catch (Exception e) {
            log.error("{} health check failed: {}", name, describe(e));
            reachable = false;
        }
        log.debug("Health check for {}: {}", name, reachable);
        return new ConnectorHealth(name, reachable, clock.instant());
    }

    /**
     * Backend-specific liveness probe. May throw; the caller turns any failure into "unreachable".
     */
    protected abstract boolean probe();

    /**
     * Run a backend call and wrap its result, isolating every failure.
     */
    protected <E> ConnectorOutcome<E> guard(String operation, Supplier<List<E>> call) {
        try {
            List<E> items = call.get();
            log.debug("{} {} returned {} item(s)", name, operation, items == null ? 0 : items.size());
            return ConnectorOutcome.success(items);
        } catch (BackendQueryException e) {
            log.warn("{} {} failed: {}", name, operation, e.getMessage());
            return ConnectorOutcome.failure(FailureKind.BACKEND_ERROR, e.getMessage());
        } catch (Exception e) {
            FailureKind kind = classify(e);
            log.error("{} {} failed ({}): {}", name, operation, kind, describe(e));
            return ConnectorOutcome.failure(kind, describe(e));
        }
    }

    /**
     * Issue a request and block for its JSON body, mapping non-2xx statuses to {@link BackendQueryException}.
     */
    protected JsonNode exchangeJson(WebClient.RequestHeadersSpec<?> request, Duration callTimeout) {
        JsonNode body = request.retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(text -> Mono.error(new BackendQueryException(name,
                                response.statusCode().value(),
                                "HTTP " + response.statusCode().value() + " " + abbreviate(text)))))
                .bodyToMono(JsonNode.class)
                .timeout(callTimeout)
                .block();
        if (body == null) {
            throw new BackendQueryException(name, "empty response body");
        }
        return body;
    }

    /**
     * True when the request completes with a 2xx status within the health timeout.
     */
    protected boolean exchangeOk(WebClient.RequestHeadersSpec<?> request) {
        Integer status = request.exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().value()))
                .timeout(healthTimeout)
                .block();
        return status != null && status >= 200 && status < 300;
    }

    protected static FailureKind classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException) {
                return FailureKind.TIMEOUT;
            }
            if (current instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return FailureKind.TIMEOUT;
            }
            if (current instanceof WebClientResponseException || current instanceof BackendQueryException) {
                return FailureKind.BACKEND_ERROR;
            }
            if (current instanceof WebClientRequestException || current instanceof IOException) {
                return FailureKind.UNREACHABLE;
            }
            current = current.getCause();
        }
        return FailureKind.BACKEND_ERROR;
    }

    protected static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    protected static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.asText().isEmpty() ? value.asText() : fallback;
    }
}
