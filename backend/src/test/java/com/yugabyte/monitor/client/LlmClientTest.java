package com.yugabyte.monitor.client;

import com.yugabyte.monitor.connector.StubExchange;
import com.yugabyte.monitor.exception.LlmException;
import com.yugabyte.monitor.model.LlmRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LlmClient")
class LlmClientTest {

    private static final String ANSWER = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  All good.  \"}}]}";
    private static final LlmRequest REQUEST = LlmRequest.builder()
            .systemInstruction("You are a monitoring assistant.")
            .prompt("How is checkout?")
            .build();

    private static LlmClient client(StubExchange stub, String apiKey) {
        return new LlmClient(stub.builder(), "http://llm.local/v1", apiKey, "gpt-4o-mini", 500, 2, 0);
    }

    @Test
    @DisplayName("returns the trimmed content of the first choice")
    void complete() {
        StubExchange stub = new StubExchange(request -> StubExchange.json(ANSWER));

        String answer = client(stub, "key").complete(REQUEST);

        assertThat(answer).isEqualTo("All good.");
        assertThat(stub.getRequests()).singleElement().satisfies(request -> {
            assertThat(request.url().getPath()).isEqualTo("/v1/chat/completions");
            assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer key");
        });
    }

    @Test
    @DisplayName("fails fast when no API key is configured")
    void disabled() {
        StubExchange stub = new StubExchange(request -> StubExchange.json(ANSWER));
        LlmClient client = client(stub, "");

        assertThat(client.isEnabled()).isFalse();
        assertThatThrownBy(() -> client.complete(REQUEST))
                .isInstanceOf(LlmException.class)
                .extracting(e -> ((LlmException) e).getErrorCode())
                .isEqualTo(LlmException.DISABLED);
        assertThat(stub.getRequests()).isEmpty();
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("a rate-limited call is retried")
        void rateLimited() {
            AtomicInteger calls = new AtomicInteger();
            StubExchange stub = new StubExchange(request -> calls.incrementAndGet() == 1
                    ? StubExchange.json(HttpStatus.TOO_MANY_REQUESTS, "{}")
                    : StubExchange.json(ANSWER));

            assertThat(client(stub, "key").complete(REQUEST)).isEqualTo("All good.");
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("server errors are retried up to the limit")
        void serverError() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(HttpStatus.BAD_GATEWAY, "{}"));

            assertThatThrownBy(() -> client(stub, "key").complete(REQUEST))
                    .isInstanceOf(LlmException.class)
                    .extracting(e -> ((LlmException) e).getErrorCode())
                    .isEqualTo(LlmException.ERROR);
            assertThat(stub.getRequests()).hasSize(3);
        }

        @Test
        @DisplayName("an empty answer is retried and then reported")
        void emptyAnswer() {
            StubExchange stub = new StubExchange(request -> StubExchange.json("{\"choices\":[]}"));

            assertThatThrownBy(() -> client(stub, "key").complete(REQUEST))
                    .extracting(e -> ((LlmException) e).getErrorCode())
                    .isEqualTo(LlmException.EMPTY_RESPONSE);
            assertThat(stub.getRequests()).hasSize(3);
        }

        @Test
        @DisplayName("a timeout is retried and then reported")
        void timeout() {
            StubExchange stub = new StubExchange(request -> StubExchange.hang());

            assertThatThrownBy(() -> client(stub, "key").complete(REQUEST))
                    .extracting(e -> ((LlmException) e).getErrorCode())
                    .isEqualTo(LlmException.TIMEOUT);
            assertThat(stub.getRequests()).hasSize(3);
        }

        @Test
        @DisplayName("client errors are not retried")
        void clientError() {
            StubExchange stub = new StubExchange(request -> StubExchange.json(HttpStatus.UNAUTHORIZED, "{}"));

            assertThatThrownBy(() -> client(stub, "key").complete(REQUEST))
                    .extracting(e -> ((LlmException) e).getErrorCode())
                    .isEqualTo("LLM_HTTP_401");
            assertThat(stub.getRequests()).hasSize(1);
        }
    }
}
