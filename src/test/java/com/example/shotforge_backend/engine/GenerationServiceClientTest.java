package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.util.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class GenerationServiceClientTest {

    private static GenerationProperties props() {
        GenerationProperties props = new GenerationProperties();
        props.setMaxRetries(2);
        props.setRetryBackoffMillis(1);
        props.setTimeoutSeconds(5);
        return props;
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static GenerationServiceClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().baseUrl("http://generation.test").exchangeFunction(exchange).build();
        return new GenerationServiceClient(webClient, props());
    }

    @Test
    void retriesTransientFailuresThenSucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        GenerationServiceClient client = client(request -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 1) return Mono.error(mock(PrematureCloseException.class));
            if (attempt == 2) return Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"busy\"}"));
            return Mono.just(json(HttpStatus.OK, "{\"rawScript\":\"SCENE 1\"}"));
        });

        JsonNode node = client.postBlocking("script", "/v1/script", Map.of("title", "t"));

        assertThat(node.get("rawScript").asText()).isEqualTo("SCENE 1");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void clientErrorsAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        GenerationServiceClient client = client(request -> {
            attempts.incrementAndGet();
            return Mono.just(json(HttpStatus.BAD_REQUEST, "{\"error\":\"bad prompt\"}"));
        });

        assertThatThrownBy(() -> client.postBlocking("audit", "/v1/audit", Map.of()))
                .isInstanceOf(GenerationServiceException.class)
                .satisfies(e -> assertThat(((GenerationServiceException) e).getStatus()).isEqualTo(400));
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void asyncCallIsCancelledWithToken() {
        GenerationServiceClient client = client(request -> Mono.never());
        CancellationToken token = new CancellationToken();

        CompletableFuture<JsonNode> future = client.postAsync("video", "/v1/video", Map.of(), Duration.ofSeconds(30), token);
        token.cancel();

        assertThat(future.isCancelled()).isTrue();
    }

    @Test
    void completedAsyncCallsReleaseTheirCancelCallback() {
        GenerationServiceClient client = client(request -> Mono.just(json(HttpStatus.OK, "{\"audioUrl\":\"a.mp3\"}")));
        CancellationToken token = new CancellationToken();

        for (int i = 0; i < 5; i++) {
            JsonNode node = client.postAsync("voice", "/v1/voice", Map.of(), Duration.ofSeconds(5), token).join();
            assertThat(node.get("audioUrl").asText()).isEqualTo("a.mp3");
        }

        assertThat(token.registeredCallbacks()).isZero();
    }

    @Test
    void helpersReadFirstPresentField() throws Exception {
        JsonNode node = new ObjectMapper().readTree("{\"script\":\"  \",\"content\":\"text\",\"issues\":[\"a\",\" \",\"b\"]}");

        assertThat(GenerationServiceClient.text(node, "rawScript", "script", "content")).isEqualTo("text");
        assertThat(GenerationServiceClient.stringList(node, "issues")).containsExactly("a", "b");
    }
}
