package com.example.shotforge_backend.engine;

import com.example.shotforge_backend.config.GenerationProperties;
import com.example.shotforge_backend.util.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Shared JSON-over-HTTP access to the generation service.
 * <p>
 * Blocking calls (script, vision, audit, export) retry transient transport failures with
 * exponential backoff. Asynchronous calls (video, voice, debugger) are never retried here;
 * the production run owns their retry budget.
 */
@Component
public class GenerationServiceClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationServiceClient.class);
    private static final int ERROR_BODY_LIMIT = 500;

    private final WebClient client;
    private final GenerationProperties props;

    public GenerationServiceClient(@Qualifier("generationWebClient") WebClient client, GenerationProperties props) {
        this.client = client;
        this.props = props;
    }

    public JsonNode postBlocking(String operation, String path, Object body) {
        Duration timeout = Duration.ofSeconds(props.getTimeoutSeconds());
        long start = System.currentTimeMillis();
        JsonNode result = exchange(operation, path, body, timeout)
                .retryWhen(Retry.backoff(props.getMaxRetries(), Duration.ofMillis(props.getRetryBackoffMillis()))
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("GENERATION retry op={} attempt={} cause={}",
                                operation, signal.totalRetriesInARow() + 1,
                                signal.failure() == null ? "unknown" : signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block(timeout.multipliedBy(props.getMaxRetries() + 1L).plusSeconds(5));
        if (result == null) {
            throw new GenerationServiceException(operation, 0, "empty response");
        }
        LOGGER.debug("GENERATION op={} done in {} ms", operation, System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Starts a call whose future is cancelled, disposing the exchange, when {@code token} is cancelled.
     */
    public CompletableFuture<JsonNode> postAsync(String operation, String path, Object body,
                                                 Duration timeout, CancellationToken token) {
        CompletableFuture<JsonNode> future = exchange(operation, path, body, timeout).toFuture();
        Runnable dispose = () -> future.cancel(true);
        token.onCancel(dispose);
        future.whenComplete((value, error) -> token.removeOnCancel(dispose));
        return future;
    }

    private Mono<JsonNode> exchange(String operation, String path, Object body, Duration timeout) {
        return client.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(b -> new GenerationServiceException(operation, resp.statusCode().value(),
                                        truncate(b, ERROR_BODY_LIMIT))))
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new GenerationServiceException(operation, 0, "empty response")));
    }

    boolean isRetryable(Throwable throwable) {
        if (throwable instanceof GenerationServiceException gse) {
            return gse.getStatus() == 429 || gse.getStatus() >= 500;
        }
        if (throwable instanceof WebClientRequestException) return true;
        return hasCause(throwable, PrematureCloseException.class);
    }

    private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        Throwable current = throwable;
        while (current != null) {
            if (type.isInstance(current)) return true;
            current = current.getCause();
        }
        return false;
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max) + "...";
    }

    /**
     * First non-blank text value among {@code fields}, or {@code null}.
     */
    public static String text(JsonNode node, String... fields) {
        if (node == null) return null;
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                String text = value.isValueNode() ? value.asText() : value.toString();
                if (!text.isBlank()) return text.trim();
            }
        }
        return null;
    }

    public static List<String> stringList(JsonNode node, String... fields) {
        List<String> out = new ArrayList<>();
        if (node == null) return out;
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isArray()) {
                for (JsonNode item : value) {
                    String text = item.asText("").trim();
                    if (!text.isEmpty()) out.add(text);
                }
                return out;
            }
        }
        return out;
    }
}
