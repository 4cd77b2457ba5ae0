package com.enterprise.taskgateway.agent;

import com.enterprise.taskgateway.collaborator.AgentChunk;
import com.enterprise.taskgateway.collaborator.AgentEndpoint;
import com.enterprise.taskgateway.collaborator.AgentException;
import com.enterprise.taskgateway.collaborator.AgentReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

/**
 * Agent reached with JSON over HTTP.
 *
 * <p>{@code POST {base}/invoke} answers with an {@link AgentReply} object.
 * {@code POST {base}/stream} answers with newline-delimited JSON: one
 * {@link AgentChunk} per line, optionally closed by
 * {@code {"done": true, "agent": ..., "output": ...}}. The gateway request
 * id, when known, is sent as {@code X-Request-Id}.
 */
public class HttpAgentEndpoint implements AgentEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(HttpAgentEndpoint.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration invokeTimeout;

    public HttpAgentEndpoint(String baseUri, Duration connectTimeout, Duration invokeTimeout,
                             ObjectMapper objectMapper) {
        this.baseUri = URI.create(baseUri.endsWith("/") ? baseUri : baseUri + "/");
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
        this.objectMapper = objectMapper;
        this.invokeTimeout = invokeTimeout;
        logger.info("HttpAgentEndpoint targeting {}", this.baseUri);
    }

    @Override
    public CompletableFuture<AgentReply> invoke(JsonNode payload) {
        return invoke(payload, null);
    }

    @Override
    public CompletableFuture<AgentReply> invoke(JsonNode payload, String requestId) {
        HttpRequest request;
        try {
            request = post("invoke", payload, requestId);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<HttpResponse<String>> exchange =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        CompletableFuture<AgentReply> reply = exchange.thenApply(response -> {
            checkStatus(response.statusCode(), response.body());
            try {
                return objectMapper.readValue(response.body(), AgentReply.class);
            } catch (JsonProcessingException e) {
                throw new CompletionException(e);
            }
        });
        reply.whenComplete((value, error) -> {
            if (error != null && !exchange.isDone()) {
                exchange.cancel(true);
            }
        });
        return reply;
    }

    @Override
    public CompletableFuture<AgentReply> stream(JsonNode payload, Consumer<AgentChunk> sink) {
        return stream(payload, null, sink);
    }

    /**
     * Stream from the agent. Cancelling the returned future aborts the exchange
     * and no further chunks reach the sink.
     */
    @Override
    public CompletableFuture<AgentReply> stream(JsonNode payload, String requestId, Consumer<AgentChunk> sink) {
        HttpRequest request;
        try {
            request = post("stream", payload, requestId);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        ChunkSubscriber subscriber = new ChunkSubscriber(sink);
        HttpResponse.BodyHandler<AgentReply> handler = info -> {
            if (info.statusCode() < 200 || info.statusCode() >= 300) {
                return HttpResponse.BodySubscribers.replacing(null);
            }
            return HttpResponse.BodySubscribers.fromLineSubscriber(
                subscriber, ChunkSubscriber::finish, StandardCharsets.UTF_8, "\n");
        };

        CompletableFuture<HttpResponse<AgentReply>> exchange = httpClient.sendAsync(request, handler);
        CompletableFuture<AgentReply> reply = exchange.thenApply(response -> {
            checkStatus(response.statusCode(), null);
            return response.body();
        });
        reply.whenComplete((value, error) -> {
            if (error != null) {
                subscriber.cancel();
                if (!exchange.isDone()) {
                    exchange.cancel(true);
                }
            }
        });
        return reply;
    }

    private HttpRequest post(String path, JsonNode payload, String requestId) throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(baseUri.resolve(path))
            .timeout(invokeTimeout)
            .header("Content-Type", "application/json");
        if (requestId != null) {
            builder.header(REQUEST_ID_HEADER, requestId);
        }
        return builder
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
            .build();
    }

    private void checkStatus(int statusCode, String body) {
        if (statusCode < 200 || statusCode >= 300) {
            String detail = body == null || body.isBlank() ? "" : ": " + body;
            throw new CompletionException(
                new AgentException(statusCode, "Agent at " + baseUri + " answered " + statusCode + detail));
        }
    }

    /**
     * Parses response lines as they arrive and forwards chunks in order
     */
    private class ChunkSubscriber implements Flow.Subscriber<String> {
        private final Consumer<AgentChunk> sink;
        private final StringBuilder content = new StringBuilder();
        private volatile boolean cancelled;
        private volatile Flow.Subscription subscription;
        private AgentReply finalReply;
        private JsonProcessingException malformed;
        private long nextIndex;

        ChunkSubscriber(Consumer<AgentChunk> sink) {
            this.sink = sink;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (cancelled) {
                subscription.cancel();
            } else {
                subscription.request(Long.MAX_VALUE);
            }
        }

        @Override
        public void onNext(String line) {
            if (cancelled || malformed != null || line.isBlank()) {
                return;
            }
            try {
                JsonNode node = objectMapper.readTree(line);
                if (node.path("done").asBoolean(false)) {
                    finalReply = new AgentReply(node.path("agent").asText(null), node.get("output"));
                    return;
                }
                String text = node.path("content").asText("");
                AgentChunk chunk = new AgentChunk(node.path("index").asLong(nextIndex), text,
                                                  node.path("last").asBoolean(false));
                nextIndex = chunk.getIndex() + 1;
                content.append(text);
                sink.accept(chunk);
            } catch (JsonProcessingException e) {
                malformed = e;
            }
        }

        @Override
        public void onError(Throwable throwable) {
            logger.debug("Agent stream from {} failed", baseUri, throwable);
        }

        @Override
        public void onComplete() {
        }

        void cancel() {
            cancelled = true;
            Flow.Subscription current = subscription;
            if (current != null) {
                current.cancel();
            }
        }

        AgentReply finish() {
            if (malformed != null) {
                throw new UncheckedIOException(malformed);
            }
            return finalReply != null ? finalReply : new AgentReply(null, TextNode.valueOf(content.toString()));
        }
    }
}
