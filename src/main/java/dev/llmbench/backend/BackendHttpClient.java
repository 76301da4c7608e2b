package dev.llmbench.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.llmbench.config.LlmBenchConfig;
import dev.llmbench.json.LlmBenchJsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * The HTTP collaborator of {@link BackendAdapter}: POST a JSON body, return the parsed JSON reply.
 *
 * <p>Implementations do not retry. Every failure surfaces as a {@link BackendException}.
 */
public interface BackendHttpClient {
    /**
     * POST {@code body} serialized as JSON to {@code uri}.
     *
     * @return the reply body, unmodified. A newline-delimited stream of JSON objects is returned
     *     as an array of those objects.
     * @throws BackendException on transport failure, timeout, non-2xx status or unparseable body
     */
    JsonNode postJson(@Nonnull URI uri, @Nonnull Object body, @Nonnull Duration timeout)
            throws BackendException;

    static BackendHttpClient of(LlmBenchConfig config) {
        return new HttpImpl(config);
    }

    @Slf4j
    class HttpImpl implements BackendHttpClient {
        private final HttpClient httpClient;
        private final ObjectMapper objectMapper;

        HttpImpl(LlmBenchConfig config) {
            this(createDefaultHttpClient(config));
        }

        HttpImpl(HttpClient httpClient) {
            this.httpClient = httpClient;
            this.objectMapper = LlmBenchJsonMapper.get();
        }

        @Override
        public JsonNode postJson(
                @Nonnull URI uri, @Nonnull Object body, @Nonnull Duration timeout) {
            try {
                return postAsync(uri, body, timeout).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendException("Interrupted while calling " + uri, e);
            } catch (ExecutionException e) {
                throw translate(uri, timeout, e.getCause());
            }
        }

        private CompletableFuture<JsonNode> postAsync(URI uri, Object body, Duration timeout) {
            try {
                var jsonBody = objectMapper.writeValueAsString(body);

                var request =
                        HttpRequest.newBuilder()
                                .uri(uri)
                                .header("Content-Type", "application/json")
                                .header("Accept", "application/json")
                                .timeout(timeout)
                                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                                .build();

                log.debug("Backend Request: {} {} - {}", request.method(), uri, jsonBody);
                return httpClient
                        .sendAsync(request, HttpResponse.BodyHandlers.ofString())
                        .thenApply(this::handleResponse);
            } catch (JsonProcessingException e) {
                return CompletableFuture.failedFuture(
                        new BackendException("Failed to serialize request body", e));
            }
        }

        private JsonNode handleResponse(HttpResponse<String> response) {
            log.debug("Backend Response: {} - {}", response.statusCode(), response.body());

            if (response.statusCode() >= 200 && response.statusCode() < 300) {
                return parseBody(response.body());
            } else {
                log.warn(
                        "Backend request failed with status {}: {}",
                        response.statusCode(),
                        response.body());
                throw new BackendException(
                        String.format(
                                "Backend request failed with status %d: %s",
                                response.statusCode(), response.body()),
                        response.statusCode(),
                        null);
            }
        }

        /** Concatenated values (a streamed reply) are returned as an array. */
        private JsonNode parseBody(String body) {
            var values = new ArrayList<JsonNode>();
            try (var iterator = objectMapper.readerFor(JsonNode.class).<JsonNode>readValues(body)) {
                while (iterator.hasNextValue()) {
                    values.add(iterator.nextValue());
                }
            } catch (IOException e) {
                throw new BackendException("Failed to parse response body", e);
            }
            if (values.isEmpty()) {
                return objectMapper.missingNode();
            }
            if (values.size() == 1) {
                return values.get(0);
            }
            return objectMapper.createArrayNode().addAll(values);
        }

        private static BackendException translate(URI uri, Duration timeout, Throwable cause) {
            if (cause instanceof BackendException backendException) {
                return backendException;
            }
            if (cause instanceof HttpTimeoutException) {
                return new BackendException(
                        "Backend request to %s timed out after %ss"
                                .formatted(uri, timeout.toSeconds()),
                        cause);
            }
            return new BackendException(
                    "Backend request to %s failed: %s".formatted(uri, cause), cause);
        }

        private static HttpClient createDefaultHttpClient(LlmBenchConfig config) {
            return HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build();
        }
    }

    /** Implementation for test doubling */
    class InMemoryImpl implements BackendHttpClient {
        private final Map<String, Function<JsonNode, JsonNode>> responders =
                new LinkedHashMap<>();
        private final List<Exchange> exchanges = Collections.synchronizedList(new ArrayList<>());

        /** A request received by this client, body converted to its JSON tree */
        public record Exchange(URI uri, JsonNode body, Duration timeout) {}

        /** Answer every POST whose path ends with {@code pathSuffix}. */
        public InMemoryImpl respond(String pathSuffix, Function<JsonNode, JsonNode> responder) {
            responders.put(pathSuffix, responder);
            return this;
        }

        public InMemoryImpl respond(String pathSuffix, String replyJson) {
            var reply = LlmBenchJsonMapper.fromJson(replyJson, JsonNode.class);
            return respond(pathSuffix, requestBody -> reply);
        }

        public InMemoryImpl fail(String pathSuffix, String message) {
            return respond(
                    pathSuffix,
                    requestBody -> {
                        throw new BackendException(message);
                    });
        }

        public List<Exchange> exchanges() {
            return List.copyOf(exchanges);
        }

        @Override
        public JsonNode postJson(
                @Nonnull URI uri, @Nonnull Object body, @Nonnull Duration timeout) {
            var tree = LlmBenchJsonMapper.toTree(body);
            exchanges.add(new Exchange(uri, tree, timeout));
            for (var entry : responders.entrySet()) {
                if (uri.getPath().endsWith(entry.getKey())) {
                    return entry.getValue().apply(tree);
                }
            }
            throw new BackendException("No canned reply for " + uri);
        }
    }
}
