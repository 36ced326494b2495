package com.vcc.copilot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.error.ErrorKind;
import com.vcc.copilot.error.UpstreamException;
import com.vcc.copilot.model.ChatTurn;
import com.vcc.copilot.model.GenerationOptions;
import com.vcc.copilot.model.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Client for an OpenAI-compatible chat completions endpoint.
 * Failures are classified into upstream error kinds and never retried here.
 */
@Service
public class UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final KeyPool keyPool;
    private final String chatPath;
    private final Duration timeout;

    public UpstreamClient(WebClient.Builder builder,
                          ObjectMapper objectMapper,
                          CopilotProperties properties,
                          KeyPool keyPool) {
        CopilotProperties.UpstreamConfig upstream = properties.getUpstream();
        this.timeout = Duration.ofSeconds(upstream.getTimeoutSeconds());

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(timeout);

        this.webClient = builder
                .baseUrl(upstream.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        this.objectMapper = objectMapper;
        this.keyPool = keyPool;
        this.chatPath = upstream.getChatPath();
        log.info("UpstreamClient initialized with baseUrl={}, timeout={}s",
                upstream.getBaseUrl(), upstream.getTimeoutSeconds());
    }

    /**
     * Send one chat completion request.
     *
     * @param messages system message plus conversation turns, in order
     * @param options  effective model parameters
     * @return parsed completion; errors with {@link UpstreamException} on provider failure
     */
    public Mono<GenerationResult> complete(List<ChatTurn> messages, GenerationOptions options) {
        ObjectNode body = requestBody(messages, options);
        String apiKey = keyPool.nextKey();

        WebClient.RequestBodySpec request = webClient.post()
                .uri(chatPath)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        if (apiKey != null) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        return request
                .bodyValue(body)
                .exchangeToMono(response -> {
                    HttpStatusCode status = response.statusCode();
                    if (status.is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class)
                                .switchIfEmpty(Mono.error(() -> new UpstreamException(
                                        ErrorKind.UPSTREAM_MALFORMED, "Empty completion body")));
                    }
                    return response.releaseBody()
                            .then(Mono.<JsonNode>error(statusError(status)));
                })
                .map(json -> parseCompletion(json, options.model()))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof UpstreamException), UpstreamClient::classify)
                .doOnNext(result -> log.debug("Upstream completion: model={}, tokens={}, finish={}",
                        result.model(), result.tokensUsed(), result.finishReason()))
                .doOnError(e -> log.warn("Upstream call failed: {}", e.getMessage()));
    }

    ObjectNode requestBody(List<ChatTurn> messages, GenerationOptions options) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", options.model());
        body.put("max_tokens", options.maxTokens());
        body.put("temperature", options.temperature());
        body.put("stream", false);
        ArrayNode array = body.putArray("messages");
        for (ChatTurn turn : messages) {
            array.addObject()
                    .put("role", turn.role())
                    .put("content", turn.content());
        }
        return body;
    }

    /**
     * Parse {@code choices[0].message.content}, {@code choices[0].finish_reason} and
     * {@code usage.total_tokens}. Only the content is mandatory.
     */
    static GenerationResult parseCompletion(JsonNode json, String requestedModel) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        if (!content.isTextual()) {
            throw new UpstreamException(ErrorKind.UPSTREAM_MALFORMED, "Completion has no message content");
        }
        JsonNode finish = choice.path("finish_reason");
        JsonNode model = json.path("model");
        return new GenerationResult(
                content.asText(),
                model.isTextual() ? model.asText() : requestedModel,
                json.path("usage").path("total_tokens").asInt(0),
                finish.isTextual() ? finish.asText() : "unknown");
    }

    static UpstreamException statusError(HttpStatusCode status) {
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new UpstreamException(ErrorKind.UPSTREAM_RATE_LIMITED, "Provider rate limit reached");
        }
        if (status.is5xxServerError()) {
            return new UpstreamException(ErrorKind.UPSTREAM_UNAVAILABLE, "Provider returned " + status.value());
        }
        return new UpstreamException(ErrorKind.UPSTREAM_MALFORMED, "Provider rejected request with " + status.value());
    }

    static UpstreamException classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return new UpstreamException(ErrorKind.UPSTREAM_TIMEOUT, "Provider did not answer in time", error);
        }
        if (error instanceof CodecException) {
            return new UpstreamException(ErrorKind.UPSTREAM_MALFORMED, "Provider payload unreadable", error);
        }
        if (error instanceof WebClientRequestException) {
            return new UpstreamException(ErrorKind.UPSTREAM_UNAVAILABLE, "Provider unreachable", error);
        }
        return new UpstreamException(ErrorKind.UPSTREAM_UNAVAILABLE, "Provider call failed", error);
    }
}
