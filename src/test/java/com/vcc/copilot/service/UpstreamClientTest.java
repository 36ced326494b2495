package com.vcc.copilot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.error.ErrorKind;
import com.vcc.copilot.error.UpstreamException;
import com.vcc.copilot.model.ChatTurn;
import com.vcc.copilot.model.GenerationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamClientTest {

    private static final List<ChatTurn> MESSAGES = List.of(
            ChatTurn.system("guardrails"), new ChatTurn(ChatTurn.USER, "Status?"));
    private static final GenerationOptions OPTIONS = new GenerationOptions("test-model", 512, 0.2);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();
    private CopilotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CopilotProperties();
        properties.getUpstream().setBaseUrl("http://llm.test");
        properties.getUpstream().setApiKeys(List.of("sk-test-key-one", "sk-test-key-two"));
        properties.getUpstream().setTimeoutSeconds(5);
    }

    private UpstreamClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new UpstreamClient(WebClient.builder().exchangeFunction(recording), objectMapper, properties,
                new KeyPool(properties));
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void parsesContentFinishReasonAndTokenUsage() {
        String body = "{\"model\":\"test-model-0301\",\"choices\":[{\"message\":{\"role\":\"assistant\","
                + "\"content\":\"Launch is in May.\"},\"finish_reason\":\"stop\"}],\"usage\":{\"total_tokens\":321}}";

        StepVerifier.create(client(respond(HttpStatus.OK, body)).complete(MESSAGES, OPTIONS))
                .assertNext(result -> {
                    assertThat(result.text()).isEqualTo("Launch is in May.");
                    assertThat(result.model()).isEqualTo("test-model-0301");
                    assertThat(result.tokensUsed()).isEqualTo(321);
                    assertThat(result.finishReason()).isEqualTo("stop");
                })
                .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo("http://llm.test/v1/chat/completions");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test-key-one");
    }

    @Test
    void rotatesKeysBetweenCalls() {
        String body = "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}";
        UpstreamClient client = client(respond(HttpStatus.OK, body));

        client.complete(MESSAGES, OPTIONS).block();
        client.complete(MESSAGES, OPTIONS).block();

        assertThat(requests).extracting(r -> r.headers().getFirst(HttpHeaders.AUTHORIZATION))
                .containsExactly("Bearer sk-test-key-one", "Bearer sk-test-key-two");
    }

    @Test
    void missingUsageAndFinishReasonFallBackToDefaults() {
        String body = "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}";

        StepVerifier.create(client(respond(HttpStatus.OK, body)).complete(MESSAGES, OPTIONS))
                .assertNext(result -> {
                    assertThat(result.model()).isEqualTo("test-model");
                    assertThat(result.tokensUsed()).isZero();
                    assertThat(result.finishReason()).isEqualTo("unknown");
                })
                .verifyComplete();
    }

    @Test
    void missingContentIsMalformed() {
        StepVerifier.create(client(respond(HttpStatus.OK, "{\"choices\":[]}")).complete(MESSAGES, OPTIONS))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_MALFORMED, false))
                .verify();
    }

    @Test
    void unparseableBodyIsMalformed() {
        StepVerifier.create(client(respond(HttpStatus.OK, "<html>oops</html>")).complete(MESSAGES, OPTIONS))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_MALFORMED, false))
                .verify();
    }

    @Test
    void providerRateLimitIsRetryable() {
        StepVerifier.create(client(respond(HttpStatus.TOO_MANY_REQUESTS, "{}")).complete(MESSAGES, OPTIONS))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_RATE_LIMITED, true))
                .verify();
    }

    @Test
    void serverErrorIsUnavailable() {
        StepVerifier.create(client(respond(HttpStatus.BAD_GATEWAY, "{}")).complete(MESSAGES, OPTIONS))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_UNAVAILABLE, true))
                .verify();
    }

    @Test
    void rejectedRequestIsMalformed() {
        StepVerifier.create(client(respond(HttpStatus.BAD_REQUEST, "{\"error\":\"bad\"}")).complete(MESSAGES, OPTIONS))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_MALFORMED, false))
                .verify();
    }

    @Test
    void connectionFailureIsUnavailable() {
        ExchangeFunction refused = request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST,
                URI.create("http://llm.test/v1/chat/completions"), new HttpHeaders()));

        StepVerifier.create(client(refused).complete(MESSAGES, OPTIONS))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_UNAVAILABLE, true))
                .verify();
    }

    @Test
    void slowProviderTimesOut() {
        UpstreamClient client = client(request -> Mono.never());

        StepVerifier.withVirtualTime(() -> client.complete(MESSAGES, OPTIONS))
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(6))
                .expectErrorSatisfies(e -> assertKind(e, ErrorKind.UPSTREAM_TIMEOUT, true))
                .verify();
    }

    @Test
    void requestBodyCarriesModelParametersAndMessages() {
        JsonNode body = client(respond(HttpStatus.OK, "{}")).requestBody(MESSAGES, OPTIONS);

        assertThat(body.path("model").asText()).isEqualTo("test-model");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(512);
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.2);
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").path(1).path("content").asText()).isEqualTo("Status?");
    }

    private static void assertKind(Throwable error, ErrorKind kind, boolean retryable) {
        assertThat(error).isInstanceOf(UpstreamException.class);
        UpstreamException upstream = (UpstreamException) error;
        assertThat(upstream.getKind()).isEqualTo(kind);
        assertThat(upstream.isRetryable()).isEqualTo(retryable);
    }
}
