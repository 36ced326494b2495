package com.vcc.copilot.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.copilot.auth.PortalTokenVerifier;
import com.vcc.copilot.dto.ErrorResponse;
import com.vcc.copilot.error.AuthException;
import com.vcc.copilot.model.PortalPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Bearer authentication for the portal copilot endpoints.
 * Every failure gets the same 401 body; the reason is only logged.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class PortalAuthenticationFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(PortalAuthenticationFilter.class);

    static final String COPILOT_PATH_PREFIX = "/portal/copilot";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String PRINCIPAL_ATTR = PortalAuthenticationFilter.class.getName() + ".principal";

    private final PortalTokenVerifier tokenVerifier;
    private final ObjectMapper objectMapper;

    public PortalAuthenticationFilter(PortalTokenVerifier tokenVerifier, ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.startsWith(COPILOT_PATH_PREFIX)) {
            return chain.filter(exchange);
        }

        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            log.debug("requestId={} missing bearer credential for {}", RequestIdFilter.requestId(exchange), path);
            return unauthorized(exchange);
        }

        PortalPrincipal principal;
        try {
            principal = tokenVerifier.verify(header.substring(BEARER_PREFIX.length()));
        } catch (AuthException e) {
            log.info("requestId={} rejected credential: {}", RequestIdFilter.requestId(exchange), e.getAuthReason());
            return unauthorized(exchange);
        }

        exchange.getAttributes().put(PRINCIPAL_ATTR, principal);
        log.debug("requestId={} authenticated subject {}", RequestIdFilter.requestId(exchange), principal.getSubjectId());
        return chain.filter(exchange);
    }

    /**
     * Principal stored by this filter.
     *
     * @throws AuthException when the exchange was not authenticated
     */
    public static PortalPrincipal principal(ServerWebExchange exchange) {
        PortalPrincipal principal = exchange.getAttribute(PRINCIPAL_ATTR);
        if (principal == null) {
            throw new AuthException(AuthException.Reason.MISSING_CREDENTIAL, "Authentication required");
        }
        return principal;
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(ErrorResponse.of(AuthException.CODE, AuthException.PUBLIC_MESSAGE));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize 401 body: {}", e.getMessage());
            bytes = "{\"success\":false,\"error\":{\"code\":\"UNAUTHORIZED\"}}".getBytes(StandardCharsets.UTF_8);
        }

        return exchange.getResponse().writeWith(
                Mono.just(exchange.getResponse().bufferFactory().wrap(bytes))
        );
    }
}
