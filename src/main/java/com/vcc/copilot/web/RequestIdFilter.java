package com.vcc.copilot.web;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Echoes or assigns {@code X-Request-Id} and exposes it to handlers as an exchange attribute.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String REQUEST_ID_ATTR = RequestIdFilter.class.getName() + ".requestId";
    private static final int MAX_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = resolveRequestId(exchange);
        exchange.getAttributes().put(REQUEST_ID_ATTR, requestId);
        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        return chain.filter(exchange);
    }

    /**
     * Request id of the exchange, or "n/a" when the filter did not run.
     */
    public static String requestId(ServerWebExchange exchange) {
        String requestId = exchange.getAttribute(REQUEST_ID_ATTR);
        return requestId != null ? requestId : "n/a";
    }

    private String resolveRequestId(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header) && header.trim().length() <= MAX_LENGTH) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }
}
