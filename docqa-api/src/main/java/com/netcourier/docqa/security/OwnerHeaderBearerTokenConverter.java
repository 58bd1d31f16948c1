package com.netcourier.docqa.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import org.springframework.security.oauth2.server.resource.web.server.authentication.ServerBearerTokenAuthenticationConverter;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Reads the bearer token and attaches the {@value #OWNER_HEADER} header as token details, so a shared static
 * token can still act on behalf of distinct owners.
 */
public class OwnerHeaderBearerTokenConverter implements ServerAuthenticationConverter {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final ServerBearerTokenAuthenticationConverter delegate = new ServerBearerTokenAuthenticationConverter();

    @Override
    public Mono<Authentication> convert(ServerWebExchange exchange) {
        String owner = exchange.getRequest().getHeaders().getFirst(OWNER_HEADER);
        return delegate.convert(exchange)
                .map(authentication -> {
                    if (owner != null && !owner.isBlank() && authentication instanceof BearerTokenAuthenticationToken bearer) {
                        bearer.setDetails(owner.trim());
                    }
                    return authentication;
                });
    }
}
