package com.knowledgedesk.ragbot.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts exactly one shared bearer token for the admin API.
 */
public class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    static final String ADMIN_PRINCIPAL = "ragbot-admin";
    static final String ADMIN_ROLE = "ROLE_ADMIN";

    private final byte[] expectedToken;

    public StaticTokenAuthenticationManager(String expectedToken) {
        if (expectedToken == null || expectedToken.isBlank()) {
            throw new IllegalArgumentException("Admin token must not be blank");
        }
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer) || bearer.getToken() == null) {
            return Mono.error(new BadCredentialsException("Bearer token required"));
        }
        // constant-time comparison
        if (!MessageDigest.isEqual(expectedToken, bearer.getToken().getBytes(StandardCharsets.UTF_8))) {
            return Mono.error(new BadCredentialsException("Invalid admin token"));
        }
        return Mono.just(new UsernamePasswordAuthenticationToken(ADMIN_PRINCIPAL, null,
                AuthorityUtils.createAuthorityList(ADMIN_ROLE)));
    }
}
