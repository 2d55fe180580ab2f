package io.procjobs.backend.util;

import io.procjobs.backend.model.query.Requester;

import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RequesterResolverTest {

    private final RequesterResolver resolver = new RequesterResolver("admin");

    @Test
    void resolve_NoToken_ShouldBeAnonymous() {
        assertThat(resolver.resolve(null).isAnonymous()).isTrue();
    }

    @Test
    void resolve_PlainUser_ShouldNotBeAdmin() {
        Jwt jwt = token().subject("alice").claim("roles", List.of("user")).build();

        assertThat(resolver.resolve(jwt)).isEqualTo(Requester.user("alice"));
    }

    @Test
    void resolve_AdminRoleClaim_ShouldBeAdmin() {
        Jwt jwt = token().subject("root").claim("roles", List.of("user", "admin")).build();

        Requester requester = resolver.resolve(jwt);

        assertThat(requester.isAdmin()).isTrue();
        assertThat(requester.getUserId()).isEqualTo("root");
    }

    @Test
    void resolve_AdminScope_ShouldBeAdmin() {
        Jwt jwt = token().subject("ops").claim("scope", "read admin").build();

        assertThat(resolver.resolve(jwt).isAdmin()).isTrue();
    }

    private static Jwt.Builder token() {
        return Jwt.withTokenValue("token")
                .header("alg", "HS256")
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(60));
    }
}
