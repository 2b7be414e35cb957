package com.itdesk.backend.service;

import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TokenServiceTest {

    private TokenService tokenService;
    private User user;

    @BeforeEach
    void setUp() {
        tokenService = new TokenService();
        tokenService.setSecret("test-secret-key-with-at-least-32-bytes-for-hs256");
        tokenService.setExpiration(60_000L);

        user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("sarah.johnson");
        user.setRole(Role.AGENT);
    }

    @Test
    void subjectIsUserIdAndClaimsCarryRole() {
        String token = tokenService.generateToken(user);

        assertThat(tokenService.validateToken(token)).isEqualTo(user.getId().toString());
        String role = tokenService.extractClaim(token, claims -> claims.get("role", String.class));
        assertThat(role).isEqualTo("agent");
        assertThat(tokenService.getExpirationSeconds()).isEqualTo(60);
    }

    @Test
    void expiredTokenIsRejected() {
        tokenService.setExpiration(-1_000L);
        String token = tokenService.generateToken(user);

        assertThat(tokenService.validateToken(token)).isEmpty();
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        String token = tokenService.generateToken(user);
        tokenService.setSecret("another-secret-key-with-at-least-32-bytes-long");

        assertThat(tokenService.validateToken(token)).isEmpty();
        assertThat(tokenService.validateToken("garbage")).isEmpty();
    }
}
