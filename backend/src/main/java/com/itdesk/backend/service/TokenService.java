package com.itdesk.backend.service;

import com.itdesk.backend.domain.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Token assinado que vai no cookie de sessão. O subject é o id do usuário;
 * o servidor não guarda estado de sessão.
 */
@Service
@Slf4j
public class TokenService {

    // Obrigatório: sem jwt.secret a aplicação não sobe
    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration:86400000}")
    private Long expiration; // 24h

    public String generateToken(User user) {
        Map<String, Object> claims = new HashMap<>();
        claims.put("role", user.getRole().toJson());
        claims.put("username", user.getUsername());
        return createToken(claims, user.getId().toString());
    }

    /** Subject do token, ou vazio quando o token é inválido ou expirou. */
    public String validateToken(String token) {
        try {
            return extractSubject(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected session token: {}", e.getMessage());
            return "";
        }
    }

    public long getExpirationSeconds() {
        return expiration / 1000;
    }

    public String extractSubject(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        return claimsResolver.apply(extractAllClaims(token));
    }

    private String createToken(Map<String, Object> claims, String subject) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(subject)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + expiration))
                .signWith(getSignKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSignKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private Key getSignKey() {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    void setSecret(String secret) {
        this.secret = secret;
    }

    void setExpiration(Long expiration) {
        this.expiration = expiration;
    }
}
