package com.itdesk.backend.config.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Cookie HttpOnly + SameSite=Strict que carrega o token de sessão. */
@Component
public class SessionCookies {

    @Value("${itdesk.session.cookie-name:ITDESK_SESSION}")
    private String cookieName;

    @Value("${itdesk.session.secure-cookie:false}")
    private boolean secure;

    public ResponseCookie create(String token, long maxAgeSeconds) {
        return base(token).maxAge(Duration.ofSeconds(maxAgeSeconds)).build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    public String read(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (cookieName.equals(cookie.getName()) && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path("/");
    }
}
