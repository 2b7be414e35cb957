package com.itdesk.backend.controller;

import com.itdesk.backend.config.security.SessionCookies;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.dto.AuthDTOs.CurrentUserResponse;
import com.itdesk.backend.dto.AuthDTOs.LoginRequest;
import com.itdesk.backend.dto.AuthDTOs.MessageResponse;
import com.itdesk.backend.dto.UserResponse;
import com.itdesk.backend.service.ActivityLogService;
import com.itdesk.backend.service.AuthService;
import com.itdesk.backend.service.TokenService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;
    private final TokenService tokenService;
    private final SessionCookies sessionCookies;
    private final ActivityLogService activityLogService;

    // --- LOGIN (username ou matrícula) ---
    @PostMapping("/login")
    public ResponseEntity<CurrentUserResponse> login(@Valid @RequestBody LoginRequest request,
                                                     HttpServletRequest httpRequest) {
        User user;
        try {
            user = authService.authenticate(request.username(), request.password());
        } catch (BadCredentialsException e) {
            activityLogService.recordLogin(null, httpRequest, false, e.getMessage());
            throw e;
        }

        String token = tokenService.generateToken(user);
        activityLogService.recordLogin(user.getId(), httpRequest, true, null);
        log.info("User {} logged in", user.getUsername());

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.create(token, tokenService.getExpirationSeconds()).toString())
                .body(new CurrentUserResponse(UserResponse.from(user)));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@AuthenticationPrincipal User user, HttpServletRequest httpRequest) {
        activityLogService.recordLogout(user != null ? user.getId() : null, httpRequest);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString())
                .body(new MessageResponse("Logged out successfully"));
    }

    @GetMapping("/me")
    public CurrentUserResponse me(@AuthenticationPrincipal User user) {
        return new CurrentUserResponse(UserResponse.from(user));
    }
}
