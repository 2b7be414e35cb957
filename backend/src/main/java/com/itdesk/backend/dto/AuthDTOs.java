package com.itdesk.backend.dto;

import jakarta.validation.constraints.NotBlank;

public class AuthDTOs {

    // username também aceita a matrícula (employeeId)
    public record LoginRequest(@NotBlank String username, @NotBlank String password) {}

    public record CurrentUserResponse(UserResponse user) {}

    public record MessageResponse(String message) {}
}
