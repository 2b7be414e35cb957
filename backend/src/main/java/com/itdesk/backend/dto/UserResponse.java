package com.itdesk.backend.dto;

import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;

import java.time.LocalDateTime;
import java.util.UUID;

/** Visão segura do usuário: nunca inclui o hash da senha. */
public record UserResponse(
    UUID id,
    String employeeId,
    String username,
    String name,
    String email,
    String mobile,
    String department,
    String designation,
    Role role,
    LocalDateTime createdAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(
            user.getId(),
            user.getEmployeeId(),
            user.getUsername(),
            user.getName(),
            user.getEmail(),
            user.getMobile(),
            user.getDepartment(),
            user.getDesignation(),
            user.getRole(),
            user.getCreatedAt()
        );
    }
}
