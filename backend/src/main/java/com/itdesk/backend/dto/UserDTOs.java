package com.itdesk.backend.dto;

import com.itdesk.backend.domain.enums.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public class UserDTOs {

    public record CreateUserRequest(
        @NotBlank String employeeId,
        String username,
        @NotBlank @Size(min = 6, message = "Password must be at least 6 characters long") String password,
        @NotBlank String name,
        @NotBlank @Email String email,
        String mobile,
        String department,
        String designation,
        Role role
    ) {}

    // Atualização parcial: campos nulos não são alterados
    public record UpdateUserRequest(
        String employeeId,
        String username,
        @Size(min = 6, message = "Password must be at least 6 characters long") String password,
        String name,
        @Email String email,
        String mobile,
        String department,
        String designation,
        Role role
    ) {}

    public record ResetPasswordRequest(
        @NotBlank @Size(min = 6, message = "Password must be at least 6 characters long") String password
    ) {}

    public record BulkCreateUsersRequest(@NotEmpty(message = "Users array is required and cannot be empty") List<CreateUserRequest> users) {}

    public record BulkDeleteUsersRequest(@NotEmpty(message = "Employee IDs array is required") List<String> employeeIds) {}

    public record BulkCreateResult(String message, List<UserResponse> results, List<RowError> errors) {}

    public record RowError(int index, Map<String, String> data, List<String> errors) {}

    // conflicts: matrículas que não puderam ser removidas por terem chamados ou comentários
    public record BulkDeleteResult(String message, int deleted, List<String> notFound, List<String> conflicts) {}
}
