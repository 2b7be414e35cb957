package com.itdesk.backend.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String message,
    int status,
    String path,
    LocalDateTime timestamp,
    List<FieldViolation> errors
) {
    public static ErrorResponse of(String message, int status, String path) {
        return new ErrorResponse(message, status, path, LocalDateTime.now(), null);
    }

    public record FieldViolation(String field, String message) {}
}
