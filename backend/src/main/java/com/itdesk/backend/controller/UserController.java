package com.itdesk.backend.controller;

import com.itdesk.backend.domain.User;
import com.itdesk.backend.dto.AuthDTOs.MessageResponse;
import com.itdesk.backend.dto.UserDTOs.BulkCreateResult;
import com.itdesk.backend.dto.UserDTOs.BulkCreateUsersRequest;
import com.itdesk.backend.dto.UserDTOs.BulkDeleteResult;
import com.itdesk.backend.dto.UserDTOs.BulkDeleteUsersRequest;
import com.itdesk.backend.dto.UserDTOs.CreateUserRequest;
import com.itdesk.backend.dto.UserDTOs.ResetPasswordRequest;
import com.itdesk.backend.dto.UserDTOs.UpdateUserRequest;
import com.itdesk.backend.dto.UserResponse;
import com.itdesk.backend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.UUID;

/** Cadastro de usuários. Todas as rotas exigem ADMIN (ver SecurityConfig). */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final UserService userService;

    @GetMapping
    public List<UserResponse> list() {
        return userService.list();
    }

    @GetMapping("/{id}")
    public UserResponse get(@PathVariable UUID id) {
        return userService.get(id);
    }

    @PostMapping
    public ResponseEntity<UserResponse> create(@Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(request));
    }

    @PutMapping("/{id}")
    public UserResponse update(@PathVariable UUID id, @Valid @RequestBody UpdateUserRequest request) {
        return userService.update(id, request);
    }

    @PutMapping("/{id}/reset-password")
    public MessageResponse resetPassword(@PathVariable UUID id, @Valid @RequestBody ResetPasswordRequest request) {
        userService.resetPassword(id, request.password());
        return new MessageResponse("Password reset successfully");
    }

    @DeleteMapping("/{id}")
    public MessageResponse delete(@AuthenticationPrincipal User admin, @PathVariable UUID id) {
        userService.delete(admin, id);
        return new MessageResponse("User deleted successfully");
    }

    // --- OPERAÇÕES EM LOTE ---
    @PostMapping("/bulk")
    public ResponseEntity<BulkCreateResult> bulkCreate(@Valid @RequestBody BulkCreateUsersRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.bulkCreate(request.users()));
    }

    @DeleteMapping("/bulk")
    public BulkDeleteResult bulkDelete(@AuthenticationPrincipal User admin,
                                       @Valid @RequestBody BulkDeleteUsersRequest request) {
        return userService.bulkDelete(admin, request.employeeIds());
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BulkCreateResult> importCsv(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.importCsv(file));
    }

    @GetMapping("/import-template")
    public ResponseEntity<InputStreamResource> importTemplate() {
        return csv("user-import-template.csv", userService.importTemplate());
    }

    @GetMapping("/export")
    public ResponseEntity<InputStreamResource> export() {
        return csv("users.csv", userService.exportCsv());
    }

    static ResponseEntity<InputStreamResource> csv(String filename, ByteArrayInputStream content) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(TEXT_CSV)
                .body(new InputStreamResource(content));
    }
}
