package com.itdesk.backend.controller;

import com.itdesk.backend.domain.Setting;
import com.itdesk.backend.dto.AuthDTOs.MessageResponse;
import com.itdesk.backend.dto.SettingDTOs.BulkSettingsRequest;
import com.itdesk.backend.dto.SettingDTOs.SettingRequest;
import com.itdesk.backend.dto.SettingDTOs.SettingValueRequest;
import com.itdesk.backend.dto.SettingDTOs.TestEmailRequest;
import com.itdesk.backend.service.EmailService;
import com.itdesk.backend.service.SettingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Configurações do sistema (SMTP, templates de e-mail). ADMIN apenas. */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingController {

    private final SettingService settingService;
    private final EmailService emailService;

    @GetMapping
    public List<Setting> list(@RequestParam(required = false) String category) {
        return settingService.list(category);
    }

    @GetMapping("/{key}")
    public Setting get(@PathVariable String key) {
        return settingService.get(key);
    }

    @PostMapping
    public ResponseEntity<Setting> upsert(@Valid @RequestBody SettingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(settingService.upsert(request));
    }

    @PutMapping("/{key}")
    public Setting update(@PathVariable String key, @Valid @RequestBody SettingValueRequest request) {
        return settingService.updateValue(key, request.value());
    }

    @PostMapping("/bulk")
    public ResponseEntity<List<Setting>> bulk(@Valid @RequestBody BulkSettingsRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(settingService.upsertAll(request.settings()));
    }

    // Envio síncrono: falha de SMTP volta como 500 com a mensagem do servidor de e-mail
    @PostMapping("/test-email")
    public MessageResponse testEmail(@Valid @RequestBody TestEmailRequest request) {
        emailService.sendTestEmail(request.email(), request.settings());
        return new MessageResponse("Test email sent successfully to " + request.email());
    }
}
