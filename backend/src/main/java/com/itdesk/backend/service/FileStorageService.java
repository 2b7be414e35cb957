package com.itdesk.backend.service;

import com.itdesk.backend.exception.BadRequestException;
import com.itdesk.backend.exception.FileStorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.PathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Anexos gravados em disco local com nome aleatório; o nome original e o MIME
 * ficam no banco para o download.
 */
@Service
@Slf4j
public class FileStorageService {

    public static final long MAX_FILE_SIZE = 5L * 1024 * 1024;

    public static final Set<String> ALLOWED_TYPES = Set.of(
        "application/pdf",
        "image/png",
        "image/jpeg",
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document"
    );

    @Value("${itdesk.upload.dir:uploads}")
    private String uploadDir;

    private Path rootLocation;

    @PostConstruct
    public void init() {
        this.rootLocation = Paths.get(uploadDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(rootLocation);
        } catch (IOException e) {
            throw new FileStorageException("Could not create upload directory " + rootLocation, e);
        }
        log.info("Attachments stored under {}", rootLocation);
    }

    public void validate(MultipartFile file) {
        if (file.isEmpty()) {
            throw new BadRequestException("File cannot be empty.");
        }
        if (file.getSize() > MAX_FILE_SIZE) {
            throw new BadRequestException("File too large. Maximum size is 5MB.");
        }
        if (file.getContentType() == null || !ALLOWED_TYPES.contains(file.getContentType())) {
            throw new BadRequestException("Invalid file type. Only PDF, PNG, JPG, and DOCX files are allowed.");
        }
    }

    /** Grava o arquivo e devolve o nome gerado ({@code uuid + extensão}). */
    public String store(MultipartFile file) {
        validate(file);
        String storedName = UUID.randomUUID() + extensionOf(file.getOriginalFilename());
        Path destination = resolve(storedName);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new FileStorageException("Failed to store file " + file.getOriginalFilename(), e);
        }
        return storedName;
    }

    public Optional<Resource> load(String storedName) {
        Path file = resolve(storedName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(new PathResource(file));
    }

    public void delete(String storedName) {
        try {
            Files.deleteIfExists(resolve(storedName));
        } catch (IOException e) {
            log.warn("Could not delete stored file {}: {}", storedName, e.getMessage());
        }
    }

    private Path resolve(String storedName) {
        Path file = rootLocation.resolve(storedName).normalize();
        if (!file.startsWith(rootLocation)) {
            throw new BadRequestException("Invalid file name.");
        }
        return file;
    }

    static String extensionOf(String originalName) {
        String extension = StringUtils.getFilenameExtension(StringUtils.cleanPath(originalName == null ? "" : originalName));
        return extension == null || extension.isBlank() ? "" : "." + extension.toLowerCase(Locale.ROOT);
    }

    void setUploadDir(String uploadDir) {
        this.uploadDir = uploadDir;
    }
}
