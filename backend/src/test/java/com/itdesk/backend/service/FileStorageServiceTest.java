package com.itdesk.backend.service;

import com.itdesk.backend.exception.BadRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileStorageServiceTest {

    @TempDir
    Path uploadDir;

    private FileStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new FileStorageService();
        storage.setUploadDir(uploadDir.toString());
        storage.init();
    }

    @Test
    void storesFileUnderRandomNameKeepingExtension() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "attachments", "Screenshot.PNG", "image/png", new byte[]{1, 2, 3});

        String storedName = storage.store(file);

        assertThat(storedName).matches("[0-9a-f\\-]{36}\\.png");
        assertThat(Files.readAllBytes(uploadDir.resolve(storedName))).containsExactly(1, 2, 3);

        Optional<Resource> loaded = storage.load(storedName);
        assertThat(loaded).isPresent();
        assertThat(loaded.get().contentLength()).isEqualTo(3);
    }

    @Test
    void rejectsUnsupportedType() {
        MockMultipartFile file = new MockMultipartFile("attachments", "run.exe", "application/octet-stream", new byte[]{1});

        assertThatThrownBy(() -> storage.store(file))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Invalid file type");
    }

    @Test
    void rejectsFilesOverFiveMegabytes() {
        byte[] big = new byte[(int) FileStorageService.MAX_FILE_SIZE + 1];
        MockMultipartFile file = new MockMultipartFile("attachments", "big.pdf", "application/pdf", big);

        assertThatThrownBy(() -> storage.store(file))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("File too large. Maximum size is 5MB.");
    }

    @Test
    void deleteRemovesFileAndLoadReportsMissing() {
        MockMultipartFile file = new MockMultipartFile("attachments", "report.pdf", "application/pdf", new byte[]{9});
        String storedName = storage.store(file);

        storage.delete(storedName);

        assertThat(storage.load(storedName)).isEmpty();
    }

    @Test
    void refusesPathsOutsideUploadDirectory() {
        assertThatThrownBy(() -> storage.load("../secret.txt")).isInstanceOf(BadRequestException.class);
    }

    @Test
    void extensionIsOptional() {
        assertThat(FileStorageService.extensionOf("README")).isEmpty();
        assertThat(FileStorageService.extensionOf("contract.final.DOCX")).isEqualTo(".docx");
    }
}
