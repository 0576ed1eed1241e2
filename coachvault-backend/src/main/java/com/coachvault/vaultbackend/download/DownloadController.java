package com.coachvault.vaultbackend.download;

import com.coachvault.vaultbackend.resource.Resource;
import com.coachvault.vaultbackend.resource.ResourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/downloads")
@RequiredArgsConstructor
@Slf4j
public class DownloadController {

    private final DownloadService downloadService;
    private final ResourceRepository resourceRepository;
    private final Clock clock;

    @Value("${app.upload.root:uploads}")
    private String uploadRoot;

    @GetMapping("/{resourceId}")
    public Map<String, Object> requestDownload(@PathVariable Long resourceId, Authentication authentication) {
        IssuedDownloadToken issued = downloadService.requestDownload(authentication.getName(), resourceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "You do not have access to this resource"));

        long expiresIn = Math.max(0, Duration.between(clock.instant(), issued.expiresAt()).getSeconds());
        return Map.of(
                "token", issued.token(),
                "expiresAt", issued.expiresAt().toString(),
                "expiresIn", expiresIn
        );
    }

    // The token is the credential here; no session is needed
    @GetMapping("/secure/{token}")
    public ResponseEntity<FileSystemResource> secureDownload(@PathVariable String token) {
        DownloadService.RedeemResult result = downloadService.redeem(token);

        switch (result.status()) {
            case INVALID_TOKEN -> throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid or expired download token");
            case DENIED -> throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Access denied");
            default -> {
            }
        }

        Resource resource = resourceRepository.findById(result.grant().resourceId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Resource not found"));

        Path file = resolveStoredFile(resource.getStoragePath());
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("File for resource {} is missing on disk", resource.getId());
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found");
        }

        downloadService.recordCompleted(result.grant());

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.getFileName() + "\"")
                .body(new FileSystemResource(file));
    }

    private Path resolveStoredFile(String storagePath) {
        if (storagePath == null || storagePath.isBlank()) return null;

        Path base = Paths.get(uploadRoot).toAbsolutePath().normalize();
        Path resolved = base.resolve(storagePath).normalize();
        // Stay inside the upload root
        return resolved.startsWith(base) ? resolved : null;
    }
}
