package com.coachvault.vaultbackend.download;

import java.time.Instant;

public record IssuedDownloadToken(String token, Instant expiresAt) {
}
