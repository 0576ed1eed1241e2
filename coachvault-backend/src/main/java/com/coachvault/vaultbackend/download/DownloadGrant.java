package com.coachvault.vaultbackend.download;

import java.time.Instant;

/**
 * Claims of a verified download token.
 */
public record DownloadGrant(String userId, Long resourceId, Instant expiresAt, String tokenId) {
}
