package com.coachvault.vaultbackend.download;

import com.coachvault.vaultbackend.audit.AuditActions;
import com.coachvault.vaultbackend.audit.AuditService;
import com.coachvault.vaultbackend.entitlement.EntitlementDecision;
import com.coachvault.vaultbackend.entitlement.EntitlementService;
import com.coachvault.vaultbackend.resource.ResourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Download pipeline: entitlement check, token issue, and token redemption,
 * each followed by an audit record.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DownloadService {

    private final EntitlementService entitlementService;
    private final DownloadTokenService tokenService;
    private final AuditService auditService;
    private final ResourceRepository resourceRepository;

    public Optional<IssuedDownloadToken> requestDownload(String userId, Long resourceId) {
        EntitlementDecision decision = entitlementService.evaluateDownload(userId, resourceId);
        String subjectId = resourceId != null ? resourceId.toString() : null;

        if (!decision.allowed()) {
            auditService.record(userId, AuditActions.DOWNLOAD_DENY, AuditActions.SUBJECT_RESOURCE, subjectId,
                    Map.of("reason", decision.reason(), "outcome", decision.outcome().name()));
            log.debug("Download denied for user {} on resource {}: {}", userId, resourceId, decision.reason());
            return Optional.empty();
        }

        auditService.record(userId, AuditActions.DOWNLOAD_ALLOW, AuditActions.SUBJECT_RESOURCE, subjectId,
                Map.of("reason", decision.reason()));

        IssuedDownloadToken issued = tokenService.issue(userId, resourceId);
        auditService.record(userId, AuditActions.TOKEN_ISSUE, AuditActions.SUBJECT_RESOURCE, subjectId,
                Map.of("expiresAt", issued.expiresAt().toString()));
        return Optional.of(issued);
    }

    /**
     * Verifies the token and re-runs the entitlement check for its subject,
     * so access revoked after issue is still refused at transfer time.
     * Nothing is counted here; see {@link #recordCompleted(DownloadGrant)}.
     */
    public RedeemResult redeem(String token) {
        Optional<DownloadGrant> verified = tokenService.verify(token);
        if (verified.isEmpty()) {
            auditService.record(null, AuditActions.TOKEN_REJECT, AuditActions.SUBJECT_RESOURCE, null);
            return RedeemResult.invalidToken();
        }

        DownloadGrant grant = verified.get();
        String subjectId = grant.resourceId().toString();
        EntitlementDecision decision = entitlementService.evaluateDownload(grant.userId(), grant.resourceId());

        if (!decision.allowed()) {
            auditService.record(grant.userId(), AuditActions.DOWNLOAD_DENY, AuditActions.SUBJECT_RESOURCE, subjectId,
                    Map.of("reason", decision.reason(), "outcome", decision.outcome().name(), "stage", "redeem"));
            return RedeemResult.denied(grant);
        }

        return RedeemResult.granted(grant);
    }

    /**
     * Marks a redeemed grant as delivered. Call only once the file is known to
     * exist, so a failed transfer is never counted.
     */
    public void recordCompleted(DownloadGrant grant) {
        String subjectId = grant.resourceId().toString();
        auditService.record(grant.userId(), AuditActions.DOWNLOAD_REDEEM, AuditActions.SUBJECT_RESOURCE, subjectId,
                grant.tokenId() != null ? Map.of("tokenId", grant.tokenId()) : Map.of());

        try {
            resourceRepository.incrementDownloads(grant.resourceId());
        } catch (RuntimeException e) {
            log.warn("Could not bump download count for resource {}: {}", grant.resourceId(), e.getMessage());
        }
    }

    public record RedeemResult(Status status, DownloadGrant grant) {

        public enum Status {
            GRANTED,
            INVALID_TOKEN,
            DENIED
        }

        static RedeemResult granted(DownloadGrant grant) {
            return new RedeemResult(Status.GRANTED, grant);
        }

        static RedeemResult invalidToken() {
            return new RedeemResult(Status.INVALID_TOKEN, null);
        }

        static RedeemResult denied(DownloadGrant grant) {
            return new RedeemResult(Status.DENIED, grant);
        }
    }
}
