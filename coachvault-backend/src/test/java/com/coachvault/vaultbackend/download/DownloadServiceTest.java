package com.coachvault.vaultbackend.download;

import com.coachvault.vaultbackend.audit.AuditActions;
import com.coachvault.vaultbackend.audit.AuditEvent;
import com.coachvault.vaultbackend.audit.AuditEventRepository;
import com.coachvault.vaultbackend.audit.AuditService;
import com.coachvault.vaultbackend.entitlement.EntitlementDecision;
import com.coachvault.vaultbackend.entitlement.EntitlementService;
import com.coachvault.vaultbackend.resource.ResourceRepository;
import com.coachvault.vaultbackend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DownloadServiceTest {

    private static final String SECRET = "download-token-test-secret-0123456789abcdef";

    private MutableClock clock;
    private EntitlementService entitlements;
    private DownloadTokenService tokens;
    private AuditService audit;
    private ResourceRepository resources;
    private DownloadService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        entitlements = mock(EntitlementService.class);
        tokens = new DownloadTokenService(SECRET, clock);
        audit = mock(AuditService.class);
        resources = mock(ResourceRepository.class);
        service = new DownloadService(entitlements, tokens, audit, resources);
    }

    @Test
    void deniedRequestIssuesNoTokenAndIsAudited() {
        when(entitlements.evaluateDownload("user-1", 7L))
                .thenReturn(EntitlementDecision.deny(EntitlementDecision.MEMBERSHIP_INACTIVE));

        Optional<IssuedDownloadToken> issued = service.requestDownload("user-1", 7L);

        assertTrue(issued.isEmpty());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(audit).record(eq("user-1"), eq(AuditActions.DOWNLOAD_DENY), eq("resource"), eq("7"), metadata.capture());
        assertEquals(EntitlementDecision.MEMBERSHIP_INACTIVE, metadata.getValue().get("reason"));
        verify(audit, never()).record(any(), eq(AuditActions.TOKEN_ISSUE), any(), any(), any());
    }

    @Test
    void allowedRequestIssuesVerifiableToken() {
        when(entitlements.evaluateDownload("user-1", 7L))
                .thenReturn(EntitlementDecision.allow(EntitlementDecision.PURCHASE));

        IssuedDownloadToken issued = service.requestDownload("user-1", 7L).orElseThrow();

        DownloadGrant grant = tokens.verify(issued.token()).orElseThrow();
        assertEquals("user-1", grant.userId());
        assertEquals(7L, grant.resourceId());
        verify(audit).record(eq("user-1"), eq(AuditActions.DOWNLOAD_ALLOW), eq("resource"), eq("7"), anyMap());
        verify(audit).record(eq("user-1"), eq(AuditActions.TOKEN_ISSUE), eq("resource"), eq("7"), anyMap());
    }

    @Test
    void redeemGrantsWithoutCountingDownload() {
        when(entitlements.evaluateDownload("user-1", 7L))
                .thenReturn(EntitlementDecision.allow(EntitlementDecision.OWNER));
        String token = tokens.issue("user-1", 7L).token();

        DownloadService.RedeemResult result = service.redeem(token);

        assertEquals(DownloadService.RedeemResult.Status.GRANTED, result.status());
        assertEquals(7L, result.grant().resourceId());
        verifyNoInteractions(resources);
        verify(audit, never()).record(any(), eq(AuditActions.DOWNLOAD_REDEEM), any(), any(), any());
    }

    @Test
    void completedDownloadIsCountedAndAudited() {
        DownloadGrant grant = new DownloadGrant("user-1", 7L, clock.instant().plus(Duration.ofMinutes(10)), "jti-1");

        service.recordCompleted(grant);

        verify(resources).incrementDownloads(7L);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(audit).record(eq("user-1"), eq(AuditActions.DOWNLOAD_REDEEM), eq("resource"), eq("7"), metadata.capture());
        assertEquals("jti-1", metadata.getValue().get("tokenId"));
    }

    @Test
    void redeemRechecksEntitlement() {
        String token = tokens.issue("user-1", 7L).token();
        // Membership canceled after the token went out
        when(entitlements.evaluateDownload("user-1", 7L))
                .thenReturn(EntitlementDecision.deny(EntitlementDecision.MEMBERSHIP_INACTIVE));

        DownloadService.RedeemResult result = service.redeem(token);

        assertEquals(DownloadService.RedeemResult.Status.DENIED, result.status());
        verify(resources, never()).incrementDownloads(anyLong());
    }

    @Test
    void expiredTokenIsRejectedWithoutEntitlementCheck() {
        String token = tokens.issue("user-1", 7L).token();
        clock.advance(Duration.ofMinutes(11));

        DownloadService.RedeemResult result = service.redeem(token);

        assertEquals(DownloadService.RedeemResult.Status.INVALID_TOKEN, result.status());
        assertNull(result.grant());
        verifyNoInteractions(entitlements);
        verify(audit).record(isNull(), eq(AuditActions.TOKEN_REJECT), eq("resource"), isNull());
    }

    @Test
    void failedCounterUpdateIsSwallowed() {
        when(resources.incrementDownloads(7L)).thenThrow(new DataAccessResourceFailureException("db down"));
        DownloadGrant grant = new DownloadGrant("user-1", 7L, clock.instant().plus(Duration.ofMinutes(10)), "jti-1");

        assertDoesNotThrow(() -> service.recordCompleted(grant));
        verify(audit).record(eq("user-1"), eq(AuditActions.DOWNLOAD_REDEEM), eq("resource"), eq("7"), anyMap());
    }

    @Test
    void auditOutageDoesNotChangeDecisions() {
        AuditEventRepository brokenRepo = mock(AuditEventRepository.class);
        when(brokenRepo.save(any(AuditEvent.class))).thenThrow(new DataAccessResourceFailureException("audit db down"));
        AuditService brokenAudit = new AuditService(brokenRepo, mock(PlatformTransactionManager.class));
        DownloadService withBrokenAudit = new DownloadService(entitlements, tokens, brokenAudit, resources);

        when(entitlements.evaluateDownload("user-1", 7L))
                .thenReturn(EntitlementDecision.allow(EntitlementDecision.PURCHASE));
        when(entitlements.evaluateDownload("user-2", 7L))
                .thenReturn(EntitlementDecision.deny(EntitlementDecision.NO_PURCHASE));

        Optional<IssuedDownloadToken> allowed = withBrokenAudit.requestDownload("user-1", 7L);
        Optional<IssuedDownloadToken> denied = withBrokenAudit.requestDownload("user-2", 7L);

        assertTrue(allowed.isPresent());
        assertTrue(denied.isEmpty());
        assertEquals(DownloadService.RedeemResult.Status.GRANTED,
                withBrokenAudit.redeem(allowed.get().token()).status());
        assertEquals(DownloadService.RedeemResult.Status.INVALID_TOKEN,
                withBrokenAudit.redeem("garbage").status());
        verify(brokenRepo, atLeast(3)).save(any(AuditEvent.class));
    }
}
