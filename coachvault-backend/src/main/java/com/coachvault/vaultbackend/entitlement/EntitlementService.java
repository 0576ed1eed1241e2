package com.coachvault.vaultbackend.entitlement;

import com.coachvault.vaultbackend.profile.MembershipStatus;
import com.coachvault.vaultbackend.profile.Profile;
import com.coachvault.vaultbackend.profile.ProfileRepository;
import com.coachvault.vaultbackend.purchase.PurchaseRepository;
import com.coachvault.vaultbackend.purchase.PurchaseStatus;
import com.coachvault.vaultbackend.resource.ResourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a user may consume a resource.
 * <p>
 * Every call re-reads storage. Any read failure fails closed: the boolean
 * methods return {@code false} and never throw.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EntitlementService {

    private final ProfileRepository profileRepository;
    private final ResourceRepository resourceRepository;
    private final PurchaseRepository purchaseRepository;
    private final Clock clock;

    public boolean isActiveMember(String userId) {
        return evaluateMembership(userId).allowed();
    }

    public boolean isEligibleCreator(String userId) {
        return evaluateCreator(userId).allowed();
    }

    public boolean canDownload(String userId, Long resourceId) {
        return evaluateDownload(userId, resourceId).allowed();
    }

    public EntitlementDecision evaluateMembership(String userId) {
        try {
            return membershipOf(loadProfile(userId));
        } catch (RuntimeException e) {
            log.warn("Membership check failed for user {}: {}", userId, e.getMessage());
            return EntitlementDecision.storageError();
        }
    }

    public EntitlementDecision evaluateCreator(String userId) {
        try {
            Optional<Profile> profile = loadProfile(userId);
            EntitlementDecision membership = membershipOf(profile);
            if (!membership.allowed()) return membership;

            return profile.get().isCreatorEnabled()
                    ? EntitlementDecision.allow(EntitlementDecision.CREATOR_ENABLED)
                    : EntitlementDecision.deny(EntitlementDecision.CREATOR_DISABLED);
        } catch (RuntimeException e) {
            log.warn("Creator check failed for user {}: {}", userId, e.getMessage());
            return EntitlementDecision.storageError();
        }
    }

    /**
     * Membership first, then ownership, then a succeeded purchase. A lapsed
     * member loses access to their own resources too.
     */
    public EntitlementDecision evaluateDownload(String userId, Long resourceId) {
        try {
            Optional<Profile> profile = loadProfile(userId);

            // 1. Members only
            EntitlementDecision membership = membershipOf(profile);
            if (!membership.allowed()) return membership;

            // 2. Internal profile id
            Long profileId = profile.get().getId();
            if (profileId == null) return EntitlementDecision.deny(EntitlementDecision.NO_PROFILE);

            if (resourceId == null) return EntitlementDecision.deny(EntitlementDecision.NO_PURCHASE);

            // 3. Creators keep access to their own content
            Optional<Long> ownerId = resourceRepository.findOwnerIdById(resourceId);
            if (ownerId.isPresent() && Objects.equals(ownerId.get(), profileId)) {
                return EntitlementDecision.allow(EntitlementDecision.OWNER);
            }

            // 4. Completed purchase
            boolean purchased = purchaseRepository.existsByBuyerIdAndResourceIdAndStatus(
                    profileId, resourceId, PurchaseStatus.SUCCEEDED);
            return purchased
                    ? EntitlementDecision.allow(EntitlementDecision.PURCHASE)
                    : EntitlementDecision.deny(EntitlementDecision.NO_PURCHASE);
        } catch (RuntimeException e) {
            log.warn("Download check failed for user {} on resource {}: {}", userId, resourceId, e.getMessage());
            return EntitlementDecision.storageError();
        }
    }

    private Optional<Profile> loadProfile(String userId) {
        if (userId == null || userId.isBlank()) return Optional.empty();
        return profileRepository.findByUserId(userId);
    }

    private EntitlementDecision membershipOf(Optional<Profile> profile) {
        if (profile.isEmpty()) return EntitlementDecision.deny(EntitlementDecision.NO_PROFILE);

        Profile p = profile.get();
        Instant now = clock.instant();
        if (p.hasActiveMembership(now)) return EntitlementDecision.allow(EntitlementDecision.ACTIVE_MEMBER);

        return p.getMembershipStatus() == MembershipStatus.ACTIVE
                ? EntitlementDecision.deny(EntitlementDecision.MEMBERSHIP_EXPIRED)
                : EntitlementDecision.deny(EntitlementDecision.MEMBERSHIP_INACTIVE);
    }
}
