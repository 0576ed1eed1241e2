package com.coachvault.vaultbackend.profile;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@Table(name = "profiles")
public class Profile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Subject of the identity provider's access token
    @Column(nullable = false, unique = true, length = 64)
    private String userId;

    private String displayName;

    // --- Membership state (written by billing reconciliation, read-only here) ---
    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(nullable = false, length = 16)
    private MembershipStatus membershipStatus = MembershipStatus.NONE;

    @Column(nullable = true)
    private Instant membershipCurrentPeriodEnd;

    @Column(nullable = false)
    private boolean creatorEnabled = false;

    @Column(nullable = true)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (membershipStatus == null) membershipStatus = MembershipStatus.NONE;
    }

    /**
     * Membership counts only while the status is ACTIVE and the paid period,
     * when one is recorded, ends strictly after {@code now}.
     */
    public boolean hasActiveMembership(Instant now) {
        if (membershipStatus != MembershipStatus.ACTIVE) return false;
        return membershipCurrentPeriodEnd == null || membershipCurrentPeriodEnd.isAfter(now);
    }
}
