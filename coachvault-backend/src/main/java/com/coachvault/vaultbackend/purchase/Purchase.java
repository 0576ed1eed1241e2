package com.coachvault.vaultbackend.purchase;

import com.coachvault.vaultbackend.profile.Profile;
import com.coachvault.vaultbackend.resource.Resource;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@ToString(exclude = {"buyer", "resource"})
@Table(name = "purchases")
public class Purchase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "buyer_id")
    private Profile buyer;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "resource_id")
    private Resource resource;

    // Only SUCCEEDED grants download rights
    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(nullable = false, length = 16)
    private PurchaseStatus status = PurchaseStatus.PENDING;

    @Column(nullable = true)
    private Long amountCents;

    @Column(nullable = true)
    private Long platformFeeCents;

    @Column(nullable = true, length = 3)
    private String currency;

    @Column(nullable = true)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
