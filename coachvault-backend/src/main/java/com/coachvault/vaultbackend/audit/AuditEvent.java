package com.coachvault.vaultbackend.audit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Append-only record of a security or financial decision.
 */
@Entity
@Data
@NoArgsConstructor
@Table(name = "audit_events")
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Null when the actor is unknown, e.g. a rejected download token
    @Column(nullable = true, length = 64)
    private String actorId;

    @Column(nullable = false, length = 64)
    private String action;

    @Column(nullable = false, length = 32)
    private String subjectType;

    @Column(nullable = true, length = 64)
    private String subjectId;

    @Convert(converter = AuditMetadataConverter.class)
    @Column(length = 4000)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (metadata == null) metadata = new HashMap<>();
    }
}
