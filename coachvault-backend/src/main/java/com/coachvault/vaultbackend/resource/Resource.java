package com.coachvault.vaultbackend.resource;

import com.coachvault.vaultbackend.profile.Profile;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@ToString(exclude = "owner")
@Table(name = "resources")
public class Resource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id")
    private Profile owner;

    @Column(nullable = false)
    private String title;

    // List price in the smallest currency unit
    @Column(nullable = false)
    private long priceCents;

    // Relative to app.upload.root
    @Column(nullable = true, length = 512)
    private String storagePath;

    @Column(nullable = false)
    private long downloads = 0;

    @Column(nullable = true)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
