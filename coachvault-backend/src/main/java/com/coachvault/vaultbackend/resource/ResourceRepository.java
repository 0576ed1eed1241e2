package com.coachvault.vaultbackend.resource;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface ResourceRepository extends JpaRepository<Resource, Long> {

    @Query("SELECT r.owner.id FROM Resource r WHERE r.id = :id")
    Optional<Long> findOwnerIdById(@Param("id") Long id);

    @Modifying
    @Transactional
    @Query("UPDATE Resource r SET r.downloads = r.downloads + 1 WHERE r.id = :id")
    int incrementDownloads(@Param("id") Long id);
}
