package com.coachvault.vaultbackend.purchase;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PurchaseRepository extends JpaRepository<Purchase, Long> {
    boolean existsByBuyerIdAndResourceIdAndStatus(Long buyerId, Long resourceId, PurchaseStatus status);
}
