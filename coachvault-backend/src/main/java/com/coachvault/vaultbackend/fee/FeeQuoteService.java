package com.coachvault.vaultbackend.fee;

import com.coachvault.vaultbackend.audit.AuditActions;
import com.coachvault.vaultbackend.audit.AuditService;
import com.coachvault.vaultbackend.resource.Resource;
import com.coachvault.vaultbackend.resource.ResourceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class FeeQuoteService {

    private final FeeCalculator feeCalculator;
    private final ResourceRepository resourceRepository;
    private final AuditService auditService;

    public FeeSplit quote(String actorId, Long resourceId) {
        Resource resource = resourceRepository.findById(resourceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Resource not found"));

        FeeSplit split = feeCalculator.split(resource.getPriceCents());

        auditService.record(actorId, AuditActions.FEE_COMPUTE, AuditActions.SUBJECT_RESOURCE, resourceId.toString(),
                Map.of(
                        "grossCents", split.grossCents(),
                        "platformFeeCents", split.platformFeeCents(),
                        "sellerEarningsCents", split.sellerEarningsCents(),
                        "rate", feeCalculator.getPlatformRate().toPlainString()
                ));
        return split;
    }
}
