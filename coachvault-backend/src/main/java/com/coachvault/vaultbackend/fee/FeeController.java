package com.coachvault.vaultbackend.fee;

import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/fees")
@RequiredArgsConstructor
public class FeeController {

    private final FeeQuoteService feeQuoteService;

    @GetMapping("/quote/{resourceId}")
    public FeeSplit quote(@PathVariable Long resourceId, Authentication authentication) {
        return feeQuoteService.quote(authentication.getName(), resourceId);
    }
}
