package com.subscription.api;

import com.subscription.domain.exception.ResourceNotFoundException;
import com.subscription.domain.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Service-to-service access gate for gated content.
 *
 * GET /internal/check-access?supporter_id=&creator_id=
 * 200 if the supporter holds an ACTIVE, unexpired subscription to any tier of the creator, else 404.
 */
@Slf4j
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
public class InternalAccessController {

    private final SubscriptionService subscriptionService;

    @GetMapping("/check-access")
    public ResponseEntity<Void> checkAccess(@RequestParam("supporter_id") UUID supporterId,
                                            @RequestParam("creator_id") UUID creatorId) {
        log.info("Checking access of supporter {} to content of creator {}", supporterId, creatorId);

        if (!subscriptionService.hasAccess(supporterId, creatorId)) {
            throw new ResourceNotFoundException("No active subscription found for this creator.");
        }
        return ResponseEntity.ok().build();
    }
}
