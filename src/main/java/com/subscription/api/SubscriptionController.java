package com.subscription.api;

import com.subscription.api.dto.SubscriptionCreateRequest;
import com.subscription.api.dto.SubscriptionResponse;
import com.subscription.domain.service.SubscriptionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Direct purchase confirmation and subscription listing.
 *
 * POST /subscriptions
 * GET  /users/{userId}/subscriptions
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @PostMapping("/subscriptions")
    public ResponseEntity<SubscriptionResponse> createSubscription(@CurrentUser UUID supporterId,
                                                                   @Valid @RequestBody SubscriptionCreateRequest request) {
        SubscriptionResponse response = SubscriptionResponse.from(
                subscriptionService.subscribe(supporterId, request.getTierId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Newest expiry first.
     */
    @GetMapping("/users/{userId}/subscriptions")
    public ResponseEntity<List<SubscriptionResponse>> listSubscriptions(
            @PathVariable UUID userId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        List<SubscriptionResponse> subscriptions = subscriptionService.listForSupporter(userId, limit, offset).stream()
                .map(SubscriptionResponse::from)
                .toList();
        return ResponseEntity.ok(subscriptions);
    }
}
