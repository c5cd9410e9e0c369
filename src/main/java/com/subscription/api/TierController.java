package com.subscription.api;

import com.subscription.api.dto.TierCreateRequest;
import com.subscription.api.dto.TierResponse;
import com.subscription.api.dto.TierUpdateRequest;
import com.subscription.domain.service.TierService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Creator-owned tier CRUD. Every endpoint requires a bearer token; changes require ownership.
 */
@RestController
@RequiredArgsConstructor
public class TierController {

    private final TierService tierService;

    @PostMapping("/tiers")
    public ResponseEntity<TierResponse> createTier(@CurrentUser UUID creatorId,
                                                   @Valid @RequestBody TierCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TierResponse.from(tierService.create(creatorId, request)));
    }

    @GetMapping("/tiers/{tierId}")
    public ResponseEntity<TierResponse> getTier(@CurrentUser UUID callerId, @PathVariable UUID tierId) {
        return ResponseEntity.ok(TierResponse.from(tierService.get(tierId)));
    }

    @PutMapping("/tiers/{tierId}")
    public ResponseEntity<TierResponse> updateTier(@CurrentUser UUID callerId,
                                                   @PathVariable UUID tierId,
                                                   @Valid @RequestBody TierUpdateRequest request) {
        return ResponseEntity.ok(TierResponse.from(tierService.update(callerId, tierId, request)));
    }

    @DeleteMapping("/tiers/{tierId}")
    public ResponseEntity<Void> deleteTier(@CurrentUser UUID callerId, @PathVariable UUID tierId) {
        tierService.delete(callerId, tierId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/{creatorId}/tiers")
    public ResponseEntity<List<TierResponse>> listCreatorTiers(@CurrentUser UUID callerId,
                                                               @PathVariable UUID creatorId) {
        List<TierResponse> tiers = tierService.listByCreator(creatorId).stream()
                .map(TierResponse::from)
                .toList();
        return ResponseEntity.ok(tiers);
    }
}
