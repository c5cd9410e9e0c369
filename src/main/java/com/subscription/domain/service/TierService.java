package com.subscription.domain.service;

import com.subscription.api.dto.TierCreateRequest;
import com.subscription.api.dto.TierUpdateRequest;
import com.subscription.domain.exception.ForbiddenException;
import com.subscription.domain.exception.ResourceNotFoundException;
import com.subscription.domain.exception.SubscriptionConflictException;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import com.subscription.infrastructure.persistence.entity.TierEntity;
import com.subscription.infrastructure.persistence.repository.SubscriptionRepository;
import com.subscription.infrastructure.persistence.repository.TierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TierService {

    private final TierRepository tierRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final Clock clock;

    @Transactional
    public TierEntity create(UUID creatorId, TierCreateRequest request) {
        TierEntity tier = TierEntity.builder()
                .creatorId(creatorId)
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .currency(request.getCurrency().toUpperCase(Locale.ROOT))
                .build();

        TierEntity saved = tierRepository.save(tier);
        log.info("Creator {} created tier {}", creatorId, saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public TierEntity get(UUID tierId) {
        return tierRepository.findById(tierId)
                .orElseThrow(() -> new ResourceNotFoundException("Tier not found"));
    }

    @Transactional(readOnly = true)
    public List<TierEntity> listByCreator(UUID creatorId) {
        return tierRepository.findByCreatorIdOrderByCreatedAtDesc(creatorId);
    }

    @Transactional
    public TierEntity update(UUID callerId, UUID tierId, TierUpdateRequest request) {
        TierEntity tier = ownedTier(callerId, tierId);

        if (request.getName() != null) {
            tier.setName(request.getName());
        }
        if (request.getDescription() != null) {
            tier.setDescription(request.getDescription());
        }
        if (request.getPrice() != null) {
            tier.setPrice(request.getPrice());
        }
        if (request.getCurrency() != null) {
            tier.setCurrency(request.getCurrency().toUpperCase(Locale.ROOT));
        }

        TierEntity saved = tierRepository.save(tier);
        log.info("Creator {} updated tier {}", callerId, tierId);
        return saved;
    }

    /**
     * Delete a tier. Refused while any supporter still holds an ACTIVE, unexpired subscription to it.
     */
    @Transactional
    public void delete(UUID callerId, UUID tierId) {
        TierEntity tier = ownedTier(callerId, tierId);

        if (subscriptionRepository.existsByTierIdAndStatusAndExpiresAtAfter(tierId, SubscriptionStatus.ACTIVE, clock.instant())) {
            throw new SubscriptionConflictException("Tier has active subscriptions");
        }

        tierRepository.delete(tier);
        log.info("Creator {} deleted tier {}", callerId, tierId);
    }

    private TierEntity ownedTier(UUID callerId, UUID tierId) {
        TierEntity tier = get(tierId);
        if (!tier.isOwnedBy(callerId)) {
            log.warn("User {} attempted to modify tier {} owned by {}", callerId, tierId, tier.getCreatorId());
            throw new ForbiddenException("Only the owning creator may modify this tier");
        }
        return tier;
    }
}
