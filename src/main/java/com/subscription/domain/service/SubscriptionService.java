package com.subscription.domain.service;

import com.subscription.domain.exception.ResourceNotFoundException;
import com.subscription.domain.exception.SelfSubscriptionException;
import com.subscription.domain.exception.SubscriptionConflictException;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import com.subscription.infrastructure.persistence.entity.TierEntity;
import com.subscription.infrastructure.persistence.repository.SubscriptionRepository;
import com.subscription.infrastructure.persistence.repository.TierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Request-driven subscription operations.
 *
 * Direct purchase confirmation shares the (supporter, tier) row with the payment
 * event pipeline and takes the same row lock before writing it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final TierRepository tierRepository;
    private final Clock clock;

    @Transactional
    public SubscriptionEntity subscribe(UUID supporterId, UUID tierId) {
        log.info("User {} attempting to subscribe to tier {}", supporterId, tierId);

        TierEntity tier = tierRepository.findById(tierId)
                .orElseThrow(() -> new ResourceNotFoundException("Tier not found"));

        if (tier.isOwnedBy(supporterId)) {
            log.info("User {} attempted to self-subscribe to tier {}", supporterId, tierId);
            throw new SelfSubscriptionException("Cannot subscribe to your own tier");
        }

        Instant now = clock.instant();
        if (subscriptionRepository.existsWithCreator(supporterId, tier.getCreatorId(), SubscriptionStatus.ACTIVE, now)) {
            log.info("User {} already actively subscribed to creator {}", supporterId, tier.getCreatorId());
            throw new SubscriptionConflictException("Already actively subscribed to this creator");
        }

        Instant expiresAt = now.plus(SubscriptionReconciler.SUBSCRIPTION_PERIOD);
        Optional<SubscriptionEntity> existing = subscriptionRepository.findBySupporterIdAndTierId(supporterId, tierId);

        SubscriptionEntity subscription;
        if (existing.isPresent()) {
            subscription = existing.get();
            // re-checked under the row lock: a concurrent purchase or payment event may have activated it
            if (subscription.grantsAccessAt(now)) {
                log.info("Subscription {} was activated concurrently for user {}", subscription.getId(), supporterId);
                throw new SubscriptionConflictException("Already actively subscribed to this creator");
            }
            subscription.activate(now, expiresAt);
        } else {
            subscription = SubscriptionEntity.builder()
                    .supporterId(supporterId)
                    .tierId(tierId)
                    .status(SubscriptionStatus.ACTIVE)
                    .startedAt(now)
                    .expiresAt(expiresAt)
                    .build();
        }

        SubscriptionEntity saved = subscriptionRepository.save(subscription);
        log.info("Subscription {} active for user {} until {}", saved.getId(), supporterId, expiresAt);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<SubscriptionEntity> listForSupporter(UUID supporterId, int limit, int offset) {
        List<SubscriptionEntity> subscriptions = subscriptionRepository.findPageBySupporter(supporterId, limit, offset);
        log.info("Retrieved {} subscriptions for user {}", subscriptions.size(), supporterId);
        return subscriptions;
    }

    /**
     * Whether the supporter holds an ACTIVE, unexpired subscription to any tier of the creator.
     */
    @Transactional(readOnly = true)
    public boolean hasAccess(UUID supporterId, UUID creatorId) {
        boolean granted = subscriptionRepository.existsWithCreator(
                supporterId, creatorId, SubscriptionStatus.ACTIVE, clock.instant());
        log.debug("Access {} for supporter {} to creator {}", granted ? "GRANTED" : "DENIED", supporterId, creatorId);
        return granted;
    }
}
