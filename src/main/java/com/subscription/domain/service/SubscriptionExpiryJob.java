package com.subscription.domain.service;

import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import com.subscription.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Moves lapsed ACTIVE subscriptions to INACTIVE.
 *
 * The reconciler treats ACTIVE as already paid, so without this sweep a renewal
 * payment for a lapsed subscription would be ignored. The bulk UPDATE takes row
 * locks and therefore serializes with in-flight reconciliations of the same rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionExpiryJob {

    private final SubscriptionRepository subscriptionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.subscription.expiry-sweep-interval-ms:60000}")
    @Transactional
    public void expireLapsedSubscriptions() {
        Instant now = clock.instant();
        int expired = subscriptionRepository.markLapsed(SubscriptionStatus.ACTIVE, SubscriptionStatus.INACTIVE, now);

        if (expired == 0) {
            return;
        }

        log.info("Marked {} lapsed subscriptions INACTIVE", expired);
        Counter.builder("subscription.expired")
                .register(meterRegistry)
                .increment(expired);
    }
}
