package com.subscription.domain.service;

import com.subscription.domain.model.PaymentSucceededEvent;
import com.subscription.infrastructure.persistence.UnitOfWork;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import com.subscription.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies a confirmed payment to subscription state.
 *
 * Processing Flow:
 * 1. Lock the (supporter, tier) row with SELECT ... FOR UPDATE
 * 2. Already ACTIVE: no-op, so a redelivered event never extends expiry twice
 * 3. Otherwise create the row, or reactivate it in place, for one billing period
 * 4. Commit the unit of work
 *
 * Failure Handling:
 * - Any exception, including a failed commit, rolls the unit of work back and
 *   reports {@code false}. The caller leaves the offset uncommitted so the event is redelivered.
 * - A concurrent first insert for the same pair loses on the unique index and is
 *   redelivered; the retry then sees the ACTIVE row and short-circuits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionReconciler {

    public static final Duration SUBSCRIPTION_PERIOD = Duration.ofDays(30);

    private final SubscriptionRepository subscriptionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public boolean reconcile(PaymentSucceededEvent event, UnitOfWork unitOfWork) {
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Optional<SubscriptionEntity> existing = subscriptionRepository
                    .findBySupporterIdAndTierId(event.getUserId(), event.getTierId());

            if (existing.isPresent() && existing.get().isActive()) {
                log.warn("Subscription for user {}, tier {} already ACTIVE (payment {})",
                        event.getUserId(), event.getTierId(), event.getPaymentId());
                unitOfWork.commit();
                count("duplicate");
                return true;
            }

            Instant startedAt = clock.instant();
            Instant expiresAt = startedAt.plus(SUBSCRIPTION_PERIOD);
            String result;

            if (existing.isPresent()) {
                SubscriptionEntity subscription = existing.get();
                log.info("Reactivating subscription {} (was {}) for payment {}",
                        subscription.getId(), subscription.getStatus(), event.getPaymentId());
                subscription.activate(startedAt, expiresAt);
                subscriptionRepository.save(subscription);
                result = "reactivated";
            } else {
                SubscriptionEntity subscription = SubscriptionEntity.builder()
                        .supporterId(event.getUserId())
                        .tierId(event.getTierId())
                        .status(SubscriptionStatus.ACTIVE)
                        .startedAt(startedAt)
                        .expiresAt(expiresAt)
                        .build();
                subscriptionRepository.save(subscription);
                log.info("Creating new subscription for user {}, tier {} (payment {})",
                        event.getUserId(), event.getTierId(), event.getPaymentId());
                result = "created";
            }

            unitOfWork.commit();

            sample.stop(Timer.builder("subscription.reconcile.latency")
                    .tag("result", result)
                    .register(meterRegistry));
            count(result);
            return true;

        } catch (RuntimeException e) {
            log.error("Database error reconciling payment {} for user {}, tier {}: {}",
                    event.getPaymentId(), event.getUserId(), event.getTierId(), e.getMessage(), e);
            unitOfWork.rollback();
            count("error");
            return false;
        }
    }

    private void count(String result) {
        Counter.builder("subscription.reconciled")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
