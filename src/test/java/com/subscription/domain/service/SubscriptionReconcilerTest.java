package com.subscription.domain.service;

import com.subscription.domain.model.PaymentEventTypes;
import com.subscription.domain.model.PaymentSucceededEvent;
import com.subscription.infrastructure.persistence.UnitOfWork;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import com.subscription.infrastructure.persistence.repository.SubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.TransactionSystemException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock private SubscriptionRepository subscriptionRepository;
    @Mock private UnitOfWork unitOfWork;

    private MeterRegistry meterRegistry;
    private SubscriptionReconciler reconciler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reconciler = new SubscriptionReconciler(subscriptionRepository, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void reconcile_noExistingRow_createsActiveSubscription() {
        PaymentSucceededEvent event = createTestEvent();
        when(subscriptionRepository.findBySupporterIdAndTierId(event.getUserId(), event.getTierId()))
                .thenReturn(Optional.empty());

        assertTrue(reconciler.reconcile(event, unitOfWork));

        ArgumentCaptor<SubscriptionEntity> saved = ArgumentCaptor.forClass(SubscriptionEntity.class);
        verify(subscriptionRepository).save(saved.capture());
        assertEquals(event.getUserId(), saved.getValue().getSupporterId());
        assertEquals(event.getTierId(), saved.getValue().getTierId());
        assertEquals(SubscriptionStatus.ACTIVE, saved.getValue().getStatus());
        assertEquals(NOW, saved.getValue().getStartedAt());
        assertEquals(NOW.plus(Duration.ofDays(30)), saved.getValue().getExpiresAt());

        verify(unitOfWork).commit();
        verify(unitOfWork, never()).rollback();
        assertEquals(1.0, meterRegistry.counter("subscription.reconciled", "result", "created").count());
    }

    @Test
    void reconcile_inactiveRow_isReactivatedInPlace() {
        PaymentSucceededEvent event = createTestEvent();
        SubscriptionEntity lapsed = existing(event, SubscriptionStatus.INACTIVE, NOW.minus(Duration.ofDays(3)));
        UUID originalId = lapsed.getId();
        when(subscriptionRepository.findBySupporterIdAndTierId(event.getUserId(), event.getTierId()))
                .thenReturn(Optional.of(lapsed));

        assertTrue(reconciler.reconcile(event, unitOfWork));

        assertEquals(originalId, lapsed.getId());
        assertEquals(SubscriptionStatus.ACTIVE, lapsed.getStatus());
        assertEquals(NOW, lapsed.getStartedAt());
        assertEquals(NOW.plus(Duration.ofDays(30)), lapsed.getExpiresAt());
        verify(subscriptionRepository).save(lapsed);
        verify(unitOfWork).commit();
        assertEquals(1.0, meterRegistry.counter("subscription.reconciled", "result", "reactivated").count());
    }

    @Test
    void reconcile_pendingRow_isActivated() {
        PaymentSucceededEvent event = createTestEvent();
        SubscriptionEntity pending = existing(event, SubscriptionStatus.PENDING, NOW);
        when(subscriptionRepository.findBySupporterIdAndTierId(event.getUserId(), event.getTierId()))
                .thenReturn(Optional.of(pending));

        assertTrue(reconciler.reconcile(event, unitOfWork));

        assertEquals(SubscriptionStatus.ACTIVE, pending.getStatus());
        verify(unitOfWork).commit();
    }

    @Test
    void reconcile_alreadyActive_isNoOpAndKeepsExpiry() {
        PaymentSucceededEvent event = createTestEvent();
        Instant expiry = NOW.plus(Duration.ofDays(12));
        SubscriptionEntity active = existing(event, SubscriptionStatus.ACTIVE, expiry);
        when(subscriptionRepository.findBySupporterIdAndTierId(event.getUserId(), event.getTierId()))
                .thenReturn(Optional.of(active));

        assertTrue(reconciler.reconcile(event, unitOfWork));

        assertEquals(expiry, active.getExpiresAt());
        verify(subscriptionRepository, never()).save(any());
        verify(unitOfWork).commit();
        assertEquals(1.0, meterRegistry.counter("subscription.reconciled", "result", "duplicate").count());
    }

    @Test
    void reconcile_commitFails_rollsBackAndReportsFailure() {
        PaymentSucceededEvent event = createTestEvent();
        when(subscriptionRepository.findBySupporterIdAndTierId(event.getUserId(), event.getTierId()))
                .thenReturn(Optional.empty());
        doThrow(new TransactionSystemException("connection reset")).when(unitOfWork).commit();

        assertFalse(reconciler.reconcile(event, unitOfWork));

        verify(unitOfWork).rollback();
        assertEquals(1.0, meterRegistry.counter("subscription.reconciled", "result", "error").count());
    }

    @Test
    void reconcile_lockTimeout_rollsBackWithoutWriting() {
        PaymentSucceededEvent event = createTestEvent();
        when(subscriptionRepository.findBySupporterIdAndTierId(event.getUserId(), event.getTierId()))
                .thenThrow(new CannotAcquireLockException("lock timeout"));

        assertFalse(reconciler.reconcile(event, unitOfWork));

        verify(subscriptionRepository, never()).save(any());
        verify(unitOfWork, never()).commit();
        verify(unitOfWork).rollback();
    }

    private SubscriptionEntity existing(PaymentSucceededEvent event, SubscriptionStatus status, Instant expiresAt) {
        return SubscriptionEntity.builder()
                .id(UUID.randomUUID())
                .supporterId(event.getUserId())
                .tierId(event.getTierId())
                .status(status)
                .startedAt(expiresAt.minus(Duration.ofDays(30)))
                .expiresAt(expiresAt)
                .createdAt(NOW.minus(Duration.ofDays(90)))
                .updatedAt(NOW.minus(Duration.ofDays(3)))
                .build();
    }

    private PaymentSucceededEvent createTestEvent() {
        return PaymentSucceededEvent.builder()
                .eventType(PaymentEventTypes.PAYMENT_SUCCEEDED)
                .paymentId(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .tierId(UUID.randomUUID())
                .amount(1000L)
                .currency("usd")
                .paidAt(OffsetDateTime.of(2024, 5, 1, 11, 59, 0, 0, ZoneOffset.UTC))
                .stripePaymentIntentId("pi_123")
                .stripeCheckoutSessionId("cs_123")
                .build();
    }
}
