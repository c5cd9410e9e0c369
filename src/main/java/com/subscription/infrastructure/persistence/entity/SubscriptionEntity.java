package com.subscription.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A supporter's subscription to one tier.
 *
 * At most one row exists per (supporter, tier). Renewals and reactivations mutate
 * the row in place; writers must load it with a pessimistic write lock first.
 */
@Entity
@Table(name = "subscription",
        uniqueConstraints = @UniqueConstraint(name = "uq_subscription_supporter_tier",
                columnNames = {"supporter_id", "tier_id"}),
        indexes = {
            @Index(name = "idx_subscription_supporter", columnList = "supporter_id"),
            @Index(name = "idx_subscription_tier", columnList = "tier_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(name = "supporter_id", nullable = false, columnDefinition = "UUID")
    private UUID supporterId;

    @Column(name = "tier_id", nullable = false, columnDefinition = "UUID")
    private UUID tierId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(nullable = false)
    private Instant startedAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public enum SubscriptionStatus {
        ACTIVE,
        INACTIVE,
        PENDING,
        CANCELLED
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (status == null) {
            status = SubscriptionStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    /**
     * True while the subscription is ACTIVE and has not yet lapsed at {@code now}.
     */
    public boolean grantsAccessAt(Instant now) {
        return isActive() && expiresAt != null && expiresAt.isAfter(now);
    }

    /**
     * Move this subscription to ACTIVE for a fresh billing period.
     */
    public void activate(Instant startedAt, Instant expiresAt) {
        this.status = SubscriptionStatus.ACTIVE;
        this.startedAt = startedAt;
        this.expiresAt = expiresAt;
    }
}
