package com.subscription.infrastructure.persistence.repository;

import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID>, SubscriptionPageRepository {

    /**
     * Find the (supporter, tier) subscription with a pessimistic write lock.
     *
     * Serializes concurrent writers for the same pair across sessions and processes
     * until the surrounding transaction commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<SubscriptionEntity> findBySupporterIdAndTierId(UUID supporterId, UUID tierId);

    @Query("""
            SELECT COUNT(s) > 0
            FROM SubscriptionEntity s, TierEntity t
            WHERE t.id = s.tierId
              AND s.supporterId = :supporterId
              AND t.creatorId = :creatorId
              AND s.status = :status
              AND s.expiresAt > :now
            """)
    boolean existsWithCreator(@Param("supporterId") UUID supporterId,
                              @Param("creatorId") UUID creatorId,
                              @Param("status") SubscriptionStatus status,
                              @Param("now") Instant now);

    boolean existsByTierIdAndStatusAndExpiresAtAfter(UUID tierId, SubscriptionStatus status, Instant now);

    /**
     * Bulk transition of lapsed subscriptions. Bypasses entity callbacks, so
     * {@code updatedAt} is set explicitly.
     */
    @Modifying
    @Query("""
            UPDATE SubscriptionEntity s
            SET s.status = :lapsedStatus, s.updatedAt = :now
            WHERE s.status = :activeStatus AND s.expiresAt <= :now
            """)
    int markLapsed(@Param("activeStatus") SubscriptionStatus activeStatus,
                   @Param("lapsedStatus") SubscriptionStatus lapsedStatus,
                   @Param("now") Instant now);
}
