package com.subscription.infrastructure.persistence.repository;

import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;

import java.util.List;
import java.util.UUID;

/**
 * Offset/limit listing, which derived queries cannot express.
 */
public interface SubscriptionPageRepository {

    List<SubscriptionEntity> findPageBySupporter(UUID supporterId, int limit, int offset);
}
