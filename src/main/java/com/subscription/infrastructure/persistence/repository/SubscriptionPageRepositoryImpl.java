package com.subscription.infrastructure.persistence.repository;

import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import java.util.List;
import java.util.UUID;

class SubscriptionPageRepositoryImpl implements SubscriptionPageRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SubscriptionEntity> findPageBySupporter(UUID supporterId, int limit, int offset) {
        return entityManager.createQuery("""
                        SELECT s FROM SubscriptionEntity s
                        WHERE s.supporterId = :supporterId
                        ORDER BY s.expiresAt DESC
                        """, SubscriptionEntity.class)
                .setParameter("supporterId", supporterId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
