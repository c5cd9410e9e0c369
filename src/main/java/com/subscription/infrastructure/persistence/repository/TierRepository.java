package com.subscription.infrastructure.persistence.repository;

import com.subscription.infrastructure.persistence.entity.TierEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TierRepository extends JpaRepository<TierEntity, UUID> {

    List<TierEntity> findByCreatorIdOrderByCreatedAtDesc(UUID creatorId);
}
