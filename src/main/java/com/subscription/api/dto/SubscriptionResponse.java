package com.subscription.api.dto;

import com.subscription.infrastructure.persistence.entity.SubscriptionEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SubscriptionResponse {

    UUID id;
    UUID supporterId;
    UUID tierId;
    String status;
    Instant startedAt;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    public static SubscriptionResponse from(SubscriptionEntity subscription) {
        return SubscriptionResponse.builder()
                .id(subscription.getId())
                .supporterId(subscription.getSupporterId())
                .tierId(subscription.getTierId())
                .status(subscription.getStatus().name())
                .startedAt(subscription.getStartedAt())
                .expiresAt(subscription.getExpiresAt())
                .createdAt(subscription.getCreatedAt())
                .updatedAt(subscription.getUpdatedAt())
                .build();
    }
}
