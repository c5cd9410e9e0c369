package com.subscription.api.dto;

import com.subscription.infrastructure.persistence.entity.TierEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TierResponse {

    UUID id;
    UUID creatorId;
    String name;
    String description;
    BigDecimal price;
    String currency;
    Instant createdAt;
    Instant updatedAt;

    public static TierResponse from(TierEntity tier) {
        return TierResponse.builder()
                .id(tier.getId())
                .creatorId(tier.getCreatorId())
                .name(tier.getName())
                .description(tier.getDescription())
                .price(tier.getPrice())
                .currency(tier.getCurrency())
                .createdAt(tier.getCreatedAt())
                .updatedAt(tier.getUpdatedAt())
                .build();
    }
}
