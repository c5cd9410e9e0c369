package com.subscription.domain.service;

import com.subscription.api.dto.TierCreateRequest;
import com.subscription.api.dto.TierUpdateRequest;
import com.subscription.domain.exception.ForbiddenException;
import com.subscription.domain.exception.ResourceNotFoundException;
import com.subscription.domain.exception.SubscriptionConflictException;
import com.subscription.infrastructure.persistence.entity.SubscriptionEntity.SubscriptionStatus;
import com.subscription.infrastructure.persistence.entity.TierEntity;
import com.subscription.infrastructure.persistence.repository.SubscriptionRepository;
import com.subscription.infrastructure.persistence.repository.TierRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TierServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T08:30:00Z");

    @Mock private TierRepository tierRepository;
    @Mock private SubscriptionRepository subscriptionRepository;

    private TierService tierService;
    private final UUID creatorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        tierService = new TierService(tierRepository, subscriptionRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void create_normalizesCurrency() {
        when(tierRepository.save(any(TierEntity.class))).thenAnswer(i -> i.getArgument(0));
        TierCreateRequest request = TierCreateRequest.builder()
                .name("Silver")
                .description("Monthly posts")
                .price(new BigDecimal("4.50"))
                .currency("eur")
                .build();

        TierEntity tier = tierService.create(creatorId, request);

        assertEquals(creatorId, tier.getCreatorId());
        assertEquals("Silver", tier.getName());
        assertEquals("EUR", tier.getCurrency());
        assertEquals(0, tier.getPrice().compareTo(new BigDecimal("4.50")));
    }

    @Test
    void get_missing_throwsNotFound() {
        UUID tierId = UUID.randomUUID();
        when(tierRepository.findById(tierId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> tierService.get(tierId));
    }

    @Test
    void update_byOwner_changesOnlyProvidedFields() {
        TierEntity tier = existingTier();
        when(tierRepository.findById(tier.getId())).thenReturn(Optional.of(tier));
        when(tierRepository.save(tier)).thenReturn(tier);

        tierService.update(creatorId, tier.getId(), TierUpdateRequest.builder().price(new BigDecimal("12.00")).build());

        assertEquals("Gold", tier.getName());
        assertEquals("USD", tier.getCurrency());
        assertEquals(0, tier.getPrice().compareTo(new BigDecimal("12.00")));
    }

    @Test
    void update_byOtherUser_isForbidden() {
        TierEntity tier = existingTier();
        when(tierRepository.findById(tier.getId())).thenReturn(Optional.of(tier));

        assertThrows(ForbiddenException.class,
                () -> tierService.update(UUID.randomUUID(), tier.getId(), TierUpdateRequest.builder().name("Hacked").build()));
        verify(tierRepository, never()).save(any());
    }

    @Test
    void delete_withActiveSubscribers_conflicts() {
        TierEntity tier = existingTier();
        when(tierRepository.findById(tier.getId())).thenReturn(Optional.of(tier));
        when(subscriptionRepository.existsByTierIdAndStatusAndExpiresAtAfter(tier.getId(), SubscriptionStatus.ACTIVE, NOW))
                .thenReturn(true);

        assertThrows(SubscriptionConflictException.class, () -> tierService.delete(creatorId, tier.getId()));
        verify(tierRepository, never()).delete(any());
    }

    @Test
    void delete_withoutActiveSubscribers_removesTier() {
        TierEntity tier = existingTier();
        when(tierRepository.findById(tier.getId())).thenReturn(Optional.of(tier));
        when(subscriptionRepository.existsByTierIdAndStatusAndExpiresAtAfter(tier.getId(), SubscriptionStatus.ACTIVE, NOW))
                .thenReturn(false);

        tierService.delete(creatorId, tier.getId());

        verify(tierRepository).delete(tier);
    }

    private TierEntity existingTier() {
        return TierEntity.builder()
                .id(UUID.randomUUID())
                .creatorId(creatorId)
                .name("Gold")
                .price(new BigDecimal("10.00"))
                .currency("USD")
                .build();
    }
}
