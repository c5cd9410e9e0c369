package com.subscription.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Payment confirmation published by the payment service.
 *
 * Immutable once validated. Its effect is applied to the subscription and the event
 * itself is never persisted.
 */
@Value
@Builder
@Jacksonized
public class PaymentSucceededEvent {

    @JsonProperty("event_type")
    String eventType;

    @NotNull
    @JsonProperty("payment_id")
    UUID paymentId;

    @NotNull
    @JsonProperty("user_id")
    UUID userId;

    @NotNull
    @JsonProperty("tier_id")
    UUID tierId;

    @NotNull
    @JsonProperty("amount")
    Long amount;

    @NotNull
    @JsonProperty("currency")
    String currency;

    @NotNull
    @JsonProperty("paid_at")
    OffsetDateTime paidAt;

    @JsonProperty("stripe_payment_intent_id")
    String stripePaymentIntentId;

    @NotNull
    @JsonProperty("stripe_checkout_session_id")
    String stripeCheckoutSessionId;
}
