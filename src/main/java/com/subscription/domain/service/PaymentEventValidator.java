package com.subscription.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.subscription.domain.exception.InvalidEventException;
import com.subscription.domain.model.PaymentEventTypes;
import com.subscription.domain.model.PaymentSucceededEvent;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Schema validation for events on the payment events topic.
 *
 * Outcomes:
 * - a validated {@link PaymentSucceededEvent}
 * - empty, for event types this service does not act on (including a missing type)
 * - {@link InvalidEventException} for anything malformed (permanent, never retried)
 *
 * Type checking is strict: numbers are not accepted as strings and vice versa,
 * and fractional amounts are rejected. Unknown fields are ignored.
 */
@Slf4j
@Component
public class PaymentEventValidator {

    private final ObjectMapper strictMapper;
    private final Validator validator;

    public PaymentEventValidator(ObjectMapper objectMapper, Validator validator) {
        this.strictMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        this.strictMapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        this.strictMapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        this.validator = validator;
    }

    public Optional<PaymentSucceededEvent> validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new InvalidEventException("Event payload must be a JSON object");
        }

        JsonNode eventType = payload.get(PaymentEventTypes.FIELD);
        if (eventType == null || !eventType.isTextual()) {
            log.debug("Ignoring event without a string '{}'", PaymentEventTypes.FIELD);
            return Optional.empty();
        }
        if (PaymentEventTypes.PAYMENT_FAILED.equals(eventType.asText())) {
            log.info("Payment {} failed, subscription state unchanged", payload.path("payment_id").asText("?"));
            return Optional.empty();
        }
        if (!PaymentEventTypes.PAYMENT_SUCCEEDED.equals(eventType.asText())) {
            log.debug("Ignoring event type: {}", eventType.asText());
            return Optional.empty();
        }

        PaymentSucceededEvent event;
        try {
            event = strictMapper.treeToValue(payload, PaymentSucceededEvent.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidEventException("Malformed payment.succeeded event: " + describe(e), e);
        }

        Set<ConstraintViolation<PaymentSucceededEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            String fields = violations.stream()
                    .map(v -> v.getPropertyPath().toString())
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining(", "));
            throw new InvalidEventException("payment.succeeded event is missing required fields: " + fields);
        }
        return Optional.of(event);
    }

    private static String describe(Exception e) {
        if (e instanceof JsonProcessingException) {
            return ((JsonProcessingException) e).getOriginalMessage();
        }
        return e.getMessage();
    }
}
