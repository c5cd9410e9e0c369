package com.subscription.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.subscription.domain.exception.InvalidEventException;
import com.subscription.domain.model.PaymentSucceededEvent;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentEventValidatorTest {

    private static final UUID PAYMENT_ID = UUID.fromString("7b0c3f4e-1a2b-4c5d-8e9f-0a1b2c3d4e5f");
    private static final UUID USER_ID = UUID.fromString("11111111-2222-4333-8444-555555555555");
    private static final UUID TIER_ID = UUID.fromString("99999999-8888-4777-8666-555555555555");

    private ObjectMapper objectMapper;
    private PaymentEventValidator validator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        validator = new PaymentEventValidator(objectMapper, Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    void validate_wellFormedSucceededEvent_returnsEvent() {
        Optional<PaymentSucceededEvent> result = validator.validate(validPayload());

        assertTrue(result.isPresent());
        PaymentSucceededEvent event = result.get();
        assertEquals(PAYMENT_ID, event.getPaymentId());
        assertEquals(USER_ID, event.getUserId());
        assertEquals(TIER_ID, event.getTierId());
        assertEquals(1500L, event.getAmount());
        assertEquals("usd", event.getCurrency());
        assertEquals(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC).toInstant(), event.getPaidAt().toInstant());
        assertEquals("cs_test_1", event.getStripeCheckoutSessionId());
    }

    @Test
    void validate_unknownFieldsAndNullIntent_areAccepted() {
        ObjectNode payload = validPayload();
        payload.putNull("stripe_payment_intent_id");
        payload.put("customer_email", "a@b.c");

        Optional<PaymentSucceededEvent> result = validator.validate(payload);

        assertTrue(result.isPresent());
        assertNull(result.get().getStripePaymentIntentId());
    }

    @Test
    void validate_otherEventType_isIgnored() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("event_type", "payment.failed");
        payload.put("payment_id", PAYMENT_ID.toString());

        assertTrue(validator.validate(payload).isEmpty());
    }

    @Test
    void validate_missingEventType_isIgnored() {
        ObjectNode payload = validPayload();
        payload.remove("event_type");

        assertTrue(validator.validate(payload).isEmpty());
    }

    @Test
    void validate_numericEventType_isIgnored() {
        ObjectNode payload = validPayload();
        payload.put("event_type", 42);

        assertTrue(validator.validate(payload).isEmpty());
    }

    @Test
    void validate_nonObjectPayload_isRejected() throws Exception {
        JsonNode array = objectMapper.readTree("[1, 2, 3]");

        assertThrows(InvalidEventException.class, () -> validator.validate(array));
    }

    @Test
    void validate_missingTierId_namesTheField() {
        ObjectNode payload = validPayload();
        payload.remove("tier_id");

        InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(payload));
        assertTrue(ex.getMessage().contains("tierId"));
    }

    @Test
    void validate_malformedUuid_isRejected() {
        ObjectNode payload = validPayload();
        payload.put("user_id", "not-a-uuid");

        assertThrows(InvalidEventException.class, () -> validator.validate(payload));
    }

    @Test
    void validate_fractionalAmount_isRejected() {
        ObjectNode payload = validPayload();
        payload.put("amount", 15.5);

        assertThrows(InvalidEventException.class, () -> validator.validate(payload));
    }

    @Test
    void validate_amountAsString_isRejected() {
        ObjectNode payload = validPayload();
        payload.put("amount", "1500");

        InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(payload));
        assertTrue(ex.getMessage().contains("1500"));
    }

    @Test
    void validate_numericCurrency_isRejected() {
        ObjectNode payload = validPayload();
        payload.put("currency", 840);

        InvalidEventException ex = assertThrows(InvalidEventException.class, () -> validator.validate(payload));
        assertTrue(ex.getMessage().contains("840"));
    }

    @Test
    void validate_numericCheckoutSessionId_isRejected() {
        ObjectNode payload = validPayload();
        payload.put("stripe_checkout_session_id", 7);

        assertThrows(InvalidEventException.class, () -> validator.validate(payload));
    }

    @Test
    void validate_paidAtWithoutOffset_isRejected() {
        ObjectNode payload = validPayload();
        payload.put("paid_at", "2024-05-01T10:00:00");

        assertThrows(InvalidEventException.class, () -> validator.validate(payload));
    }

    private ObjectNode validPayload() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("event_type", "payment.succeeded");
        payload.put("payment_id", PAYMENT_ID.toString());
        payload.put("user_id", USER_ID.toString());
        payload.put("tier_id", TIER_ID.toString());
        payload.put("amount", 1500);
        payload.put("currency", "usd");
        payload.put("paid_at", "2024-05-01T10:00:00Z");
        payload.put("stripe_payment_intent_id", "pi_test_1");
        payload.put("stripe_checkout_session_id", "cs_test_1");
        return payload;
    }
}
