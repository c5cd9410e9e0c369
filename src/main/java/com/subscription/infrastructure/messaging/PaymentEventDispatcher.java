package com.subscription.infrastructure.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subscription.domain.exception.InvalidEventException;
import com.subscription.domain.model.DispatchResult;
import com.subscription.domain.model.PaymentSucceededEvent;
import com.subscription.domain.service.PaymentEventValidator;
import com.subscription.domain.service.SubscriptionReconciler;
import com.subscription.infrastructure.persistence.UnitOfWork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Routes one raw message through decoding, validation and reconciliation.
 *
 * Poison messages (bad UTF-8, bad JSON, schema violations) are REJECTED: committable,
 * so they can never block the partition. Only reconciliation failures and unexpected
 * errors come back as FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventDispatcher {

    private final ObjectMapper objectMapper;
    private final PaymentEventValidator validator;
    private final SubscriptionReconciler reconciler;
    private final DeadLetterPublisher deadLetterPublisher;

    public DispatchResult dispatch(ConsumerRecord<String, byte[]> record, UnitOfWork unitOfWork) {
        try {
            JsonNode payload = decode(record.value());
            Optional<PaymentSucceededEvent> event = validator.validate(payload);

            if (event.isEmpty()) {
                return DispatchResult.SKIPPED;
            }

            log.info("Processing payment event {} for user {}",
                    event.get().getPaymentId(), event.get().getUserId());

            return reconciler.reconcile(event.get(), unitOfWork)
                    ? DispatchResult.PROCESSED
                    : DispatchResult.FAILED;

        } catch (IOException | InvalidEventException e) {
            log.error("Message validation error at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            deadLetterPublisher.publish(record, e.getMessage());
            return DispatchResult.REJECTED;

        } catch (RuntimeException e) {
            log.error("Message processing error at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage(), e);
            return DispatchResult.FAILED;
        }
    }

    private JsonNode decode(byte[] body) throws IOException {
        if (body == null || body.length == 0) {
            throw new InvalidEventException("Message has no body");
        }
        String json = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString();
        return objectMapper.readTree(json);
    }
}
