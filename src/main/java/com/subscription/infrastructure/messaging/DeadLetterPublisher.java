package com.subscription.infrastructure.messaging;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Forwards poison messages to the dead-letter topic for manual investigation.
 *
 * Best effort: a failed send is logged and counted but never holds back the
 * offset of the original message. Disabled when no dead-letter topic is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterPublisher {

    static final String HEADER_REASON = "x-dlt-reason";
    static final String HEADER_TOPIC = "x-original-topic";
    static final String HEADER_PARTITION = "x-original-partition";
    static final String HEADER_OFFSET = "x-original-offset";

    private static final long SEND_TIMEOUT_MS = 5_000;

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.dead-letter:}")
    private String deadLetterTopic;

    public void publish(ConsumerRecord<String, byte[]> record, String reason) {
        if (!StringUtils.hasText(deadLetterTopic)) {
            log.debug("No dead-letter topic configured, dropping {}-{}@{}",
                    record.topic(), record.partition(), record.offset());
            return;
        }

        ProducerRecord<String, byte[]> deadLetter =
                new ProducerRecord<>(deadLetterTopic, record.key(), record.value());
        deadLetter.headers()
                .add(HEADER_REASON, bytes(reason))
                .add(HEADER_TOPIC, bytes(record.topic()))
                .add(HEADER_PARTITION, bytes(String.valueOf(record.partition())))
                .add(HEADER_OFFSET, bytes(String.valueOf(record.offset())));

        try {
            log.warn("Sending {}-{}@{} to dead-letter topic {}: {}",
                    record.topic(), record.partition(), record.offset(), deadLetterTopic, reason);

            kafkaTemplate.send(deadLetter).get(SEND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            count("sent");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while dead-lettering {}-{}@{}", record.topic(), record.partition(), record.offset());
            count("error");
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            log.error("Failed to send {}-{}@{} to dead-letter topic: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage(), e);
            count("error");
        }
    }

    private void count(String result) {
        Counter.builder("subscription.events.dead_lettered")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static byte[] bytes(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }
}
