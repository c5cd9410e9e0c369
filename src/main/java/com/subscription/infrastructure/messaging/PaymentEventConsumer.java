package com.subscription.infrastructure.messaging;

import com.subscription.domain.model.DispatchResult;
import com.subscription.infrastructure.persistence.UnitOfWork;
import com.subscription.infrastructure.persistence.UnitOfWorkFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.FencedInstanceIdException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.InvalidGroupIdException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.apache.kafka.common.errors.UnsupportedVersionException;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Long-lived poll/process/commit loop over the payment events topic.
 *
 * Architecture:
 * - Manual offset management: auto-commit is off and an offset is committed
 *   synchronously only after the message's unit of work committed
 * - One new unit of work per message, never shared between messages
 * - Strictly sequential: one message at a time per process
 * - A transiently failing message is not committed; the partition is rewound to it
 *   and the loop backs off before polling it again
 *
 * States: STOPPED, RUNNING, STOPPING, STOPPED. A loop instance runs once; stop is
 * requested with {@link #requestStop()}, which also wakes a blocked poll or backoff.
 */
@Slf4j
public class PaymentEventConsumer implements Runnable {

    public enum State {
        STOPPED,
        RUNNING,
        STOPPING
    }

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final PaymentEventDispatcher dispatcher;
    private final UnitOfWorkFactory unitOfWorkFactory;
    private final MeterRegistry meterRegistry;
    private final ConsumerLoopProperties properties;
    private final String topic;

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile Consumer<String, byte[]> consumer;

    public PaymentEventConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                                PaymentEventDispatcher dispatcher,
                                UnitOfWorkFactory unitOfWorkFactory,
                                MeterRegistry meterRegistry,
                                ConsumerLoopProperties properties,
                                String topic) {
        this.consumerFactory = consumerFactory;
        this.dispatcher = dispatcher;
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.topic = topic;
    }

    public State getState() {
        return state.get();
    }

    /**
     * True once {@link #requestStop()} was called. The loop cannot be run again after that.
     */
    public boolean isStopRequested() {
        return stopRequested.get();
    }

    @Override
    public void run() {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException("Payment event consumer is already " + state.get());
        }

        try {
            consumer = consumerFactory.createConsumer();
            consumer.subscribe(List.of(topic));
            log.info("Payment event consumer subscribed to {}", topic);

            while (!stopRequested.get()) {
                if (!pollOnce()) {
                    break;
                }
            }
        } catch (WakeupException e) {
            log.info("Payment event consumer woken up for shutdown");
        } catch (RuntimeException e) {
            log.error("Consumer loop error: {}", e.getMessage(), e);
        } finally {
            state.set(State.STOPPING);
            closeConsumer();
            state.set(State.STOPPED);
        }
    }

    /**
     * Signal the loop to stop. Safe to call from any thread, any number of times.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("Stop signal sent to payment event consumer");
        }
        stopSignal.countDown();
        Consumer<String, byte[]> current = consumer;
        if (current != null) {
            current.wakeup();
        }
    }

    /**
     * One poll and the processing of everything it returned.
     *
     * @return false when the loop must stop
     */
    boolean pollOnce() {
        try {
            ConsumerRecords<String, byte[]> records = consumer.poll(properties.getPollTimeout());

            if (records.isEmpty()) {
                pause(properties.getIdlePause());
                return true;
            }

            boolean failed = false;
            for (TopicPartition partition : records.partitions()) {
                for (ConsumerRecord<String, byte[]> record : records.records(partition)) {
                    if (stopRequested.get()) {
                        return false;
                    }
                    if (!process(partition, record)) {
                        // rewind so the next poll redelivers it; later records of this partition wait
                        consumer.seek(partition, record.offset());
                        failed = true;
                        break;
                    }
                }
            }

            if (failed) {
                pause(properties.getFailureBackoff());
            }
            return true;

        } catch (KafkaException e) {
            return handleStreamError(e);
        }
    }

    private boolean process(TopicPartition partition, ConsumerRecord<String, byte[]> record) {
        log.debug("Consumed payment event: partition={}, offset={}", record.partition(), record.offset());

        DispatchResult result = dispatch(record);
        Counter.builder("subscription.events.consumed")
                .tag("result", result.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        if (!result.isCommittable()) {
            log.warn("Payment event {}@{} not committed, will be redelivered", partition, record.offset());
            return false;
        }

        // commit offset only after the unit of work is durable
        commitProcessed(partition, record.offset() + 1);
        return true;
    }

    /**
     * A stop requested while a record is in flight wakes the consumer and fails the
     * next blocking call. The record is already applied, so its offset is committed
     * again before the loop exits.
     */
    private void commitProcessed(TopicPartition partition, long nextOffset) {
        Map<TopicPartition, OffsetAndMetadata> offsets = Map.of(partition, new OffsetAndMetadata(nextOffset));
        try {
            consumer.commitSync(offsets);
        } catch (WakeupException e) {
            log.info("Stop requested while committing {}@{}, completing commit", partition, nextOffset);
            consumer.commitSync(offsets);
        }
    }

    private DispatchResult dispatch(ConsumerRecord<String, byte[]> record) {
        String name = "payment-event-" + record.topic() + "-" + record.partition() + "@" + record.offset();
        try (UnitOfWork unitOfWork = unitOfWorkFactory.begin(name)) {
            return dispatcher.dispatch(record, unitOfWork);
        } catch (TransactionException | DataAccessException e) {
            log.error("Could not open unit of work {}: {}", name, e.getMessage(), e);
            return DispatchResult.FAILED;
        }
    }

    private boolean handleStreamError(KafkaException e) {
        if (e instanceof WakeupException || e instanceof InterruptException) {
            log.info("Payment event consumer cancelled");
            return false;
        }

        if (e instanceof RecordDeserializationException) {
            skipUndeserializable((RecordDeserializationException) e);
            return true;
        }

        if (isFatal(e)) {
            log.error("Fatal Kafka error, stopping consumer: {}", e.getMessage(), e);
            return false;
        }

        if (e instanceof CommitFailedException || e instanceof RebalanceInProgressException) {
            log.warn("Offset commit lost to a rebalance, message may be redelivered: {}", e.getMessage());
            return true;
        }

        log.warn("Non-fatal Kafka error: {}", e.getMessage(), e);
        pause(properties.getIdlePause());
        return true;
    }

    private void skipUndeserializable(RecordDeserializationException e) {
        TopicPartition partition = e.topicPartition();
        long next = e.offset() + 1;
        log.error("Skipping undeserializable record {}@{}: {}", partition, e.offset(), e.getMessage());
        consumer.seek(partition, next);
        try {
            consumer.commitSync(Map.of(partition, new OffsetAndMetadata(next)));
        } catch (CommitFailedException | RebalanceInProgressException commitError) {
            log.warn("Offset commit for skipped record {}@{} lost to a rebalance: {}",
                    partition, e.offset(), commitError.getMessage());
        }
    }

    static boolean isFatal(KafkaException e) {
        return e instanceof AuthenticationException
                || e instanceof AuthorizationException
                || e instanceof FencedInstanceIdException
                || e instanceof InvalidGroupIdException
                || e instanceof InvalidTopicException
                || e instanceof UnsupportedVersionException;
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
        }
    }

    private void closeConsumer() {
        Consumer<String, byte[]> current = consumer;
        if (current == null) {
            return;
        }
        log.info("Closing Kafka consumer...");
        try {
            current.close(Duration.ofSeconds(5));
            log.info("Kafka consumer closed");
        } catch (KafkaException e) {
            log.warn("Error closing Kafka consumer: {}", e.getMessage(), e);
        }
    }
}
