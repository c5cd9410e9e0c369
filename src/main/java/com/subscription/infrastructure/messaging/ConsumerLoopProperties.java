package com.subscription.infrastructure.messaging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Timings of the payment event consumer loop ({@code app.kafka.consumer.*}).
 */
@Data
@ConfigurationProperties(prefix = "app.kafka.consumer")
public class ConsumerLoopProperties {

    /** Start the consumer with the application. */
    private boolean enabled = true;

    /** Upper bound on a single poll. Also bounds how long shutdown waits on an idle consumer. */
    private Duration pollTimeout = Duration.ofSeconds(1);

    /** Pause after an empty poll or a non-fatal stream error. */
    private Duration idlePause = Duration.ofMillis(100);

    /** Pause after a message failed transiently, before it is polled again. */
    private Duration failureBackoff = Duration.ofSeconds(5);

    /** How long shutdown waits for the in-flight message. */
    private Duration shutdownTimeout = Duration.ofSeconds(10);
}
