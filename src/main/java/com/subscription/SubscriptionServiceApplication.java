package com.subscription;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Subscription Service
 *
 * Creator tiers and supporter subscriptions. A subscription becomes ACTIVE when the
 * payment service reports a successful checkout on Kafka.
 *
 * Architecture:
 * - Kafka poll loop with manual offset commits (at-least-once delivery)
 * - One database transaction per payment event, offset committed after it
 * - Idempotent activation (an ACTIVE subscription absorbs redelivered events)
 * - Dead letter topic for events that can never be applied
 * - Scheduled sweep that lapses expired subscriptions
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class SubscriptionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubscriptionServiceApplication.class, args);
    }
}
