package com.subscription.config;

import com.subscription.infrastructure.messaging.ConsumerLoopProperties;
import com.subscription.infrastructure.messaging.PaymentEventConsumer;
import com.subscription.infrastructure.messaging.PaymentEventConsumerLifecycle;
import com.subscription.infrastructure.messaging.PaymentEventDispatcher;
import com.subscription.infrastructure.persistence.UnitOfWorkFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;

import javax.sql.DataSource;

/**
 * Wires the payment event consumer. Disabled with {@code app.kafka.consumer.enabled=false}.
 */
@Configuration
@EnableConfigurationProperties(ConsumerLoopProperties.class)
@ConditionalOnProperty(prefix = "app.kafka.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MessagingConfig {

    @Bean
    public PaymentEventConsumer paymentEventConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                                                     PaymentEventDispatcher dispatcher,
                                                     UnitOfWorkFactory unitOfWorkFactory,
                                                     MeterRegistry meterRegistry,
                                                     ConsumerLoopProperties properties,
                                                     @Value("${app.kafka.topics.payment-events}") String topic) {
        return new PaymentEventConsumer(consumerFactory, dispatcher, unitOfWorkFactory, meterRegistry, properties, topic);
    }

    @Bean
    public PaymentEventConsumerLifecycle paymentEventConsumerLifecycle(PaymentEventConsumer paymentEventConsumer,
                                                                       DataSource dataSource,
                                                                       ConsumerLoopProperties properties) {
        return new PaymentEventConsumerLifecycle(paymentEventConsumer, dataSource, properties);
    }
}
