package com.subscription.infrastructure.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the payment event consumer on its own thread for the lifetime of the application.
 *
 * Started last and stopped first (default {@link SmartLifecycle} phase), so the loop
 * never outlives the connection pool or the Kafka producer it depends on.
 */
@Slf4j
public class PaymentEventConsumerLifecycle implements SmartLifecycle {

    private static final int DB_CHECK_TIMEOUT_SECONDS = 2;

    private final PaymentEventConsumer paymentEventConsumer;
    private final DataSource dataSource;
    private final ConsumerLoopProperties properties;

    private ExecutorService executor;
    private Future<?> task;
    private volatile boolean running;

    public PaymentEventConsumerLifecycle(PaymentEventConsumer paymentEventConsumer,
                                         DataSource dataSource,
                                         ConsumerLoopProperties properties) {
        this.paymentEventConsumer = paymentEventConsumer;
        this.dataSource = dataSource;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (paymentEventConsumer.isStopRequested()) {
            log.error("Payment event consumer was already stopped and cannot be restarted; restart the application");
            return;
        }
        log.info("Application startup: starting payment event consumer");
        checkDatabaseConnection();

        executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "payment-event-consumer"));
        task = executor.submit(paymentEventConsumer);
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Application shutdown: stopping payment event consumer");
        paymentEventConsumer.requestStop();

        try {
            task.get(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Payment event consumer did not stop within {}, interrupting", properties.getShutdownTimeout());
            task.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
        } catch (ExecutionException e) {
            log.error("Payment event consumer terminated with error: {}", e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
            running = false;
            log.info("Payment event consumer disposed");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Best effort: the pipeline retries failed transactions on its own, so an unreachable
     * database at startup is logged and otherwise ignored.
     */
    private void checkDatabaseConnection() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(DB_CHECK_TIMEOUT_SECONDS)) {
                log.info("Database connection successful during startup");
            } else {
                log.error("Database connection failed validation during startup");
            }
        } catch (SQLException e) {
            log.error("Database connection failed during startup: {}", e.getMessage());
        }
    }
}
