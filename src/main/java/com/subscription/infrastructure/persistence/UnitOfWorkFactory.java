package com.subscription.infrastructure.persistence;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.time.Duration;

@Component
public class UnitOfWorkFactory {

    private final PlatformTransactionManager transactionManager;
    private final Duration transactionTimeout;

    public UnitOfWorkFactory(PlatformTransactionManager transactionManager,
                             @Value("${app.subscription.transaction-timeout:30s}") Duration transactionTimeout) {
        this.transactionManager = transactionManager;
        this.transactionTimeout = transactionTimeout;
    }

    /**
     * Begin a new, independent transaction. Never joins a transaction already bound to the thread.
     */
    public UnitOfWork begin(String name) {
        DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setName(name);
        definition.setTimeout((int) transactionTimeout.toSeconds());
        return new UnitOfWork(transactionManager, transactionManager.getTransaction(definition), name);
    }
}
