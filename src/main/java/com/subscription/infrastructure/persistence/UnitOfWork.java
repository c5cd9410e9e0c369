package com.subscription.infrastructure.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;

/**
 * One transactional boundary scoped to a single inbound message.
 *
 * Backed by its own {@code REQUIRES_NEW} transaction, so repository calls made on the
 * owning thread run against a fresh persistence context. Closing a unit of work that was
 * neither committed nor rolled back rolls it back.
 */
@Slf4j
public class UnitOfWork implements AutoCloseable {

    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;
    private final String name;

    UnitOfWork(PlatformTransactionManager transactionManager, TransactionStatus status, String name) {
        this.transactionManager = transactionManager;
        this.status = status;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Flush and commit. Throws if the commit fails; the transaction is then already rolled back.
     */
    public void commit() {
        transactionManager.commit(status);
        log.debug("Unit of work {} committed", name);
    }

    public void rollback() {
        if (status.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(status);
            log.debug("Unit of work {} rolled back", name);
        } catch (TransactionException e) {
            log.warn("Rollback of unit of work {} failed: {}", name, e.getMessage(), e);
        }
    }

    public boolean isCompleted() {
        return status.isCompleted();
    }

    @Override
    public void close() {
        if (!status.isCompleted()) {
            log.debug("Unit of work {} closed without completion, rolling back", name);
            rollback();
        }
    }
}
