package com.subscription.infrastructure.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnitOfWorkTest {

    @Mock private PlatformTransactionManager transactionManager;
    @Mock private TransactionStatus status;

    private UnitOfWorkFactory factory;

    @BeforeEach
    void setUp() {
        factory = new UnitOfWorkFactory(transactionManager, Duration.ofSeconds(15));
        when(transactionManager.getTransaction(any(TransactionDefinition.class))).thenReturn(status);
    }

    @Test
    void begin_opensIndependentNamedTransaction() {
        UnitOfWork unitOfWork = factory.begin("payment-event-t-0@3");

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertEquals(TransactionDefinition.PROPAGATION_REQUIRES_NEW, definition.getValue().getPropagationBehavior());
        assertEquals("payment-event-t-0@3", definition.getValue().getName());
        assertEquals(15, definition.getValue().getTimeout());
        assertEquals("payment-event-t-0@3", unitOfWork.getName());
    }

    @Test
    void close_afterCommit_doesNotRollBack() {
        try (UnitOfWork unitOfWork = factory.begin("committed")) {
            unitOfWork.commit();
            when(status.isCompleted()).thenReturn(true);
        }

        verify(transactionManager).commit(status);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void close_withoutCompletion_rollsBack() {
        when(status.isCompleted()).thenReturn(false);

        try (UnitOfWork ignored = factory.begin("abandoned")) {
            assertFalse(ignored.isCompleted());
        }

        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void rollback_failure_isContained() {
        when(status.isCompleted()).thenReturn(false);
        doThrow(new TransactionSystemException("connection lost")).when(transactionManager).rollback(status);
        UnitOfWork unitOfWork = factory.begin("broken");

        assertDoesNotThrow(unitOfWork::rollback);
    }

    @Test
    void commit_failure_propagates() {
        doThrow(new TransactionSystemException("serialization failure")).when(transactionManager).commit(status);
        UnitOfWork unitOfWork = factory.begin("conflict");

        assertThrows(TransactionSystemException.class, unitOfWork::commit);
    }
}
