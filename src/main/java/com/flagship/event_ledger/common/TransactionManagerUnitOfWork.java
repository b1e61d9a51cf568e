package com.flagship.event_ledger.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.function.Supplier;

/**
 * {@link UnitOfWork} backed by the application's transaction manager, so JPA
 * repositories and JdbcTemplate calls made inside a unit share one connection.
 */
@Component
@Slf4j
public class TransactionManagerUnitOfWork implements UnitOfWork {

    private final PlatformTransactionManager transactionManager;
    private final TransactionDefinition definition;

    public TransactionManagerUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(
                TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.definition = def;
    }

    @Override
    public Transaction begin() {
        return new ManagedTransaction(transactionManager.getTransaction(definition));
    }

    @Override
    public <T> T execute(Supplier<T> work) {
        Transaction tx = begin();
        try {
            T result = work.get();
            tx.commit();
            return result;
        } catch (DataAccessException | TransactionException e) {
            rollbackQuietly(tx, e);
            throw new StorageFailureException("Unit of work failed: " + e.getMessage(), e);
        } catch (RuntimeException | Error e) {
            rollbackQuietly(tx, e);
            throw e;
        }
    }

    private void rollbackQuietly(Transaction tx, Throwable cause) {
        if (tx.isCompleted()) {
            return;
        }
        try {
            tx.rollback();
        } catch (RuntimeException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("Rollback failed after: {}", cause.getMessage(), rollbackFailure);
        }
    }

    private final class ManagedTransaction implements Transaction {

        private final TransactionStatus status;

        private ManagedTransaction(TransactionStatus status) {
            this.status = status;
        }

        @Override
        public void commit() {
            transactionManager.commit(status);
        }

        @Override
        public void rollback() {
            transactionManager.rollback(status);
        }

        @Override
        public boolean isCompleted() {
            return status.isCompleted();
        }
    }
}
