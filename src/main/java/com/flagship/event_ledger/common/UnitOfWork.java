package com.flagship.event_ledger.common;

import java.util.function.Supplier;

/**
 * Explicit transaction boundary for multi-step storage work.
 *
 * Every unit of work runs in a new READ_COMMITTED transaction, independent of any
 * transaction active on the calling thread. Callers either drive the boundary by
 * hand ({@link #begin()}, then {@link Transaction#commit()} or
 * {@link Transaction#rollback()}) or hand a block to {@link #execute(Supplier)},
 * which commits on normal return and rolls back on any exception.
 */
public interface UnitOfWork {

    /**
     * Opens a new transaction bound to the calling thread.
     */
    Transaction begin();

    /**
     * Runs {@code work} inside a new transaction.
     *
     * @return whatever {@code work} returned
     * @throws StorageFailureException if the storage layer fails; the transaction is rolled back first
     */
    <T> T execute(Supplier<T> work);

    default void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }

    interface Transaction {

        void commit();

        void rollback();

        boolean isCompleted();
    }
}
