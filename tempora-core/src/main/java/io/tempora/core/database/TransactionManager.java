package io.tempora.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Binds a database handle to the calling thread for the duration of a unit
 * of work.
 */
public interface TransactionManager
{
    /**
     * Handle of the unit of work running on this thread.
     *
     * @throws IllegalStateException when called outside of begin or autoCommit
     */
    Handle getHandle();

    /**
     * Runs func in a new transaction. Commits when it returns, rolls back
     * when it throws. Nesting is not allowed.
     */
    <T, E1 extends Exception, E2 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2> func, Class<E1> e1, Class<E2> e2)
        throws E1, E2;

    /**
     * Joins the unit of work of this thread if any, otherwise runs func on a
     * handle in auto-commit mode.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException> func);

    @FunctionalInterface
    interface SupplierInTransaction<T, E1 extends Exception, E2 extends Exception>
    {
        T get()
                throws E1, E2;
    }
}
