package io.tempora.core.database;

import java.sql.SQLException;
import com.google.inject.Inject;
import io.tempora.commons.ThrowablesUtil;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private final ThreadLocal<Handle> current = new ThreadLocal<>();
    private final Jdbi dbi;

    @Inject
    public ThreadLocalTransactionManager(Jdbi dbi)
    {
        this.dbi = dbi;
    }

    @Override
    public Handle getHandle()
    {
        Handle handle = current.get();
        if (handle == null) {
            throw new IllegalStateException("Not in transaction");
        }
        return handle;
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2> func, Class<E1> e1, Class<E2> e2)
            throws E1, E2
    {
        if (current.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed");
        }

        try (Handle handle = dbi.open()) {
            handle.begin();
            current.set(handle);
            boolean committed = false;
            try {
                T result = func.get();
                commit(handle);
                committed = true;
                return result;
            }
            catch (Exception ex) {
                ThrowablesUtil.propagateIfInstanceOf(ex, e1);
                ThrowablesUtil.propagateIfInstanceOf(ex, e2);
                throw ThrowablesUtil.propagate(ex);
            }
            finally {
                current.remove();
                if (!committed) {
                    handle.rollback();
                }
            }
        }
    }

    private static void commit(Handle handle)
    {
        // PostgreSQL silently rolls back on COMMIT when a statement of the
        // transaction failed. Connection.isValid reports that state.
        boolean isValid;
        try {
            isValid = handle.getConnection().isValid(30);
        }
        catch (SQLException ex) {
            throw new TransactionException("Can't validate a transaction before commit", ex);
        }
        if (!isValid) {
            throw new TransactionException("Trying to commit a transaction that is already aborted");
        }
        handle.commit();
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException> func)
    {
        if (current.get() != null) {
            return func.get();
        }
        try (Handle handle = dbi.open()) {
            current.set(handle);
            try {
                return func.get();
            }
            finally {
                current.remove();
            }
        }
    }
}
