package io.tempora.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import com.google.common.base.Optional;
import io.tempora.core.repository.ResourceConflictException;
import io.tempora.core.repository.ResourceNotFoundException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class BasicDatabaseStoreManager <D>
{
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final Class<? extends D> daoIface;
    private final TransactionManager transactionManager;

    protected BasicDatabaseStoreManager(Class<? extends D> daoIface, TransactionManager transactionManager)
    {
        this.daoIface = daoIface;
        this.transactionManager = transactionManager;
    }

    public <T> T requiredResource(T resource, String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        if (resource == null) {
            throw new ResourceNotFoundException("Resource does not exist: " + String.format(messageFormat, messageParameters));
        }
        return resource;
    }

    public interface NewResourceAction <T>
    {
        T call() throws ResourceConflictException;
    }

    public <T> T catchConflict(NewResourceAction<T> function,
            String messageFormat, Object... messageParameters)
            throws ResourceConflictException
    {
        try {
            return function.call();
        }
        catch (UnableToExecuteStatementException ex) {
            if (ex.getCause() instanceof SQLException) {
                SQLException sqlEx = (SQLException) ex.getCause();
                if (isConflictException(sqlEx)) {
                    throw new ResourceConflictException("Resource already exists: " + String.format(messageFormat, messageParameters), ex);
                }
            }
            throw ex;
        }
    }

    public boolean isConflictException(SQLException ex)
    {
        // h2 and postgresql
        return "23505".equals(ex.getSQLState());
    }

    public interface TransactionAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionActionWithExceptions <T, D, E1 extends Exception, E2 extends Exception>
    {
        T call(Handle handle, D dao) throws E1, E2;
    }

    public <T> T transaction(TransactionAction<T, D> action)
    {
        return transaction(action::call, RuntimeException.class, RuntimeException.class);
    }

    public <T, E1 extends Exception> T transaction(
            TransactionActionWithExceptions<T, D, E1, RuntimeException> action,
            Class<E1> exClass1)
        throws E1
    {
        return transaction(action, exClass1, RuntimeException.class);
    }

    public <T, E1 extends Exception, E2 extends Exception> T transaction(
            TransactionActionWithExceptions<T, D, E1, E2> action,
            Class<E1> exClass1,
            Class<E2> exClass2)
        throws E1, E2
    {
        return transactionManager.<T, E1, E2>begin(() -> {
            Handle handle = transactionManager.getHandle();
            return action.call(handle, handle.attach(daoIface));
        }, exClass1, exClass2);
    }

    public <T> T autoCommit(TransactionAction<T, D> action)
    {
        return transactionManager.autoCommit(() -> {
            Handle handle = transactionManager.getHandle();
            return action.call(handle, handle.attach(daoIface));
        });
    }

    public static Optional<Integer> getOptionalInt(ResultSet r, String column)
            throws SQLException
    {
        int v = r.getInt(column);
        return optional(r.wasNull(), v);
    }

    public static Optional<Long> getOptionalLong(ResultSet r, String column)
            throws SQLException
    {
        long v = r.getLong(column);
        return optional(r.wasNull(), v);
    }

    public static Instant getTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }

    public static Optional<Instant> getOptionalTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        Timestamp t = r.getTimestamp(column);
        if (r.wasNull()) {
            return Optional.absent();
        }
        else {
            return Optional.of(t.toInstant());
        }
    }

    public static Optional<String> getOptionalString(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        return optional(r.wasNull(), v);
    }

    private static <T> Optional<T> optional(boolean wasNull, T v)
    {
        if (wasNull) {
            return Optional.absent();
        }
        else {
            return Optional.of(v);
        }
    }
}
