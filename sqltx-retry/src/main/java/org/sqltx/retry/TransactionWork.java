package org.sqltx.retry;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work run inside one transaction by {@link RetryingTransactionManager}.
 *
 * <p>The work may be invoked several times, once per attempt. Everything done through the
 * supplied connection is rolled back before a retry; side effects outside of it are the
 * caller's responsibility. Implementations must not commit, roll back or close the
 * connection.</p>
 *
 * @param <T> result of the work
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(Connection connection) throws SQLException;
}
