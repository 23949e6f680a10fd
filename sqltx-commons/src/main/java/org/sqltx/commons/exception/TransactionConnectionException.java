package org.sqltx.commons.exception;

import org.sqltx.commons.SqlStates;

/**
 * Raised when a connection cannot be obtained from the pool or the backend
 * connection fails while a transaction operation is in flight.
 *
 * <p>Never retried automatically by the two-phase commit path.</p>
 */
public class TransactionConnectionException extends TransactionException {

    private static final long serialVersionUID = 1L;

    public TransactionConnectionException(String message) {
        super(message, SqlStates.CONNECTION_FAILURE);
    }

    public TransactionConnectionException(String message, Throwable cause) {
        super(message, SqlStates.sqlStateOr(cause, SqlStates.CONNECTION_FAILURE), cause);
    }
}
