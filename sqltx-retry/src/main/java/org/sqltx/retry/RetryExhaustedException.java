package org.sqltx.retry;

import org.sqltx.commons.SqlStates;
import org.sqltx.commons.exception.TransactionException;

import java.sql.SQLException;

/**
 * Every attempt of a transaction ended in a retryable conflict.
 */
public class RetryExhaustedException extends TransactionException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    /**
     * @param attempts     number of attempts made, including the first
     * @param lastConflict the conflict that ended the last attempt
     */
    public RetryExhaustedException(int attempts, SQLException lastConflict) {
        super("Transaction still conflicting after " + attempts + " attempt(s): "
                + (lastConflict != null ? lastConflict.getMessage() : "unknown"),
                SqlStates.SERIALIZATION_FAILURE, lastConflict);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
