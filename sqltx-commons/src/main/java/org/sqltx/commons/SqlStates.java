package org.sqltx.commons;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * SQLSTATE constants and classification helpers shared by the XA participants
 * and the retrying transaction manager.
 */
public final class SqlStates {

    /** SQL client unable to establish connection. */
    public static final String CONNECTION_FAILURE = "08001";

    /** Serialization failure, the conflict class of serializable engines. */
    public static final String SERIALIZATION_FAILURE = "40001";

    /** Generic XA error raised by this library when the backend gives none. */
    public static final String XA_PROTOCOL_ERROR = "XAE00";

    /** XAER_NOTA: unknown transaction identifier. */
    public static final String XA_UNKNOWN_XID = "XAE04";

    /** XAER_DUPID: transaction identifier already in use. */
    public static final String XA_DUPLICATE_XID = "XAE08";

    /** XAER_PROTO: routine invoked in an improper context. */
    public static final String XA_INVALID_STATE = "XAE09";

    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    private SqlStates() {
    }

    /**
     * Returns whether the exception reports a broken or unavailable connection,
     * either through its JDBC type or through an SQLSTATE of class 08.
     *
     * @param e the exception to classify
     * @return true for connection failures
     */
    public static boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException
                || e instanceof SQLNonTransientConnectionException
                || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS);
    }

    /**
     * Walks the cause chain looking for an {@link SQLException} whose SQLSTATE is
     * one of {@code states}. Chained exceptions ({@link SQLException#getNextException()})
     * are inspected as well.
     *
     * @param t the throwable to inspect, may be null
     * @param states the SQLSTATE values to look for
     * @return true if any exception in the chain matches
     */
    public static boolean hasSqlState(Throwable t, Set<String> states) {
        Throwable current = t;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof SQLException) {
                SQLException sqlException = (SQLException) current;
                if (sqlException.getSQLState() != null && states.contains(sqlException.getSQLState())) {
                    return true;
                }
                SQLException next = sqlException.getNextException();
                if (next != null && next != current && hasSqlState(next, states)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Returns the SQLSTATE of {@code t} if it is an {@link SQLException} carrying one,
     * otherwise {@code fallback}.
     *
     * @param t the throwable, may be null
     * @param fallback the SQLSTATE to use when none is available
     * @return the SQLSTATE
     */
    public static String sqlStateOr(Throwable t, String fallback) {
        if (t instanceof SQLException && ((SQLException) t).getSQLState() != null) {
            return ((SQLException) t).getSQLState();
        }
        return fallback;
    }
}
