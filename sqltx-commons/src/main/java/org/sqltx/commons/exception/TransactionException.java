package org.sqltx.commons.exception;

import java.sql.SQLException;

/**
 * Base type of every error raised by the transaction coordination layer.
 *
 * <p>All coordination errors are {@link SQLException}s so that callers already
 * written against JDBC can handle them in the same {@code catch} blocks. Subtypes
 * let an orchestrating coordinator tell "no such transaction" from "connection
 * problem" from "protocol misuse" without inspecting messages.</p>
 *
 * <p>Backend errors that do not map to a known category are not wrapped in this
 * type; they are rethrown unchanged.</p>
 */
public class TransactionException extends SQLException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new transaction exception.
     *
     * @param message the detail message
     * @param sqlState the SQLSTATE reported to callers
     */
    public TransactionException(String message, String sqlState) {
        super(message, sqlState);
    }

    /**
     * Constructs a new transaction exception with the specified cause.
     *
     * @param message the detail message
     * @param sqlState the SQLSTATE reported to callers
     * @param cause the underlying error
     */
    public TransactionException(String message, String sqlState, Throwable cause) {
        super(message, sqlState, cause);
    }

    /**
     * Constructs a new transaction exception carrying a vendor error code.
     *
     * @param message the detail message
     * @param sqlState the SQLSTATE reported to callers
     * @param vendorCode the backend specific error code
     * @param cause the underlying error
     */
    public TransactionException(String message, String sqlState, int vendorCode, Throwable cause) {
        super(message, sqlState, vendorCode, cause);
    }
}
