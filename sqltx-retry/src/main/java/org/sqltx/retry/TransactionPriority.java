package org.sqltx.retry;

/**
 * Transaction priorities understood by {@code SET TRANSACTION PRIORITY}.
 */
public enum TransactionPriority {
    LOW,
    NORMAL,
    HIGH;

    public String toSql() {
        return "SET TRANSACTION PRIORITY " + name();
    }
}
