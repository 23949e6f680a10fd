package org.sqltx.xa;

import org.sqltx.commons.SqlStates;
import org.sqltx.commons.exception.TransactionException;

import java.sql.SQLException;

/**
 * No branch exists for the Xid: the registry holds no session for it, or the backend
 * does not know it (already committed, rolled back, or never prepared).
 */
public class NoSuchTransactionException extends TransactionException {

    private static final long serialVersionUID = 1L;

    private final String xid;

    public NoSuchTransactionException(String xid) {
        super("No transaction for xid '" + xid + "'", SqlStates.XA_UNKNOWN_XID);
        this.xid = xid;
    }

    public NoSuchTransactionException(String xid, SQLException cause) {
        super("No transaction for xid '" + xid + "': " + cause.getMessage(), SqlStates.XA_UNKNOWN_XID, cause.getErrorCode(), cause);
        this.xid = xid;
    }

    public String getXid() {
        return xid;
    }
}
