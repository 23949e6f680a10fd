package org.sqltx.xa;

import org.sqltx.commons.SqlStates;
import org.sqltx.commons.exception.TransactionException;

import java.sql.SQLException;

/**
 * The backend rejected an XA statement (duplicate Xid, branch in the wrong backend state,
 * malformed identifier) or the participant refused to issue it.
 */
public class XaProtocolException extends TransactionException {

    private static final long serialVersionUID = 1L;

    private final String xid;

    public XaProtocolException(String message, String xid) {
        this(message, xid, SqlStates.XA_PROTOCOL_ERROR);
    }

    protected XaProtocolException(String message, String xid, String sqlState) {
        super(message, sqlState);
        this.xid = xid;
    }

    /**
     * Wraps a backend error, keeping its SQLSTATE and vendor code.
     */
    public XaProtocolException(String message, String xid, SQLException cause) {
        super(message, SqlStates.sqlStateOr(cause, SqlStates.XA_PROTOCOL_ERROR), cause.getErrorCode(), cause);
        this.xid = xid;
    }

    /**
     * @return the Xid of the branch the statement referenced
     */
    public String getXid() {
        return xid;
    }
}
