package org.sqltx.xa.dialect;

import org.sqltx.commons.SqlStates;
import org.sqltx.commons.exception.TransactionConnectionException;
import org.sqltx.commons.exception.TransactionException;
import org.sqltx.xa.NoSuchTransactionException;
import org.sqltx.xa.XaProtocolException;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;

/**
 * Shared Xid validation and error translation. Subclasses say which backend errors mean
 * "unknown Xid" and which mean "protocol violation".
 */
public abstract class AbstractXaDialect implements XaDialect {

    /**
     * @return maximum length of the Xid in UTF-8 bytes
     */
    protected abstract int maxXidBytes();

    protected abstract String escape(String xid) throws XaProtocolException;

    protected abstract boolean isUnknownXid(SQLException e);

    protected abstract boolean isProtocolError(SQLException e);

    @Override
    public String quoteXid(String xid) throws XaProtocolException {
        if (xid == null || xid.isEmpty()) {
            throw new XaProtocolException("Xid must not be empty", xid);
        }
        int bytes = xid.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxXidBytes()) {
            throw new XaProtocolException("Xid is " + bytes + " bytes long, " + name()
                    + " accepts at most " + maxXidBytes(), xid);
        }
        return "'" + escape(xid) + "'";
    }

    @Override
    public SQLException translate(SQLException e, String xid, String operation) {
        if (e instanceof TransactionException) {
            return e;
        }
        if (SqlStates.isConnectionFailure(e)) {
            return new TransactionConnectionException(operation + " failed for xid '" + xid + "': " + e.getMessage(), e);
        }
        if (isUnknownXid(e)) {
            return new NoSuchTransactionException(xid, e);
        }
        if (isProtocolError(e)) {
            return new XaProtocolException(operation + " rejected by " + name() + " for xid '" + xid + "': " + e.getMessage(), xid, e);
        }
        return e;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name() + "}";
    }
}
