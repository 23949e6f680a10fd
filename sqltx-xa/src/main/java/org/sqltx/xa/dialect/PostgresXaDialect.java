package org.sqltx.xa.dialect;

import org.sqltx.xa.XaProtocolException;
import org.sqltx.xa.XaState;

import java.sql.SQLException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * PostgreSQL prepared transactions. The server has no XA START; the branch is an ordinary
 * transaction opened with {@code BEGIN} and turned into a prepared transaction named after
 * the Xid. Requires {@code max_prepared_transactions > 0}.
 */
public class PostgresXaDialect extends AbstractXaDialect {

    public static final String NAME = "postgresql";

    /** GIDSIZE is 200 including the terminator. */
    static final int MAX_GID_BYTES = 199;

    static final String UNDEFINED_OBJECT = "42704";
    static final String DUPLICATE_OBJECT = "42710";
    static final String OBJECT_NOT_IN_PREREQUISITE_STATE = "55000";
    static final String INVALID_TRANSACTION_STATE_CLASS = "25";

    static final String RECOVERY_QUERY = "SELECT 1 AS \"formatID\", octet_length(gid) AS gtrid_length, "
            + "0 AS bqual_length, convert_to(gid, 'UTF8') AS data "
            + "FROM pg_prepared_xacts WHERE database = current_database()";

    private static final Set<XaState> ROLLBACK_STATES = EnumSet.of(XaState.STARTED, XaState.ENDED, XaState.PREPARED);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsJdbcUrl(String jdbcUrl) {
        return jdbcUrl != null && jdbcUrl.startsWith("jdbc:postgresql:");
    }

    @Override
    protected int maxXidBytes() {
        return MAX_GID_BYTES;
    }

    @Override
    protected String escape(String xid) throws XaProtocolException {
        if (xid.indexOf('\0') >= 0) {
            throw new XaProtocolException("Xid must not contain NUL characters", xid);
        }
        return xid.replace("'", "''");
    }

    @Override
    public List<String> startStatements(String xid) throws XaProtocolException {
        quoteXid(xid);
        return List.of("BEGIN");
    }

    @Override
    public List<String> endStatements(String xid) throws XaProtocolException {
        quoteXid(xid);
        return Collections.emptyList();
    }

    @Override
    public List<String> prepareStatements(String xid) throws XaProtocolException {
        return List.of("PREPARE TRANSACTION " + quoteXid(xid));
    }

    @Override
    public List<String> commitStatements(String xid) throws XaProtocolException {
        return List.of("COMMIT PREPARED " + quoteXid(xid));
    }

    @Override
    public List<String> commitOnePhaseStatements(String xid) throws XaProtocolException {
        quoteXid(xid);
        return List.of("COMMIT");
    }

    @Override
    public List<String> rollbackStatements(String xid, XaState state) throws XaProtocolException {
        if (state == XaState.PREPARED) {
            return List.of("ROLLBACK PREPARED " + quoteXid(xid));
        }
        quoteXid(xid);
        return List.of("ROLLBACK");
    }

    @Override
    public Set<XaState> rollbackStates() {
        return ROLLBACK_STATES;
    }

    @Override
    public String recoveryQuery() {
        return RECOVERY_QUERY;
    }

    @Override
    protected boolean isUnknownXid(SQLException e) {
        return UNDEFINED_OBJECT.equals(e.getSQLState());
    }

    @Override
    protected boolean isProtocolError(SQLException e) {
        String state = e.getSQLState();
        return state != null && (DUPLICATE_OBJECT.equals(state)
                || OBJECT_NOT_IN_PREREQUISITE_STATE.equals(state)
                || state.startsWith(INVALID_TRANSACTION_STATE_CLASS));
    }
}
