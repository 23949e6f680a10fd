package org.sqltx.xa.dialect;

import org.sqltx.commons.SqlStates;
import org.sqltx.xa.XaProtocolException;
import org.sqltx.xa.XaState;

import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * MySQL and MariaDB: native {@code XA START / END / PREPARE / COMMIT / ROLLBACK / RECOVER}.
 *
 * <p>The Xid is used as the global transaction id with an empty branch qualifier and the
 * default format id. Inside the literal quotes are doubled and backslash and NUL are
 * escaped, since by default the server interprets backslash escapes in string literals.</p>
 *
 * <p>A server running with {@code sql_mode=NO_BACKSLASH_ESCAPES} takes backslashes
 * literally. Use {@code new MySqlXaDialect(false)} for such servers, otherwise a Xid
 * containing a backslash is stored with the backslash doubled and recovery no longer
 * matches it. In that mode NUL cannot be written and is rejected.</p>
 */
public class MySqlXaDialect extends AbstractXaDialect {

    public static final String NAME = "mysql";

    /** gtrid limit of the XA implementation. */
    static final int MAX_GTRID_BYTES = 64;

    static final int ER_XAER_NOTA = 1397;
    static final int ER_XAER_INVAL = 1398;
    static final int ER_XAER_RMFAIL = 1399;
    static final int ER_XAER_OUTSIDE = 1400;
    static final int ER_XAER_RMERR = 1401;
    static final int ER_XAER_DUPID = 1440;

    private static final Set<XaState> ROLLBACK_STATES = EnumSet.of(XaState.STARTED, XaState.ENDED, XaState.PREPARED);

    private final boolean backslashEscapes;

    public MySqlXaDialect() {
        this(true);
    }

    /**
     * @param backslashEscapes false when the server runs with {@code NO_BACKSLASH_ESCAPES}
     */
    public MySqlXaDialect(boolean backslashEscapes) {
        this.backslashEscapes = backslashEscapes;
    }

    public boolean isBackslashEscapes() {
        return backslashEscapes;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsJdbcUrl(String jdbcUrl) {
        return jdbcUrl != null && (jdbcUrl.startsWith("jdbc:mysql:") || jdbcUrl.startsWith("jdbc:mariadb:"));
    }

    @Override
    protected int maxXidBytes() {
        return MAX_GTRID_BYTES;
    }

    @Override
    protected String escape(String xid) throws XaProtocolException {
        if (!backslashEscapes) {
            if (xid.indexOf('\0') >= 0) {
                throw new XaProtocolException("Xid must not contain NUL characters when backslash escapes are off", xid);
            }
            return xid.replace("'", "''");
        }
        StringBuilder sb = new StringBuilder(xid.length() + 8);
        for (int i = 0; i < xid.length(); i++) {
            char c = xid.charAt(i);
            switch (c) {
                case '\'':
                    sb.append("''");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\0':
                    sb.append("\\0");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public List<String> startStatements(String xid) throws XaProtocolException {
        return List.of("XA START " + quoteXid(xid));
    }

    @Override
    public List<String> endStatements(String xid) throws XaProtocolException {
        return List.of("XA END " + quoteXid(xid));
    }

    @Override
    public List<String> prepareStatements(String xid) throws XaProtocolException {
        return List.of("XA PREPARE " + quoteXid(xid));
    }

    @Override
    public List<String> commitStatements(String xid) throws XaProtocolException {
        return List.of("XA COMMIT " + quoteXid(xid));
    }

    @Override
    public List<String> commitOnePhaseStatements(String xid) throws XaProtocolException {
        return List.of("XA COMMIT " + quoteXid(xid) + " ONE PHASE");
    }

    @Override
    public List<String> rollbackStatements(String xid, XaState state) throws XaProtocolException {
        String quoted = quoteXid(xid);
        // XA ROLLBACK is refused while the branch is ACTIVE
        if (state == XaState.STARTED) {
            return List.of("XA END " + quoted, "XA ROLLBACK " + quoted);
        }
        return List.of("XA ROLLBACK " + quoted);
    }

    @Override
    public Set<XaState> rollbackStates() {
        return ROLLBACK_STATES;
    }

    @Override
    public String recoveryQuery() {
        return "XA RECOVER";
    }

    @Override
    protected boolean isUnknownXid(SQLException e) {
        return e.getErrorCode() == ER_XAER_NOTA || SqlStates.XA_UNKNOWN_XID.equals(e.getSQLState());
    }

    @Override
    protected boolean isProtocolError(SQLException e) {
        int code = e.getErrorCode();
        if (code == ER_XAER_DUPID || code == ER_XAER_INVAL || code == ER_XAER_RMFAIL
                || code == ER_XAER_OUTSIDE || code == ER_XAER_RMERR) {
            return true;
        }
        String state = e.getSQLState();
        // XAE* are XAER_* errors, XA1* are XA_RB* (branch already rolled back)
        return state != null && (state.startsWith("XAE") || state.startsWith("XA1"));
    }
}
