package org.sqltx.xa.dialect;

import org.sqltx.xa.XaProtocolException;
import org.sqltx.xa.XaState;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * Backend specific XA statement set.
 *
 * <p>Every statement that references a branch embeds the Xid as a literal produced by
 * {@link #quoteXid(String)}; JDBC parameter markers are never used because XA statements
 * cannot be prepared on the supported backends. Implementations are stateless and are
 * discovered through {@link java.util.ServiceLoader}, see {@link XaDialects}.</p>
 */
public interface XaDialect {

    /**
     * Short backend name, for example {@code "mysql"}.
     */
    String name();

    /**
     * @return true if connections for this JDBC url speak this dialect
     */
    boolean supportsJdbcUrl(String jdbcUrl);

    /**
     * Validates the Xid against the backend's limits and returns it as a quoted SQL literal.
     *
     * @throws XaProtocolException if the backend cannot represent the Xid
     */
    String quoteXid(String xid) throws XaProtocolException;

    List<String> startStatements(String xid) throws XaProtocolException;

    /**
     * May be empty for backends without an explicit end of work.
     */
    List<String> endStatements(String xid) throws XaProtocolException;

    List<String> prepareStatements(String xid) throws XaProtocolException;

    /**
     * Statements committing a prepared branch. They reference only the Xid, so they also
     * work on a connection other than the one that prepared the branch.
     */
    List<String> commitStatements(String xid) throws XaProtocolException;

    List<String> commitOnePhaseStatements(String xid) throws XaProtocolException;

    /**
     * Statements rolling back a branch currently in {@code state}.
     *
     * @param state one of {@link #rollbackStates()}
     */
    List<String> rollbackStatements(String xid, XaState state) throws XaProtocolException;

    /**
     * States from which this backend accepts a rollback. Always contains {@link XaState#PREPARED}.
     */
    Set<XaState> rollbackStates();

    /**
     * Query listing prepared branches with the columns {@code formatID}, {@code gtrid_length},
     * {@code bqual_length} and {@code data}.
     */
    String recoveryQuery();

    /**
     * Maps a backend error raised while running a statement for {@code xid} onto the
     * transaction exception hierarchy. Errors with no XA meaning are returned unchanged.
     *
     * @param operation the branch operation that failed, for the message
     */
    SQLException translate(SQLException e, String xid, String operation);
}
