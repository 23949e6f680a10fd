package org.sqltx.xa;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One backend's side of a distributed transaction.
 *
 * <p>A branch runs {@code begin → end → prepare → commit} (or {@code rollback}), or
 * {@code begin → end → commitOnePhase} when it is the only branch. State checks happen
 * before any statement is sent; a rejected call leaves the session untouched.</p>
 *
 * <p>The {@code ...ByXid} operations and the recovery methods need no live session. They
 * run on a fresh pooled connection and are how a coordinator finishes branches left
 * prepared by a crash.</p>
 *
 * <p>Errors: {@link org.sqltx.commons.exception.TransactionConnectionException} when no
 * connection can be used, {@link XaProtocolException} when the backend refuses a statement,
 * {@link InvalidXaStateException} for calls in the wrong state and
 * {@link NoSuchTransactionException} for unknown Xids. Other backend errors propagate
 * unchanged. Nothing is retried.</p>
 */
public interface TwoPhaseParticipant {

    /**
     * Acquires a connection and starts a branch on it.
     *
     * @param xid caller chosen identifier, unique among the open branches of this participant
     * @return the session owning the connection, in state {@link XaState#STARTED}
     */
    XaSession begin(String xid) throws SQLException;

    /**
     * Ends the work of a {@link XaState#STARTED} branch.
     */
    void end(XaSession session) throws SQLException;

    /**
     * Votes on an {@link XaState#ENDED} branch. On success the branch survives restarts.
     */
    void prepare(XaSession session) throws SQLException;

    /**
     * Commits a {@link XaState#PREPARED} branch and consumes the session.
     */
    void commit(XaSession session) throws SQLException;

    /**
     * Commits an {@link XaState#ENDED} branch without a prepare vote and consumes the session.
     * Only correct when this is the sole branch of the distributed transaction; the caller
     * guarantees that.
     */
    void commitOnePhase(XaSession session) throws SQLException;

    /**
     * Rolls back a branch and consumes the session. Allowed from {@link XaState#PREPARED}
     * and from the earlier states the backend accepts.
     */
    void rollback(XaSession session) throws SQLException;

    /**
     * Commits a prepared branch known only by its Xid.
     *
     * @throws NoSuchTransactionException if the backend has no prepared branch for the Xid
     */
    void commitByXid(String xid) throws SQLException;

    /**
     * Rolls back a prepared branch known only by its Xid.
     *
     * @throws NoSuchTransactionException if the backend has no prepared branch for the Xid
     */
    void rollbackByXid(String xid) throws SQLException;

    /**
     * @return all branches the backend holds in the prepared state
     */
    List<TransactionInfo> listPreparedTransactions() throws SQLException;

    Optional<TransactionInfo> findPreparedTransaction(String xid) throws SQLException;

    /**
     * Rolls back every prepared branch whose Xid starts with {@code prefix}.
     *
     * @return the number of branches actually rolled back; individual failures are logged
     */
    int cleanupStaleTransactions(String prefix) throws SQLException;

    /**
     * Rolls back every prepared branch accepted by {@code stale}.
     *
     * @return the number of branches actually rolled back; individual failures are logged
     */
    int cleanupStaleTransactions(Predicate<TransactionInfo> stale) throws SQLException;
}
