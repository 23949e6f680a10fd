package org.sqltx.xa;

import java.sql.Connection;

/**
 * One open XA branch: the Xid, the connection that exclusively carries the branch, and
 * the branch state.
 *
 * <p>Sessions are created by {@link TwoPhaseParticipant#begin(String)}. Callers run their
 * work through {@link #getConnection()} while the session is {@link XaState#STARTED} and
 * must not close the connection or use it for anything else. The participant advances the
 * state; once a terminal operation ran (successfully or not) the session is consumed and
 * its connection is gone.</p>
 *
 * <p>Not thread-safe: operations on one Xid must be issued sequentially.</p>
 */
public final class XaSession {

    private final String xid;
    private final long createdAtNanos;
    private volatile Connection connection;
    private volatile XaState state;
    private volatile boolean consumed;

    XaSession(String xid, Connection connection, XaState state) {
        this.xid = xid;
        this.connection = connection;
        this.state = state;
        this.createdAtNanos = System.nanoTime();
    }

    public String getXid() {
        return xid;
    }

    public XaState getState() {
        return state;
    }

    /**
     * @return true once commit, one-phase commit or rollback was attempted on this session
     */
    public boolean isConsumed() {
        return consumed;
    }

    /**
     * Connection bound to the branch.
     *
     * @return the connection
     * @throws IllegalStateException if the session has been consumed
     */
    public Connection getConnection() {
        Connection current = connection;
        if (consumed || current == null) {
            throw new IllegalStateException("XA session for xid '" + xid + "' is already completed (" + state + ")");
        }
        return current;
    }

    long getAgeMillis() {
        return (System.nanoTime() - createdAtNanos) / 1_000_000;
    }

    void advance(XaState next) {
        this.state = next;
    }

    /**
     * Marks the session consumed and hands its connection back to the caller, which is
     * responsible for releasing or invalidating it.
     */
    Connection consume(XaState finalState) {
        Connection detached = connection;
        connection = null;
        consumed = true;
        if (finalState != null) {
            state = finalState;
        }
        return detached;
    }

    @Override
    public String toString() {
        return "XaSession{" +
                "xid='" + xid + '\'' +
                ", state=" + state +
                ", consumed=" + consumed +
                ", age=" + getAgeMillis() + "ms" +
                '}';
    }
}
