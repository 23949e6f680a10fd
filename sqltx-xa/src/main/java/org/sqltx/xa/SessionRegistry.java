package org.sqltx.xa;

import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps open {@link XaSession}s by Xid for callers that only carry the identifier
 * between the phases of a transaction.
 *
 * <p>Every operation takes the session out of the map under the lock, releases the lock,
 * talks to the backend and, for non-terminal steps, puts the session back. The lock is
 * never held during a backend round trip, so a slow branch does not block the others.
 * While a step is in flight its Xid is invisible: a concurrent call for the same Xid fails
 * with {@link NoSuchTransactionException}.</p>
 *
 * <p>A step that was already applied is not applied twice: once a branch is ended,
 * {@code endByXid} no longer finds it, and once it is prepared neither {@code endByXid}
 * nor {@code prepareByXid} do. Such calls fail with {@link NoSuchTransactionException}
 * and leave the entry in place. If {@code end} or {@code prepare} fails the session is put
 * back unchanged, so the caller can still roll it back by Xid.</p>
 */
@Slf4j
public class SessionRegistry implements AutoCloseable {

    private final TwoPhaseParticipant participant;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, XaSession> sessions = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();

    public SessionRegistry(TwoPhaseParticipant participant) {
        if (participant == null) {
            throw new IllegalArgumentException("participant cannot be null");
        }
        this.participant = participant;
    }

    /**
     * Starts a branch and registers its session.
     *
     * @throws XaProtocolException if a session for the Xid is already registered
     */
    public void beginByXid(String xid) throws SQLException {
        lock.lock();
        try {
            if (sessions.containsKey(xid) || inFlight.contains(xid)) {
                throw new XaProtocolException("A session is already registered for xid '" + xid + "'", xid);
            }
            inFlight.add(xid);
        } finally {
            lock.unlock();
        }

        XaSession session;
        try {
            session = participant.begin(xid);
        } catch (SQLException | RuntimeException e) {
            forget(xid);
            throw e;
        }
        restore(session);
        log.debug("Registered XA session: xid={}", xid);
    }

    public void endByXid(String xid) throws SQLException {
        XaSession session = take(xid, XaState.STARTED);
        try {
            participant.end(session);
        } finally {
            restore(session);
        }
    }

    public void prepareByXid(String xid) throws SQLException {
        XaSession session = take(xid, XaState.ENDED);
        try {
            participant.prepare(session);
        } finally {
            restore(session);
        }
    }

    /**
     * Commits a prepared branch and unregisters it.
     */
    public void commitManaged(String xid) throws SQLException {
        XaSession session = take(xid, null);
        try {
            participant.commit(session);
        } finally {
            settle(session);
        }
    }

    /**
     * Commits an ended branch in one phase and unregisters it.
     */
    public void commitOnePhaseManaged(String xid) throws SQLException {
        XaSession session = take(xid, null);
        try {
            participant.commitOnePhase(session);
        } finally {
            settle(session);
        }
    }

    /**
     * Rolls back a branch and unregisters it.
     */
    public void rollbackManaged(String xid) throws SQLException {
        XaSession session = take(xid, null);
        try {
            participant.rollback(session);
        } finally {
            settle(session);
        }
    }

    /**
     * @return true if a session is registered or an operation for it is in progress
     */
    public boolean contains(String xid) {
        lock.lock();
        try {
            return sessions.containsKey(xid) || inFlight.contains(xid);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size() + inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the registered Xids, sorted
     */
    public Set<String> activeXids() {
        lock.lock();
        try {
            Set<String> xids = new TreeSet<>(sessions.keySet());
            xids.addAll(inFlight);
            return xids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rolls back every registered session, best effort. Sessions with an operation in
     * progress are left to that operation.
     */
    @Override
    public void close() {
        List<XaSession> remaining;
        lock.lock();
        try {
            remaining = new ArrayList<>(sessions.values());
            sessions.clear();
        } finally {
            lock.unlock();
        }
        for (XaSession session : remaining) {
            try {
                participant.rollback(session);
            } catch (SQLException e) {
                log.warn("Rollback on close failed for xid {}: {}", session.getXid(), e.getMessage());
            }
        }
        if (!remaining.isEmpty()) {
            log.info("Session registry closed, rolled back {} open XA session(s)", remaining.size());
        }
    }

    /**
     * Removes the session for an operation. With {@code step} set, a session already past
     * that step is treated as absent and stays registered.
     */
    private XaSession take(String xid, XaState step) throws NoSuchTransactionException {
        lock.lock();
        try {
            XaSession session = sessions.get(xid);
            if (session == null || (step != null && session.getState().compareTo(step) > 0)) {
                throw new NoSuchTransactionException(xid);
            }
            sessions.remove(xid);
            inFlight.add(xid);
            return session;
        } finally {
            lock.unlock();
        }
    }

    private void restore(XaSession session) {
        lock.lock();
        try {
            inFlight.remove(session.getXid());
            if (!session.isConsumed()) {
                sessions.put(session.getXid(), session);
            }
        } finally {
            lock.unlock();
        }
    }

    private void settle(XaSession session) {
        if (!session.isConsumed()) {
            // Rejected before reaching the backend: the branch is still open
            restore(session);
            return;
        }
        forget(session.getXid());
    }

    private void forget(String xid) {
        lock.lock();
        try {
            inFlight.remove(xid);
        } finally {
            lock.unlock();
        }
    }
}
