package org.sqltx.xa;

/**
 * Lifecycle of one XA transaction branch as seen by this participant.
 *
 * <p>States are strictly ordered:
 * {@code IDLE → STARTED → ENDED → PREPARED → COMMITTED | ROLLED_BACK}.
 * A one-phase commit goes straight from {@code ENDED} to {@code COMMITTED}, and an
 * abort may go from {@code STARTED} or {@code ENDED} to {@code ROLLED_BACK} where the
 * backend allows it.</p>
 */
public enum XaState {

    /**
     * No branch has been started yet.
     */
    IDLE,

    /**
     * The branch is active; work issued on the session connection belongs to it.
     */
    STARTED,

    /**
     * Work on the branch is finished. The branch can be prepared or committed in one phase.
     */
    ENDED,

    /**
     * The branch voted to commit and its outcome is durable on the backend until a
     * commit or rollback arrives, even across restarts.
     */
    PREPARED,

    /**
     * Terminal: the branch committed.
     */
    COMMITTED,

    /**
     * Terminal: the branch rolled back.
     */
    ROLLED_BACK;

    /**
     * @return true for {@link #COMMITTED} and {@link #ROLLED_BACK}
     */
    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }
}
