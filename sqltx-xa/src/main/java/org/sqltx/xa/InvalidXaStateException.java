package org.sqltx.xa;

import org.sqltx.commons.SqlStates;

/**
 * An operation was requested on a session whose state does not allow it, for example
 * {@code commit} before {@code prepare}, or any operation on a consumed session.
 * Raised before any statement reaches the backend.
 */
public class InvalidXaStateException extends XaProtocolException {

    private static final long serialVersionUID = 1L;

    private final XaState state;

    public InvalidXaStateException(String operation, String xid, XaState state, boolean consumed) {
        super("Cannot " + operation + " xid '" + xid + "' in state " + state + (consumed ? " (session already completed)" : ""),
                xid, SqlStates.XA_INVALID_STATE);
        this.state = state;
    }

    /**
     * @return the session state at the time of the rejected call
     */
    public XaState getState() {
        return state;
    }
}
