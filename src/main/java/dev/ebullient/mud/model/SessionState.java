package dev.ebullient.mud.model;

public enum SessionState {
    /** Transport established, not logged in */
    CONNECTED,
    /** In the middle of a login or signup exchange */
    AUTHENTICATING,
    /** Registered in the world; commands are dispatched */
    ACTIVE,
    /** Quit requested or connection lost; teardown in progress */
    DISCONNECTING,
    CLOSED;

    public boolean isLive() {
        return this != DISCONNECTING && this != CLOSED;
    }
}
