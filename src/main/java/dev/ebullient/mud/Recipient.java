package dev.ebullient.mud;

/**
 * Outbound side of a live session, as seen by the world and the router.
 */
public interface Recipient {

    String sessionId();

    String username();

    /**
     * Queue text for delivery without blocking.
     *
     * @return false if the text could not be accepted (queue full or connection closed)
     */
    boolean deliver(String text);

    /** Begin teardown of this session. Safe to call more than once. */
    void disconnect(String reason);
}
