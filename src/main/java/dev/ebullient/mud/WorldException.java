package dev.ebullient.mud;

import java.util.List;

/**
 * A user-facing failure of a world operation. Always recovered locally and
 * rendered as a reply to the issuing session; no state was changed.
 */
public class WorldException extends RuntimeException {

    public enum Reason {
        NOT_AUTHENTICATED,
        NO_SUCH_EXIT,
        NOT_FOUND,
        AMBIGUOUS,
        NO_SUCH_NPC,
        NOT_IN_ROOM,
        PLAYER_NOT_ONLINE,
        ALREADY_ONLINE
    }

    private final Reason reason;
    private final List<String> candidates;

    public WorldException(Reason reason, String message) {
        this(reason, message, List.of());
    }

    public WorldException(Reason reason, String message, List<String> candidates) {
        super(message);
        this.reason = reason;
        this.candidates = List.copyOf(candidates);
    }

    public Reason reason() {
        return reason;
    }

    /** Available exits, matching names, or whatever else helps the player retry. */
    public List<String> candidates() {
        return candidates;
    }

    public static WorldException notAuthenticated() {
        return new WorldException(Reason.NOT_AUTHENTICATED,
                "You must log in first. Type 'login' or 'signup'.");
    }
}
