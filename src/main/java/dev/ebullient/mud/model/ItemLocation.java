package dev.ebullient.mud.model;

/** Single owner of an item: a room or a player's inventory. */
public record ItemLocation(Kind kind, String ownerId) {

    public enum Kind {
        ROOM,
        PLAYER
    }

    public static ItemLocation room(String roomId) {
        return new ItemLocation(Kind.ROOM, roomId);
    }

    public static ItemLocation player(String sessionId) {
        return new ItemLocation(Kind.PLAYER, sessionId);
    }
}
