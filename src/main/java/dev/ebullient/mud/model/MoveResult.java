package dev.ebullient.mud.model;

/**
 * Outcome of a successful move: the new room as the mover sees it, plus the
 * notifications for the room left behind and the room entered.
 */
public record MoveResult(
        String fromRoomId,
        String direction,
        RoomView view,
        Event departure,
        Event arrival) {
}
