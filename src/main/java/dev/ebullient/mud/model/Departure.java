package dev.ebullient.mud.model;

import java.util.List;

/**
 * What remains of a player after it leaves the world.
 *
 * @param droppedItems names of carried items returned to {@code roomId}
 */
public record Departure(
        String sessionId,
        String username,
        String roomId,
        List<String> droppedItems) {
}
