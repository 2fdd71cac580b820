package dev.ebullient.mud.model;

import java.util.Map;

public record RoomDefinition(
        String id,
        String name,
        String description,
        Map<String, String> exits) {

    public RoomDefinition {
        exits = exits == null ? Map.of() : exits;
    }
}
