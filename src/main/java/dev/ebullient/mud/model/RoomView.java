package dev.ebullient.mud.model;

import java.util.List;

/**
 * Read-only snapshot of a room as seen by one actor.
 */
public record RoomView(
        String id,
        String name,
        String description,
        List<String> exits,
        List<String> otherOccupantNames,
        List<Entry> npcs,
        List<Entry> items) {

    public record Entry(String name, String description) {
    }

    public List<String> npcNames() {
        return npcs.stream().map(Entry::name).toList();
    }

    public List<String> itemNames() {
        return items.stream().map(Entry::name).toList();
    }
}
