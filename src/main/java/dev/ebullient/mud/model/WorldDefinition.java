package dev.ebullient.mud.model;

import java.util.List;

public record WorldDefinition(
        String startRoom,
        List<RoomDefinition> rooms,
        List<NpcDefinition> npcs,
        List<ItemDefinition> items) {

    public WorldDefinition {
        rooms = rooms == null ? List.of() : rooms;
        npcs = npcs == null ? List.of() : npcs;
        items = items == null ? List.of() : items;
    }
}
