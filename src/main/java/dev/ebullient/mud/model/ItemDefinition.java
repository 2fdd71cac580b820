package dev.ebullient.mud.model;

public record ItemDefinition(
        String id,
        String name,
        String description,
        String room) {
}
