package dev.ebullient.mud.model;

import java.util.List;
import java.util.Map;

/**
 * Load-time description of a non-player character.
 *
 * @param room starting room
 * @param wander rooms the NPC may wander between; empty for a stationary NPC
 * @param responses keyword to dialogue line, in declaration order ({@code default} is the greeting)
 */
public record NpcDefinition(
        String id,
        String name,
        String description,
        String room,
        List<String> wander,
        Map<String, String> responses) {

    public NpcDefinition {
        wander = wander == null ? List.of() : wander;
        responses = responses == null ? Map.of() : responses;
    }
}
