package dev.ebullient.mud.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A node in the world graph. Name, description and exits are fixed at load;
 * the occupant sets are mutated under the world lock only.
 */
public class Room {
    private final String id;
    private final String name;
    private final String description;
    private final Map<String, String> exits;

    private final Set<String> players = new LinkedHashSet<>();
    private final Set<String> npcs = new LinkedHashSet<>();
    private final Set<String> items = new LinkedHashSet<>();

    public Room(String id, String name, String description, Map<String, String> exits) {
        this.id = id;
        this.name = name;
        this.description = description;
        Map<String, String> normalized = new LinkedHashMap<>();
        exits.forEach((dir, target) -> normalized.put(dir.toLowerCase(), target));
        this.exits = Collections.unmodifiableMap(normalized);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Map<String, String> exits() {
        return exits;
    }

    public String exit(String direction) {
        return exits.get(direction.toLowerCase());
    }

    /** Direction whose exit leads to the given room, or null. */
    public String directionTo(String roomId) {
        for (Map.Entry<String, String> e : exits.entrySet()) {
            if (e.getValue().equals(roomId)) {
                return e.getKey();
            }
        }
        return null;
    }

    /** Session ids of players standing here. */
    public Set<String> players() {
        return players;
    }

    public Set<String> npcs() {
        return npcs;
    }

    public Set<String> items() {
        return items;
    }
}
