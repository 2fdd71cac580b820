package dev.ebullient.mud.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A scripted character. Behaviour is data: a keyword table and the set of rooms
 * it may wander between. Only the tick changes {@link #roomId()}.
 */
public class Npc {
    private final String id;
    private final String name;
    private final String description;
    private final Map<String, String> responses;
    private final Set<String> wanderRooms;
    private String roomId;

    public Npc(String id, String name, String description, String roomId,
            Set<String> wanderRooms, Map<String, String> responses) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.roomId = roomId;
        this.wanderRooms = Set.copyOf(wanderRooms);
        this.responses = new LinkedHashMap<>();
        responses.forEach((k, v) -> this.responses.put(k.toLowerCase(), v));
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

    public String roomId() {
        return roomId;
    }

    public void roomId(String roomId) {
        this.roomId = roomId;
    }

    public Set<String> wanderRooms() {
        return wanderRooms;
    }

    public boolean wanders() {
        return !wanderRooms.isEmpty();
    }

    /**
     * Find the response for a keyword: exact key first, then a key that contains
     * the keyword (or is contained by it), then the {@code default} greeting.
     */
    public String respondTo(String keyword) {
        if (keyword != null && !keyword.isBlank()) {
            String k = keyword.trim().toLowerCase();
            String exact = responses.get(k);
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<String, String> e : responses.entrySet()) {
                if (e.getKey().equals("default")) {
                    continue;
                }
                if (e.getKey().contains(k) || k.contains(e.getKey())) {
                    return e.getValue();
                }
            }
        }
        String greeting = responses.get("default");
        return greeting != null
                ? greeting
                : name + " doesn't understand what you're asking about.";
    }

    public RoomView.Entry toEntry() {
        return new RoomView.Entry(name, description);
    }
}
