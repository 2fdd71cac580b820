package dev.ebullient.mud.model;

/**
 * A world item. The location is guarded by the world lock.
 */
public class Item {
    private final String id;
    private final String name;
    private final String description;
    private ItemLocation location;

    public Item(String id, String name, String description, ItemLocation location) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.location = location;
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

    public ItemLocation location() {
        return location;
    }

    public void location(ItemLocation location) {
        this.location = location;
    }

    public RoomView.Entry toEntry() {
        return new RoomView.Entry(name, description);
    }
}
