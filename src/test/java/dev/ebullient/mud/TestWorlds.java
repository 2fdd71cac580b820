package dev.ebullient.mud;

import java.util.List;
import java.util.Map;
import java.util.Random;

import dev.ebullient.mud.model.ItemDefinition;
import dev.ebullient.mud.model.NpcDefinition;
import dev.ebullient.mud.model.RoomDefinition;
import dev.ebullient.mud.model.WorldDefinition;

/** World fixtures shared by the tests. */
final class TestWorlds {

    private TestWorlds() {
    }

    static WorldLoader loader() throws Exception {
        WorldLoader loader = new WorldLoader();
        var field = WorldLoader.class.getDeclaredField("worldResource");
        field.setAccessible(true);
        field.set(loader, "world/san-antonio.yaml");
        return loader;
    }

    /** The shipped San Antonio world with a seeded random source. */
    static WorldModel sanAntonio(long seed) throws Exception {
        return new WorldModel(loader().loadWorld(), new Random(seed));
    }

    /**
     * Three rooms: A (east to B, south to C), B (west to A, east to C), C (north to A).
     * The cat may roam A and B only; the guard never moves.
     * A holds two keys with similar names.
     */
    static WorldModel triangle(long seed) {
        return new WorldModel(new WorldDefinition("a",
                List.of(
                        new RoomDefinition("a", "Room A", "The first room.", Map.of("east", "b", "south", "c")),
                        new RoomDefinition("b", "Room B", "The second room.", Map.of("west", "a", "east", "c")),
                        new RoomDefinition("c", "Room C", "The third room.", Map.of("north", "a"))),
                List.of(
                        new NpcDefinition("cat", "Tabby Cat", "A cat on patrol.", "a", List.of("a", "b"),
                                Map.of("default", "Mrrp.")),
                        new NpcDefinition("guard", "Gate Guard", "Stands still.", "c", List.of(),
                                Map.of("gate", "The gate stays shut."))),
                List.of(
                        new ItemDefinition("brass", "a brass key", "Shiny.", "a"),
                        new ItemDefinition("bronze", "a bronze key", "Dull.", "a"),
                        new ItemDefinition("lamp", "an oil lamp", "Unlit.", "b"))),
                new Random(seed));
    }

    /**
     * One room with two NPCs whose names both start with "Gate", declared out of
     * alphabetical order, and a porter whose name is unique.
     */
    static WorldModel gatehouse() {
        return new WorldModel(new WorldDefinition("gatehouse",
                List.of(new RoomDefinition("gatehouse", "Gatehouse", "A cramped stone room.", Map.of())),
                List.of(
                        new NpcDefinition("keeper", "Gate Keeper", "Holds the ledger.", "gatehouse", List.of(),
                                Map.of("default", "Sign the ledger.")),
                        new NpcDefinition("guard", "Gate Guard", "Holds a pike.", "gatehouse", List.of(),
                                Map.of("default", "Halt.")),
                        new NpcDefinition("porter", "Old Porter", "Dozes on a stool.", "gatehouse", List.of(),
                                Map.of("default", "Mm?", "bags", "Leave them by the door."))),
                List.of()),
                new Random(1));
    }
}
