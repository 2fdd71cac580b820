package dev.ebullient.mud;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

import org.jboss.logging.Logger;

import dev.ebullient.mud.WorldException.Reason;
import dev.ebullient.mud.model.Departure;
import dev.ebullient.mud.model.DialogueLine;
import dev.ebullient.mud.model.Event;
import dev.ebullient.mud.model.Item;
import dev.ebullient.mud.model.ItemDefinition;
import dev.ebullient.mud.model.ItemLocation;
import dev.ebullient.mud.model.MoveResult;
import dev.ebullient.mud.model.Npc;
import dev.ebullient.mud.model.NpcDefinition;
import dev.ebullient.mud.model.Registration;
import dev.ebullient.mud.model.Room;
import dev.ebullient.mud.model.RoomDefinition;
import dev.ebullient.mud.model.RoomView;
import dev.ebullient.mud.model.Speech;
import dev.ebullient.mud.model.WorldDefinition;

/**
 * The single shared world: rooms, NPCs, items and the players currently in it.
 * <p>
 * Every operation runs inside one mutual-exclusion domain, so each call is
 * atomic with respect to every other call (player commands and the NPC tick alike).
 * Nothing in here performs I/O; delivery of the returned events is the caller's job.
 */
public class WorldModel {
    private static final Logger log = Logger.getLogger(WorldModel.class);

    private final Object lock = new Object();

    private final Map<String, Room> rooms = new LinkedHashMap<>();
    private final Map<String, Npc> npcs = new LinkedHashMap<>();
    private final Map<String, Item> items = new LinkedHashMap<>();

    /** Keyed by session id; iteration order is login order. */
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Map<String, String> sessionByUsername = new HashMap<>();

    private final String startRoomId;
    private final Random random;

    public WorldModel(WorldDefinition definition) {
        this(definition, new Random());
    }

    public WorldModel(WorldDefinition definition, Random random) {
        this.random = random;
        for (RoomDefinition r : definition.rooms()) {
            if (rooms.putIfAbsent(r.id(), new Room(r.id(), r.name(), r.description(), r.exits())) != null) {
                throw new IllegalArgumentException("Duplicate room id: " + r.id());
            }
        }
        for (Room room : rooms.values()) {
            room.exits().forEach((dir, target) -> {
                if (!rooms.containsKey(target)) {
                    throw new IllegalArgumentException(
                            "Exit %s from %s leads to unknown room %s".formatted(dir, room.id(), target));
                }
            });
        }
        this.startRoomId = definition.startRoom() == null && !rooms.isEmpty()
                ? rooms.keySet().iterator().next()
                : definition.startRoom();
        if (!rooms.containsKey(startRoomId)) {
            throw new IllegalArgumentException("Unknown start room: " + startRoomId);
        }

        for (NpcDefinition n : definition.npcs()) {
            requireRoom(n.room(), "NPC " + n.id());
            n.wander().forEach(w -> requireRoom(w, "NPC " + n.id() + " wander set"));
            if (!n.wander().isEmpty() && !n.wander().contains(n.room())) {
                throw new IllegalArgumentException(
                        "NPC %s starts in %s, outside its wander set %s".formatted(n.id(), n.room(), n.wander()));
            }
            Npc npc = new Npc(n.id(), n.name(), n.description(), n.room(),
                    new LinkedHashSet<>(n.wander()), n.responses());
            if (npcs.putIfAbsent(npc.id(), npc) != null) {
                throw new IllegalArgumentException("Duplicate NPC id: " + n.id());
            }
            rooms.get(n.room()).npcs().add(npc.id());
        }

        for (ItemDefinition i : definition.items()) {
            requireRoom(i.room(), "Item " + i.id());
            Item item = new Item(i.id(), i.name(), i.description(), ItemLocation.room(i.room()));
            if (items.putIfAbsent(item.id(), item) != null) {
                throw new IllegalArgumentException("Duplicate item id: " + i.id());
            }
            rooms.get(i.room()).items().add(item.id());
        }
        log.debugf("World built: %d rooms, %d NPCs, %d items (start: %s)",
                rooms.size(), npcs.size(), items.size(), startRoomId);
    }

    private void requireRoom(String roomId, String owner) {
        if (roomId == null || !rooms.containsKey(roomId)) {
            throw new IllegalArgumentException(owner + " refers to unknown room " + roomId);
        }
    }

    public String startRoomId() {
        return startRoomId;
    }

    // --- Player registry ---

    /**
     * Place a newly authenticated player in the world.
     *
     * @param requestedRoomId last persisted room; unknown rooms fall back to the start room
     */
    public Registration register(Recipient recipient, String requestedRoomId) {
        String sessionId = recipient.sessionId();
        String username = recipient.username();
        synchronized (lock) {
            if (players.containsKey(sessionId)) {
                throw new IllegalArgumentException("Session already registered: " + sessionId);
            }
            if (sessionByUsername.containsKey(key(username))) {
                throw new WorldException(Reason.ALREADY_ONLINE, username + " is already logged in.");
            }
            String roomId = requestedRoomId;
            if (roomId == null || !rooms.containsKey(roomId)) {
                if (roomId != null) {
                    log.warnf("Saved room %s for %s no longer exists; using %s", roomId, username, startRoomId);
                }
                roomId = startRoomId;
            }
            Player player = new Player(recipient, roomId);
            players.put(sessionId, player);
            sessionByUsername.put(key(username), sessionId);
            rooms.get(roomId).players().add(sessionId);
            return new Registration(viewFor(player),
                    Event.roomExcept(roomId, sessionId, username + " appears."));
        }
    }

    /**
     * Remove a player. Anything carried is left in the room the player was standing in.
     *
     * @return the departed player's last position, or null if the session was not registered
     */
    public Departure unregister(String sessionId) {
        synchronized (lock) {
            Player player = players.remove(sessionId);
            if (player == null) {
                return null;
            }
            sessionByUsername.remove(key(player.username()));
            Room room = rooms.get(player.roomId);
            room.players().remove(sessionId);

            List<String> dropped = new ArrayList<>();
            for (String itemId : List.copyOf(player.inventory)) {
                Item item = items.get(itemId);
                transferItem(item, ItemLocation.player(sessionId), ItemLocation.room(room.id()), player);
                dropped.add(item.name());
            }
            return new Departure(sessionId, player.username(), room.id(), dropped);
        }
    }

    public boolean isOnline(String username) {
        synchronized (lock) {
            return sessionByUsername.containsKey(key(username));
        }
    }

    /** Username of a registered session. */
    public String username(String actor) {
        synchronized (lock) {
            return player(actor).username();
        }
    }

    /** Online usernames in login order. */
    public List<String> who() {
        synchronized (lock) {
            return players.values().stream().map(Player::username).toList();
        }
    }

    /**
     * Live recipients for an event, resolved now.
     */
    public List<Recipient> recipientsFor(Event event) {
        synchronized (lock) {
            return switch (event.scope()) {
                case GLOBAL -> players.values().stream()
                        .map(p -> p.recipient)
                        .toList();
                case ROOM -> {
                    Room room = rooms.get(event.target());
                    if (room == null) {
                        yield List.of();
                    }
                    yield room.players().stream()
                            .filter(id -> !id.equals(event.excludeSessionId()))
                            .map(id -> players.get(id).recipient)
                            .toList();
                }
                case DIRECT -> {
                    Player p = players.get(event.target());
                    yield p == null ? List.of() : List.of(p.recipient);
                }
            };
        }
    }

    // --- Observation ---

    public RoomView lookAt(String actor) {
        synchronized (lock) {
            return viewFor(player(actor));
        }
    }

    /** The actor's current room; same view as {@link #lookAt(String)}. */
    public RoomView where(String actor) {
        return lookAt(actor);
    }

    /** Snapshot of a room with no one excluded, or null for an unknown id. */
    public RoomView describeRoom(String roomId) {
        synchronized (lock) {
            Room room = rooms.get(roomId);
            return room == null ? null : viewOf(room, null);
        }
    }

    public List<RoomView> describeRooms() {
        synchronized (lock) {
            return rooms.values().stream().map(r -> viewOf(r, null)).toList();
        }
    }

    public List<RoomView.Entry> inventory(String actor) {
        synchronized (lock) {
            return player(actor).inventory.stream()
                    .map(id -> items.get(id).toEntry())
                    .toList();
        }
    }

    // --- Movement ---

    public MoveResult move(String actor, String direction) {
        String dir = StringUtils.canonicalDirection(direction);
        synchronized (lock) {
            Player player = player(actor);
            Room from = rooms.get(player.roomId);
            String targetId = from.exit(dir);
            if (targetId == null) {
                throw new WorldException(Reason.NO_SUCH_EXIT,
                        "You can't go %s from here.".formatted(dir),
                        List.copyOf(from.exits().keySet()));
            }
            Room to = rooms.get(targetId);
            if (to == null) {
                throw new InvariantViolationException("Exit %s of %s leads nowhere".formatted(dir, from.id()));
            }

            from.players().remove(actor);
            to.players().add(actor);
            player.roomId = to.id();

            String back = to.directionTo(from.id());
            Event departure = Event.room(from.id(), "%s heads %s.".formatted(player.username(), dir));
            Event arrival = Event.roomExcept(to.id(), actor, back == null
                    ? "%s arrives.".formatted(player.username())
                    : "%s arrives from the %s.".formatted(player.username(), back));
            return new MoveResult(from.id(), dir, viewFor(player), departure, arrival);
        }
    }

    // --- Communication ---

    public Speech say(String actor, String text) {
        synchronized (lock) {
            Player player = player(actor);
            Event event = Event.roomExcept(player.roomId, actor, "[Room] %s: %s".formatted(player.username(), text));
            return new Speech(event, null, rooms.get(player.roomId).players().size() - 1);
        }
    }

    public Event shout(String actor, String text) {
        synchronized (lock) {
            Player player = player(actor);
            return Event.global("[Global] %s: %s".formatted(player.username(), text));
        }
    }

    public Event emote(String actor, String text) {
        synchronized (lock) {
            Player player = player(actor);
            return Event.roomExcept(player.roomId, actor, "%s %s".formatted(player.username(), text));
        }
    }

    /** A notice for everyone else in the actor's current room. */
    public Event notifyRoom(String actor, String text) {
        synchronized (lock) {
            return Event.roomExcept(player(actor).roomId, actor, text);
        }
    }

    public Speech whisper(String actor, String targetName, String text) {
        synchronized (lock) {
            Player player = player(actor);
            String targetSession = sessionByUsername.get(key(targetName));
            if (targetSession == null) {
                throw new WorldException(Reason.PLAYER_NOT_ONLINE,
                        "Player '%s' is not online.".formatted(targetName));
            }
            Event event = Event.direct(targetSession, "[Whisper] %s: %s".formatted(player.username(), text));
            return new Speech(event, players.get(targetSession).username(), 1);
        }
    }

    // --- Items ---

    public Item takeItem(String actor, String nameFragment) {
        synchronized (lock) {
            Player player = player(actor);
            Room room = rooms.get(player.roomId);
            Item item = resolveItem(room.items(), nameFragment, "There's no '%s' here to get.");
            transferItem(item, ItemLocation.room(room.id()), ItemLocation.player(actor), player);
            return item;
        }
    }

    public Item dropItem(String actor, String nameFragment) {
        synchronized (lock) {
            Player player = player(actor);
            Room room = rooms.get(player.roomId);
            Item item = resolveItem(player.inventory, nameFragment, "You don't have '%s' to drop.");
            transferItem(item, ItemLocation.player(actor), ItemLocation.room(room.id()), player);
            return item;
        }
    }

    private Item resolveItem(Set<String> visible, String fragment, String notFound) {
        List<Item> candidates = visible.stream().map(items::get).toList();
        List<Item> matches = StringUtils.matchByName(candidates, fragment, Item::name, Item::id);
        if (matches.isEmpty()) {
            throw new WorldException(Reason.NOT_FOUND, notFound.formatted(fragment),
                    candidates.stream().map(Item::name).toList());
        }
        if (matches.size() > 1) {
            List<String> names = matches.stream().map(Item::name).toList();
            throw new WorldException(Reason.AMBIGUOUS,
                    "Which do you mean: %s?".formatted(String.join(", ", names)), names);
        }
        return matches.get(0);
    }

    private void transferItem(Item item, ItemLocation from, ItemLocation to, Player player) {
        if (!from.equals(item.location())) {
            throw new InvariantViolationException(
                    "Item %s expected at %s but found at %s".formatted(item.id(), from, item.location()));
        }
        ownerSet(from, player).remove(item.id());
        ownerSet(to, player).add(item.id());
        item.location(to);
    }

    private Set<String> ownerSet(ItemLocation location, Player player) {
        if (location.kind() == ItemLocation.Kind.ROOM) {
            return rooms.get(location.ownerId()).items();
        }
        if (!player.sessionId().equals(location.ownerId())) {
            throw new InvariantViolationException("Item owner %s is not the acting player %s"
                    .formatted(location.ownerId(), player.sessionId()));
        }
        return player.inventory;
    }

    // --- NPCs ---

    public DialogueLine talk(String actor, String npcFragment, String keyword) {
        synchronized (lock) {
            Player player = player(actor);
            Room room = rooms.get(player.roomId);
            List<Npc> here = room.npcs().stream().map(npcs::get).toList();
            List<Npc> matches = StringUtils.matchByName(here, npcFragment, Npc::name, Npc::id);
            if (matches.isEmpty()) {
                List<Npc> elsewhere = npcs.values().stream()
                        .filter(n -> !n.roomId().equals(room.id()))
                        .toList();
                List<Npc> away = StringUtils.matchByName(elsewhere, npcFragment, Npc::name, Npc::id);
                List<String> names = here.stream().map(Npc::name).toList();
                if (!away.isEmpty()) {
                    throw new WorldException(Reason.NOT_IN_ROOM,
                            "%s isn't here.".formatted(away.get(0).name()), names);
                }
                throw new WorldException(Reason.NO_SUCH_NPC,
                        "There's no '%s' here to talk to.".formatted(npcFragment), names);
            }
            if (matches.size() > 1) {
                List<String> names = matches.stream().map(Npc::name).toList();
                throw new WorldException(Reason.AMBIGUOUS,
                        "Who do you mean: %s?".formatted(String.join(", ", names)), names);
            }
            Npc npc = matches.get(0);
            return new DialogueLine(npc.name(), keyword, npc.respondTo(keyword));
        }
    }

    /**
     * Let wandering NPCs roam. Each NPC with a wander set moves, with the given
     * probability, through one exit of its room that leads to another permitted room.
     *
     * @return a departure event for the old room and an arrival event for the new room, per move
     */
    public List<Event> tickAdvanceNpcs(double probability) {
        List<Event> events = new ArrayList<>();
        synchronized (lock) {
            for (Npc npc : npcs.values()) {
                if (!npc.wanders() || random.nextDouble() >= probability) {
                    continue;
                }
                Room from = rooms.get(npc.roomId());
                List<Map.Entry<String, String>> options = from.exits().entrySet().stream()
                        .filter(e -> npc.wanderRooms().contains(e.getValue()))
                        .filter(e -> !e.getValue().equals(from.id()))
                        .toList();
                if (options.isEmpty()) {
                    continue;
                }
                Map.Entry<String, String> exit = options.get(random.nextInt(options.size()));
                Room to = rooms.get(exit.getValue());

                from.npcs().remove(npc.id());
                to.npcs().add(npc.id());
                npc.roomId(to.id());

                String back = to.directionTo(from.id());
                events.add(Event.room(from.id(),
                        "%s wanders %s toward %s.".formatted(npc.name(), exit.getKey(), to.name())));
                events.add(Event.room(to.id(), back == null
                        ? "%s arrives.".formatted(npc.name())
                        : "%s arrives from the %s.".formatted(npc.name(), back)));
            }
        }
        return events;
    }

    /** Current room of an NPC, for tests and diagnostics. */
    public String npcRoom(String npcId) {
        synchronized (lock) {
            Npc npc = npcs.get(npcId);
            return npc == null ? null : npc.roomId();
        }
    }

    /** Owner of an item, for tests and diagnostics. */
    public ItemLocation itemLocation(String itemId) {
        synchronized (lock) {
            Item item = items.get(itemId);
            return item == null ? null : item.location();
        }
    }

    /**
     * Check that occupant sets mirror current-room fields and that every item has
     * exactly one owner that also lists it.
     *
     * @throws InvariantViolationException describing the first inconsistency found
     */
    public void verifyInvariants() {
        synchronized (lock) {
            int listed = 0;
            for (Room room : rooms.values()) {
                for (String sid : room.players()) {
                    Player p = players.get(sid);
                    if (p == null || !p.roomId.equals(room.id())) {
                        fail("Room %s lists player %s located elsewhere", room.id(), sid);
                    }
                }
                for (String npcId : room.npcs()) {
                    if (!room.id().equals(npcs.get(npcId).roomId())) {
                        fail("Room %s lists NPC %s located elsewhere", room.id(), npcId);
                    }
                }
                for (String itemId : room.items()) {
                    if (!ItemLocation.room(room.id()).equals(items.get(itemId).location())) {
                        fail("Room %s lists item %s owned elsewhere", room.id(), itemId);
                    }
                    listed++;
                }
            }
            for (Player p : players.values()) {
                Room room = rooms.get(p.roomId);
                if (room == null || !room.players().contains(p.sessionId())) {
                    fail("Player %s claims room %s which does not list it", p.username(), p.roomId);
                }
                if (!p.sessionId().equals(sessionByUsername.get(key(p.username())))) {
                    fail("Username index out of step for %s", p.username());
                }
                for (String itemId : p.inventory) {
                    if (!ItemLocation.player(p.sessionId()).equals(items.get(itemId).location())) {
                        fail("Player %s carries item %s owned elsewhere", p.username(), itemId);
                    }
                    listed++;
                }
            }
            for (Npc npc : npcs.values()) {
                if (!rooms.get(npc.roomId()).npcs().contains(npc.id())) {
                    fail("NPC %s claims room %s which does not list it", npc.id(), npc.roomId());
                }
                if (npc.wanders() && !npc.wanderRooms().contains(npc.roomId())) {
                    fail("NPC %s wandered outside its permitted rooms into %s", npc.id(), npc.roomId());
                }
            }
            if (sessionByUsername.size() != players.size()) {
                fail("%d usernames indexed for %d players", sessionByUsername.size(), players.size());
            }
            if (listed != items.size()) {
                fail("%d item ownerships listed for %d items", listed, items.size());
            }
        }
    }

    private static void fail(String format, Object... args) {
        throw new InvariantViolationException(format.formatted(args));
    }

    // --- Helpers (call with the lock held) ---

    private Player player(String actor) {
        Player player = actor == null ? null : players.get(actor);
        if (player == null) {
            throw WorldException.notAuthenticated();
        }
        return player;
    }

    private RoomView viewFor(Player player) {
        return viewOf(rooms.get(player.roomId), player.sessionId());
    }

    private RoomView viewOf(Room room, String excludeSessionId) {
        return new RoomView(
                room.id(),
                room.name(),
                room.description(),
                List.copyOf(room.exits().keySet()),
                room.players().stream()
                        .filter(id -> !id.equals(excludeSessionId))
                        .map(id -> players.get(id).username())
                        .toList(),
                room.npcs().stream().map(id -> npcs.get(id).toEntry()).toList(),
                room.items().stream().map(id -> items.get(id).toEntry()).toList());
    }

    private static String key(String username) {
        return Objects.requireNonNull(username, "username").toLowerCase();
    }

    private static final class Player {
        final Recipient recipient;
        final Set<String> inventory = new LinkedHashSet<>();
        String roomId;

        Player(Recipient recipient, String roomId) {
            this.recipient = recipient;
            this.roomId = roomId;
        }

        String sessionId() {
            return recipient.sessionId();
        }

        String username() {
            return recipient.username();
        }
    }
}
