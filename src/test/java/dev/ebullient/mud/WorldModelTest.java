package dev.ebullient.mud;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.mud.WorldException.Reason;
import dev.ebullient.mud.model.Departure;
import dev.ebullient.mud.model.DialogueLine;
import dev.ebullient.mud.model.Event;
import dev.ebullient.mud.model.Item;
import dev.ebullient.mud.model.ItemLocation;
import dev.ebullient.mud.model.MoveResult;
import dev.ebullient.mud.model.Registration;
import dev.ebullient.mud.model.RoomDefinition;
import dev.ebullient.mud.model.RoomView;
import dev.ebullient.mud.model.Scope;
import dev.ebullient.mud.model.Speech;
import dev.ebullient.mud.model.WorldDefinition;

class WorldModelTest {

    WorldModel world;
    RecordingRecipient alice;
    RecordingRecipient bob;

    @BeforeEach
    void setUp() throws Exception {
        world = TestWorlds.sanAntonio(42);
        alice = new RecordingRecipient("s-alice", "alice");
        bob = new RecordingRecipient("s-bob", "bob");
    }

    @Test
    void register_placesPlayerAndAnnouncesArrival() {
        world.register(bob, null);
        Registration reg = world.register(alice, "alamo_plaza");

        assertEquals("alamo_plaza", reg.view().id());
        assertEquals(List.of("bob"), reg.view().otherOccupantNames());
        assertEquals(Scope.ROOM, reg.arrival().scope());
        assertEquals("alice appears.", reg.arrival().text());
        assertEquals("s-alice", reg.arrival().excludeSessionId());
        world.verifyInvariants();
    }

    @Test
    void register_unknownRoomFallsBackToStart() {
        Registration reg = world.register(alice, "demolished_mall");
        assertEquals("alamo_plaza", reg.view().id());
    }

    @Test
    void register_sameUsernameTwiceIsRejected() {
        world.register(alice, null);
        WorldException e = assertThrows(WorldException.class,
                () -> world.register(new RecordingRecipient("s-other", "Alice"), null));
        assertEquals(Reason.ALREADY_ONLINE, e.reason());
        assertEquals(List.of("alice"), world.who());
        world.verifyInvariants();
    }

    @Test
    void unregister_returnsCarriedItemsToRoomAndIsIdempotent() {
        world.register(alice, null);
        world.takeItem("s-alice", "brochure");
        world.move("s-alice", "east");

        Departure departure = world.unregister("s-alice");
        assertEquals("riverwalk_north", departure.roomId());
        assertEquals(List.of("a historic brochure"), departure.droppedItems());
        assertEquals(ItemLocation.room("riverwalk_north"), world.itemLocation("alamo_brochure"));
        assertFalse(world.isOnline("alice"));
        assertNull(world.unregister("s-alice"));
        world.verifyInvariants();
    }

    @Test
    void move_northSouthRoundTripRestoresOccupants() {
        world.register(alice, "riverwalk_north");
        world.register(bob, "riverwalk_north");
        RoomView before = world.describeRoom("riverwalk_north");

        MoveResult south = world.move("s-alice", "south");
        assertEquals("riverwalk_south", south.view().id());
        assertEquals(List.of("bob"), world.describeRoom("riverwalk_north").otherOccupantNames());
        assertEquals(List.of("alice"), world.describeRoom("riverwalk_south").otherOccupantNames());

        world.move("s-alice", "north");
        assertEquals(List.of(), world.describeRoom("riverwalk_south").otherOccupantNames());
        assertEquals(before.otherOccupantNames().size(),
                world.describeRoom("riverwalk_north").otherOccupantNames().size());
        assertTrue(world.describeRoom("riverwalk_north").otherOccupantNames().contains("alice"));
        world.verifyInvariants();
    }

    @Test
    void move_buildsDepartureAndArrivalEvents() {
        world.register(alice, null);
        MoveResult result = world.move("s-alice", "E");

        assertEquals("east", result.direction());
        assertEquals("alamo_plaza", result.fromRoomId());
        assertEquals(Event.room("alamo_plaza", "alice heads east."), result.departure());
        assertEquals(Event.roomExcept("riverwalk_north", "s-alice", "alice arrives from the west."),
                result.arrival());
    }

    @Test
    void move_noSuchExitListsExitsAndChangesNothing() {
        world.register(alice, null);
        WorldException e = assertThrows(WorldException.class, () -> world.move("s-alice", "n"));

        assertEquals(Reason.NO_SUCH_EXIT, e.reason());
        assertEquals("You can't go north from here.", e.getMessage());
        assertEquals(List.of("east", "south"), e.candidates());
        assertEquals("alamo_plaza", world.where("s-alice").id());
    }

    @Test
    void operations_requireRegisteredActor() {
        WorldException e = assertThrows(WorldException.class, () -> world.lookAt("s-nobody"));
        assertEquals(Reason.NOT_AUTHENTICATED, e.reason());
    }

    @Test
    void lookAt_excludesRequesterAndListsContents() {
        world.register(alice, null);
        world.register(bob, null);
        RoomView view = world.lookAt("s-alice");

        assertEquals("The Alamo Plaza", view.name());
        assertEquals(List.of("bob"), view.otherOccupantNames());
        assertEquals(List.of("Maria, the Tour Guide"), view.npcNames());
        assertEquals(List.of("a historic brochure"), view.itemNames());
        assertEquals(List.of("east", "south"), view.exits());
    }

    @Test
    void takeItem_partialNameResolves() {
        world.register(alice, null);
        Item item = world.takeItem("s-alice", "hist");

        assertEquals("alamo_brochure", item.id());
        assertEquals(ItemLocation.player("s-alice"), world.itemLocation("alamo_brochure"));
        assertTrue(world.lookAt("s-alice").items().isEmpty());
        assertEquals("a historic brochure", world.inventory("s-alice").get(0).name());
        world.verifyInvariants();
    }

    @Test
    void takeItem_ambiguousNameMovesNothing() {
        WorldModel small = TestWorlds.triangle(1);
        small.register(alice, null);

        WorldException e = assertThrows(WorldException.class, () -> small.takeItem("s-alice", "key"));
        assertEquals(Reason.AMBIGUOUS, e.reason());
        assertEquals(List.of("a brass key", "a bronze key"), e.candidates());
        assertEquals(ItemLocation.room("a"), small.itemLocation("brass"));
        assertEquals(ItemLocation.room("a"), small.itemLocation("bronze"));
        assertTrue(small.inventory("s-alice").isEmpty());

        assertEquals("bronze", small.takeItem("s-alice", "bron").id());
        small.verifyInvariants();
    }

    @Test
    void takeItem_notHereListsWhatIs() {
        world.register(alice, null);
        WorldException e = assertThrows(WorldException.class, () -> world.takeItem("s-alice", "churros"));
        assertEquals(Reason.NOT_FOUND, e.reason());
        assertEquals(List.of("a historic brochure"), e.candidates());
    }

    @Test
    void dropItem_leavesItemInCurrentRoom() {
        world.register(alice, null);
        world.takeItem("s-alice", "brochure");
        world.move("s-alice", "south");

        Item dropped = world.dropItem("s-alice", "BROCHURE");
        assertEquals("alamo_brochure", dropped.id());
        assertEquals(ItemLocation.room("southtown"), world.itemLocation("alamo_brochure"));

        WorldException e = assertThrows(WorldException.class, () -> world.dropItem("s-alice", "brochure"));
        assertEquals(Reason.NOT_FOUND, e.reason());
        world.verifyInvariants();
    }

    @Test
    void talk_matchesKeywordsExactlyThenBySubstring() {
        world.register(alice, null);

        DialogueLine exact = world.talk("s-alice", "maria", "history");
        assertEquals("Maria, the Tour Guide", exact.npcName());
        assertTrue(exact.text().startsWith("In 1836"));

        DialogueLine partial = world.talk("s-alice", "guide", "TEX");
        assertTrue(partial.text().startsWith("Texas fought"));

        DialogueLine greeting = world.talk("s-alice", "maria", null);
        assertTrue(greeting.text().startsWith("Welcome to the Alamo!"));

        DialogueLine unknown = world.talk("s-alice", "maria", "zeppelins");
        assertEquals(greeting.text(), unknown.text());
        assertEquals("Maria, the Tour Guide says: \"" + greeting.text() + "\"", greeting.render());
    }

    @Test
    void talk_withoutDefaultSaysItDoesNotUnderstand() {
        WorldModel small = TestWorlds.triangle(1);
        small.register(alice, "c");
        assertEquals("Gate Guard doesn't understand what you're asking about.",
                small.talk("s-alice", "guard", "weather").text());
        assertEquals("The gate stays shut.", small.talk("s-alice", "guard", "gate").text());
    }

    @Test
    void talk_distinguishesAbsentFromUnknownNpc() {
        world.register(alice, null);

        WorldException away = assertThrows(WorldException.class, () -> world.talk("s-alice", "carlos", null));
        assertEquals(Reason.NOT_IN_ROOM, away.reason());
        assertEquals(List.of("Maria, the Tour Guide"), away.candidates());

        WorldException unknown = assertThrows(WorldException.class, () -> world.talk("s-alice", "elvis", null));
        assertEquals(Reason.NO_SUCH_NPC, unknown.reason());
    }

    @Test
    void chat_eventsHaveTheRightScope() {
        world.register(alice, null);
        world.register(bob, "pearl");

        Speech say = world.say("s-alice", "hello");
        assertEquals(Event.roomExcept("alamo_plaza", "s-alice", "[Room] alice: hello"), say.event());
        assertEquals(0, say.audience());

        Event shout = world.shout("s-alice", "hello all");
        assertEquals(Event.global("[Global] alice: hello all"), shout);

        Event emote = world.emote("s-alice", "waves.");
        assertEquals("alice waves.", emote.text());

        Speech whisper = world.whisper("s-alice", "BOB", "psst");
        assertEquals(Event.direct("s-bob", "[Whisper] alice: psst"), whisper.event());
        assertEquals("bob", whisper.listener());

        WorldException e = assertThrows(WorldException.class, () -> world.whisper("s-alice", "carol", "hi"));
        assertEquals(Reason.PLAYER_NOT_ONLINE, e.reason());
        assertEquals("Player 'carol' is not online.", e.getMessage());
    }

    @Test
    void say_countsListenersInTheSameRoom() {
        world.register(alice, null);
        world.register(bob, null);
        world.register(new RecordingRecipient("s-carol", "carol"), "pearl");

        assertEquals(1, world.say("s-alice", "hi").audience());
        world.move("s-bob", "east");
        assertEquals(0, world.say("s-alice", "hi").audience());
    }

    @Test
    void talk_ambiguousNpcListsCandidatesInNameOrder() {
        WorldModel gatehouse = TestWorlds.gatehouse();
        gatehouse.register(alice, null);

        WorldException e = assertThrows(WorldException.class, () -> gatehouse.talk("s-alice", "gate", null));
        assertEquals(Reason.AMBIGUOUS, e.reason());
        assertEquals(List.of("Gate Guard", "Gate Keeper"), e.candidates());
        assertEquals("Who do you mean: Gate Guard, Gate Keeper?", e.getMessage());

        assertEquals("Halt.", gatehouse.talk("s-alice", "gate guard", null).text());
        assertEquals("Sign the ledger.", gatehouse.talk("s-alice", "keeper", null).text());
    }

    @Test
    void who_listsPlayersInLoginOrder() {
        world.register(bob, null);
        world.register(alice, null);
        world.register(new RecordingRecipient("s-carol", "carol"), null);
        world.unregister("s-alice");

        assertEquals(List.of("bob", "carol"), world.who());
    }

    @Test
    void recipientsFor_resolvesScopeAtCallTime() {
        world.register(alice, null);
        world.register(bob, null);

        assertEquals(List.of(bob), world.recipientsFor(Event.roomExcept("alamo_plaza", "s-alice", "x")));
        world.move("s-bob", "east");
        assertTrue(world.recipientsFor(Event.roomExcept("alamo_plaza", "s-alice", "x")).isEmpty());
        assertEquals(2, world.recipientsFor(Event.global("x")).size());
        assertEquals(List.of(alice), world.recipientsFor(Event.direct("s-alice", "x")));
        assertTrue(world.recipientsFor(Event.direct("s-gone", "x")).isEmpty());
    }

    @Test
    void describeRoom_unknownIdIsNull() {
        assertNull(world.describeRoom("nowhere"));
        assertNotNull(world.describeRoom("pearl"));
        assertEquals(7, world.describeRooms().size());
    }

    @Test
    void constructor_rejectsExitToUnknownRoom() {
        WorldDefinition broken = new WorldDefinition("x",
                List.of(new RoomDefinition("x", "X", "Somewhere.", Map.of("north", "y"))),
                List.of(), List.of());
        assertThrows(IllegalArgumentException.class, () -> new WorldModel(broken));
    }
}
