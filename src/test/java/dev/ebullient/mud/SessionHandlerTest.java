package dev.ebullient.mud;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.mud.model.ItemLocation;
import dev.ebullient.mud.model.SessionState;

class SessionHandlerTest {

    @TempDir
    Path tempDir;

    final ExecutorService pool = Executors.newCachedThreadPool();

    WorldModel world;
    BroadcastRouter router;
    CommandDispatcher dispatcher;
    PlayerStore store;
    AccountService accounts;

    @BeforeEach
    void setUp() throws Exception {
        world = TestWorlds.sanAntonio(42);
        router = new BroadcastRouter(world);
        dispatcher = new CommandDispatcher(world);

        store = new PlayerStore();
        NpcTickTest.setField(store, "dataDir", tempDir.toString());
        NpcTickTest.setField(store, "objectMapper", new ObjectMapper().findAndRegisterModules());

        accounts = new AccountService();
        NpcTickTest.setField(accounts, "bcryptCost", 4);
        NpcTickTest.setField(accounts, "store", store);
        NpcTickTest.setField(accounts, "world", world);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    record Running(PlayerSession session, FakeConnection connection, Future<?> done) {
    }

    Running connect(FakeConnection connection) {
        PlayerSession session = new PlayerSession(connection, 64);
        SessionHandler handler = new SessionHandler(session, world, dispatcher, router, accounts, store);
        session.startWriter(pool);
        return new Running(session, connection, pool.submit(handler));
    }

    @Test
    void signupPlayAndQuitPersistsRoom() throws Exception {
        Running alice = connect(new FakeConnection()
                .send("signup", "Alice", "secret", "e", "say hi", "quit"));

        alice.done().get(10, TimeUnit.SECONDS);
        String out = alice.connection().awaitOutput("Goodbye! Your progress has been saved.", 5, TimeUnit.SECONDS);

        assertTrue(out.startsWith("Welcome to the San Antonio MUD\n"), out);
        assertTrue(out.contains("Choose a username: Choose a password: "), out);
        assertTrue(out.contains("Account created! Welcome to the San Antonio MUD, alice!"), out);
        assertTrue(out.contains("=== WELCOME GUIDE ==="), out);
        assertTrue(out.contains("You head east.\n\nRiver Walk North\n"), out);
        assertTrue(out.contains("[Room] alice: hi\n(No one else is here to hear you)"), out);

        assertEquals(SessionState.CLOSED, alice.session().state());
        assertFalse(world.isOnline("alice"));
        assertEquals("riverwalk_north", store.load("alice").roomId());
        world.verifyInvariants();
    }

    @Test
    void returningPlayerStartsWhereTheyLeft() throws Exception {
        accounts.signup("bob", "hunter2");
        store.persistLocation("bob", "pearl");

        Running bob = connect(new FakeConnection().send("login", "bob", "hunter2", "look"));
        String out = bob.connection().awaitOutput("Items here:", 5, TimeUnit.SECONDS);

        assertTrue(out.contains("Username: Password: "), out);
        assertTrue(out.contains("Welcome back, bob!\nYou are at The Pearl"), out);
        assertEquals("pearl", world.where(bob.session().sessionId()).id());

        bob.connection().hangUp();
        bob.done().get(10, TimeUnit.SECONDS);
        assertFalse(world.isOnline("bob"));
    }

    @Test
    void failedLoginReturnsToWelcome() throws Exception {
        accounts.signup("bob", "hunter2");

        Running bob = connect(new FakeConnection().send("login", "bob", "wrong", "look", "quit"));
        bob.done().get(10, TimeUnit.SECONDS);
        String out = bob.connection().awaitOutput("Goodbye!", 5, TimeUnit.SECONDS);

        assertTrue(out.contains("Login failed: Invalid username or password"), out);
        assertTrue(out.contains("You must log in first. Type 'login' or 'signup'."), out);
        assertTrue(world.who().isEmpty());
    }

    @Test
    void secondLoginForOnlinePlayerIsRefused() throws Exception {
        accounts.signup("carol", "pass1234");

        Running first = connect(new FakeConnection().send("login", "carol", "pass1234"));
        first.connection().awaitOutput("Welcome back, carol!", 5, TimeUnit.SECONDS);

        Running second = connect(new FakeConnection().send("login", "carol", "pass1234", "quit"));
        second.done().get(10, TimeUnit.SECONDS);
        second.connection().awaitOutput("Login failed: carol is already logged in.", 5, TimeUnit.SECONDS);

        assertEquals(List.of("carol"), world.who());
        assertEquals(SessionState.ACTIVE, first.session().state());

        first.connection().hangUp();
        first.done().get(10, TimeUnit.SECONDS);
        assertTrue(world.who().isEmpty());
    }

    @Test
    void hangingUpLeavesCarriedItemsBehind() throws Exception {
        RecordingRecipient watcher = new RecordingRecipient("s-watcher", "watcher");
        world.register(watcher, "southtown");

        Running dave = connect(new FakeConnection().send("signup", "dave", "letmein", "s", "get brush"));
        dave.connection().awaitOutput("You get a paint-stained brush.", 5, TimeUnit.SECONDS);
        dave.connection().hangUp();
        dave.done().get(10, TimeUnit.SECONDS);

        assertTrue(watcher.received().contains("dave arrives from the north."), watcher.received().toString());
        assertTrue(watcher.received().contains("dave gets a paint-stained brush."));
        assertTrue(watcher.received().contains("dave leaves, leaving behind a paint-stained brush."));
        assertEquals(ItemLocation.room("southtown"), world.itemLocation("paint_brush"));
        assertEquals("southtown", store.load("dave").roomId());
        world.verifyInvariants();
    }

    @Test
    void shoutReachesOtherSessions() throws Exception {
        accounts.signup("erin", "pass1234");
        accounts.signup("frank", "pass1234");

        Running erin = connect(new FakeConnection().send("login", "erin", "pass1234"));
        erin.connection().awaitOutput("Welcome back, erin!", 5, TimeUnit.SECONDS);
        Running frank = connect(new FakeConnection().send("login", "frank", "pass1234", "shout hola"));

        erin.connection().awaitOutput("[Global] frank: hola", 5, TimeUnit.SECONDS);
        frank.connection().awaitOutput("[Global] frank: hola", 5, TimeUnit.SECONDS);

        erin.connection().hangUp();
        frank.connection().hangUp();
        erin.done().get(10, TimeUnit.SECONDS);
        frank.done().get(10, TimeUnit.SECONDS);
    }
}
