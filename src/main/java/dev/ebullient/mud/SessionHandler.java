package dev.ebullient.mud;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import dev.ebullient.mud.model.Account;
import dev.ebullient.mud.model.CommandResult;
import dev.ebullient.mud.model.Departure;
import dev.ebullient.mud.model.Event;
import dev.ebullient.mud.model.Registration;
import dev.ebullient.mud.model.SessionState;

/**
 * Reader loop for one connection. Every line is handled to completion on this
 * thread, and teardown also happens here, so an in-flight command always
 * finishes before the player leaves the world.
 */
public class SessionHandler implements Runnable {
    private static final Logger log = Logger.getLogger(SessionHandler.class);

    private final PlayerSession session;
    private final WorldModel world;
    private final CommandDispatcher dispatcher;
    private final BroadcastRouter router;
    private final PlayerStore store;
    private final LoginFlow login;
    private final AtomicBoolean tornDown = new AtomicBoolean();

    public SessionHandler(PlayerSession session, WorldModel world, CommandDispatcher dispatcher,
            BroadcastRouter router, AccountService accounts, PlayerStore store) {
        this.session = session;
        this.world = world;
        this.dispatcher = dispatcher;
        this.router = router;
        this.store = store;
        this.login = new LoginFlow(session, accounts);
    }

    public PlayerSession session() {
        return session;
    }

    @Override
    public void run() {
        LineConnection connection = session.connection();
        log.debugf("Session %s opened from %s", session.sessionId(), session.remoteAddress());
        try {
            session.deliver(TextRenderer.WELCOME_BANNER);
            String line;
            while (session.state().isLive() && (line = connection.readLine()) != null) {
                if (!handleLine(line)) {
                    break;
                }
            }
        } catch (SocketTimeoutException e) {
            log.infof("Session %s idle too long", session.displayName());
            session.deliver("Disconnected for inactivity.");
        } catch (IOException e) {
            if (session.state().isLive()) {
                log.debugf("Connection to %s lost: %s", session.displayName(), e.getMessage());
            }
        } catch (RuntimeException e) {
            log.errorf(e, "Session %s failed", session.displayName());
        } finally {
            teardown();
        }
    }

    /**
     * @return false once the session should end
     */
    boolean handleLine(String line) {
        if (session.isActive()) {
            return apply(dispatcher.dispatch(session, line));
        }
        if (login.accepts(line)) {
            Account account = login.handle(line);
            if (account != null) {
                enterWorld(account);
            }
            return session.state().isLive();
        }
        return apply(dispatcher.dispatch(session, line));
    }

    private boolean apply(CommandResult result) {
        if (result.reply() != null && !session.deliver(result.reply())) {
            session.disconnect("outbound queue full");
            return false;
        }
        router.publishAll(result.events());
        return !result.quit();
    }

    private void enterWorld(Account account) {
        session.username(account.username());
        Registration registration;
        try {
            registration = world.register(session, account.roomId());
        } catch (WorldException e) {
            session.username(null);
            login.rejected(e.getMessage());
            return;
        }
        if (!session.transition(SessionState.AUTHENTICATING, SessionState.ACTIVE)) {
            // Disconnected while logging in
            world.unregister(session.sessionId());
            return;
        }
        log.infof("%s entered the world at %s (%s)",
                account.username(), registration.view().id(), session.remoteAddress());

        String greeting = account.newAccount()
                ? "Account created! Welcome to the San Antonio MUD, %s!\n\n%s\n\nYou appear at %s"
                        .formatted(account.username(), TextRenderer.WELCOME_GUIDE, registration.view().name())
                : "Welcome back, %s!\nYou are at %s\nType 'help' to see available commands"
                        .formatted(account.username(), registration.view().name());
        session.deliver(greeting + "\n\n" + TextRenderer.room(registration.view()));
        router.publish(registration.arrival());
    }

    /**
     * Leave the world (if joined), remember where, tell the room, close. Runs once.
     */
    void teardown() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        session.markDisconnecting();
        try {
            Departure departure = world.unregister(session.sessionId());
            if (departure != null) {
                store.persistLocation(departure.username(), departure.roomId());
                String text = departure.droppedItems().isEmpty()
                        ? "%s leaves.".formatted(departure.username())
                        : "%s leaves, leaving behind %s.".formatted(departure.username(),
                                String.join(", ", departure.droppedItems()));
                router.publish(Event.room(departure.roomId(), text));
                log.infof("%s left the world from %s", departure.username(), departure.roomId());
            }
        } catch (RuntimeException e) {
            log.errorf(e, "Teardown of %s failed", session.displayName());
        } finally {
            session.close();
            log.debugf("Session %s closed", session.sessionId());
        }
    }
}
