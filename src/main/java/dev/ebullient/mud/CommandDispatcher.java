package dev.ebullient.mud;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.mud.WorldException.Reason;
import dev.ebullient.mud.model.CommandResult;
import dev.ebullient.mud.model.DialogueLine;
import dev.ebullient.mud.model.Event;
import dev.ebullient.mud.model.Item;
import dev.ebullient.mud.model.MoveResult;
import dev.ebullient.mud.model.Speech;

/**
 * Turns one line of player input into world operations.
 * <p>
 * World failures become replies to the issuing player; nothing thrown from here
 * ever ends a session.
 */
@Singleton
public class CommandDispatcher {
    private static final Logger log = Logger.getLogger(CommandDispatcher.class);

    static final String SOMETHING_WENT_WRONG = "Something went wrong. Please try again.";

    @FunctionalInterface
    interface Handler {
        CommandResult handle(String actor, String args);
    }

    /** Verbs that work before login. */
    private static final Set<String> OPEN_VERBS = Set.of("help", "quit");

    @Inject
    WorldModel world;

    private final Map<String, Handler> verbs = new HashMap<>();

    public CommandDispatcher() {
        verbs.put("look", (actor, args) -> CommandResult.reply(TextRenderer.room(world.lookAt(actor))));
        verbs.put("l", verbs.get("look"));
        for (String dir : List.of("north", "south", "east", "west", "up", "down")) {
            verbs.put(dir, (actor, args) -> move(actor, dir));
            verbs.put(dir.substring(0, 1), verbs.get(dir));
        }
        verbs.put("move", this::moveVerb);
        verbs.put("go", this::moveVerb);
        verbs.put("say", this::say);
        verbs.put("shout", this::shout);
        verbs.put("emote", this::emote);
        verbs.put("whisper", this::whisper);
        verbs.put("get", this::take);
        verbs.put("take", this::take);
        verbs.put("drop", this::drop);
        verbs.put("inventory", (actor, args) -> CommandResult.reply(TextRenderer.inventory(world.inventory(actor))));
        verbs.put("inv", verbs.get("inventory"));
        verbs.put("i", verbs.get("inventory"));
        verbs.put("talk", this::talk);
        verbs.put("who", (actor, args) -> CommandResult.reply("Online players: " + String.join(", ", world.who())));
        verbs.put("where", (actor, args) -> CommandResult.reply("You are at " + world.where(actor).name()));
        verbs.put("help", (actor, args) -> CommandResult.reply(TextRenderer.HELP));
        verbs.put("quit", (actor, args) -> CommandResult.quit(actor == null
                ? "Goodbye!"
                : "Goodbye! Your progress has been saved."));
    }

    public CommandDispatcher(WorldModel world) {
        this();
        this.world = world;
    }

    public CommandResult dispatch(PlayerSession session, String rawLine) {
        return dispatch(session.isActive() ? session.sessionId() : null, rawLine);
    }

    /**
     * @param actor session id of an active player, or null before login
     */
    public CommandResult dispatch(String actor, String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();
        if (line.isEmpty()) {
            return CommandResult.reply(null);
        }
        String[] parts = line.split("\\s+", 2);
        String verb = parts[0].toLowerCase();
        String args = parts.length > 1 ? parts[1].trim() : "";

        Handler handler = verbs.get(verb);
        if (handler == null) {
            return CommandResult.reply("Unknown command: %s\nType 'help' for available commands".formatted(line));
        }
        if (actor == null && !OPEN_VERBS.contains(verb)) {
            return CommandResult.reply(WorldException.notAuthenticated().getMessage());
        }
        try {
            return handler.handle(actor, args);
        } catch (WorldException e) {
            log.debugf("%s: %s (%s)", verb, e.getMessage(), e.reason());
            return CommandResult.reply(render(verb, e));
        } catch (RuntimeException e) {
            log.errorf(e, "Command '%s' failed for session %s", line, actor);
            return CommandResult.reply(SOMETHING_WENT_WRONG);
        }
    }

    private CommandResult moveVerb(String actor, String args) {
        if (args.isEmpty()) {
            return CommandResult.reply("Usage: move <direction>");
        }
        return move(actor, args);
    }

    private CommandResult move(String actor, String direction) {
        MoveResult result = world.move(actor, direction);
        String reply = "You head %s.\n\n%s".formatted(result.direction(), TextRenderer.room(result.view()));
        return CommandResult.of(reply, result.departure(), result.arrival());
    }

    private CommandResult say(String actor, String text) {
        if (text.isEmpty()) {
            return CommandResult.reply("Usage: say <message>");
        }
        Speech speech = world.say(actor, text);
        String reply = speech.audience() == 0
                ? speech.event().text() + "\n(No one else is here to hear you)"
                : speech.event().text();
        return CommandResult.of(reply, speech.event());
    }

    private CommandResult shout(String actor, String text) {
        if (text.isEmpty()) {
            return CommandResult.reply("Usage: shout <message>");
        }
        // The sender is part of the global audience
        return CommandResult.of(null, world.shout(actor, text));
    }

    private CommandResult emote(String actor, String text) {
        if (text.isEmpty()) {
            return CommandResult.reply("Usage: emote <action>");
        }
        Event event = world.emote(actor, text);
        return CommandResult.of(event.text(), event);
    }

    private CommandResult whisper(String actor, String args) {
        String[] parts = args.split("\\s+", 2);
        if (parts.length < 2 || parts[1].isBlank()) {
            return CommandResult.reply("Usage: whisper <player> <message>");
        }
        String text = parts[1].trim();
        Speech speech = world.whisper(actor, parts[0], text);
        return CommandResult.of("You whisper to %s: %s".formatted(speech.listener(), text), speech.event());
    }

    private CommandResult take(String actor, String args) {
        if (args.isEmpty()) {
            return CommandResult.reply("Usage: get <item>");
        }
        Item item = world.takeItem(actor, args);
        Event seen = world.notifyRoom(actor, "%s gets %s.".formatted(world.username(actor), item.name()));
        return CommandResult.of("You get %s.".formatted(item.name()), seen);
    }

    private CommandResult drop(String actor, String args) {
        if (args.isEmpty()) {
            return CommandResult.reply("Usage: drop <item>");
        }
        Item item = world.dropItem(actor, args);
        Event seen = world.notifyRoom(actor, "%s drops %s.".formatted(world.username(actor), item.name()));
        return CommandResult.of("You drop %s.".formatted(item.name()), seen);
    }

    private CommandResult talk(String actor, String args) {
        if (args.isEmpty()) {
            return CommandResult.reply("Usage: talk <npc_name> [keyword]");
        }
        DialogueLine line;
        try {
            line = world.talk(actor, args, null);
        } catch (WorldException e) {
            // "talk maria tell me about history": first word names the NPC, the rest is the keyword
            int space = args.indexOf(' ');
            if (space < 0) {
                throw e;
            }
            line = world.talk(actor, args.substring(0, space), args.substring(space + 1).trim());
        }
        String username = world.username(actor);
        String observed = line.keyword() == null
                ? "%s talks to %s.\n%s".formatted(username, line.npcName(), line.render())
                : "%s talks to %s about %s.\n%s".formatted(username, line.npcName(), line.keyword(), line.render());
        return CommandResult.of(line.render(), world.notifyRoom(actor, observed));
    }

    private String render(String verb, WorldException e) {
        List<String> candidates = e.candidates();
        if (e.reason() == Reason.AMBIGUOUS || candidates.isEmpty() && e.reason() != Reason.NOT_FOUND) {
            return e.getMessage();
        }
        return switch (e.reason()) {
            case NO_SUCH_EXIT -> e.getMessage() + "\nAvailable exits: " + String.join(", ", candidates);
            case NO_SUCH_NPC, NOT_IN_ROOM -> e.getMessage() + "\nAvailable NPCs: " + String.join(", ", candidates);
            case NOT_FOUND -> verb.equals("drop")
                    ? e.getMessage() + "\n" + (candidates.isEmpty()
                            ? "You're not carrying anything."
                            : "You're carrying: " + String.join(", ", candidates))
                    : e.getMessage() + (candidates.isEmpty() ? "" : "\nAvailable items: " + String.join(", ", candidates));
            default -> e.getMessage();
        };
    }
}
