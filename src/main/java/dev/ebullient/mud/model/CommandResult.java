package dev.ebullient.mud.model;

import java.util.List;

/**
 * Result of one dispatched line.
 *
 * @param reply text for the issuing session only (may be null)
 * @param events notifications to publish, in order, after the reply
 * @param quit the session asked to leave
 */
public record CommandResult(
        String reply,
        List<Event> events,
        boolean quit) {

    public static CommandResult reply(String text) {
        return new CommandResult(text, List.of(), false);
    }

    public static CommandResult of(String text, Event... events) {
        return new CommandResult(text, List.of(events), false);
    }

    public static CommandResult quit(String text) {
        return new CommandResult(text, List.of(), true);
    }
}
