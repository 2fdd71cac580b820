package dev.ebullient.mud.model;

/**
 * A resolved, authenticated player.
 *
 * @param roomId last persisted room, or the start room for a new account
 */
public record Account(
        String username,
        String roomId,
        boolean newAccount) {
}
