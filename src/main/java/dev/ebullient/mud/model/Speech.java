package dev.ebullient.mud.model;

/**
 * A chat event and who it will reach, both taken under the world lock.
 *
 * @param listener canonical username of a whisper's target, null for room speech
 * @param audience other players who will receive the event
 */
public record Speech(
        Event event,
        String listener,
        int audience) {
}
