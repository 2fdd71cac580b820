package dev.ebullient.mud.model;

import java.util.Objects;

/**
 * Immutable message with a delivery scope.
 *
 * @param target room id for {@link Scope#ROOM}, session id for {@link Scope#DIRECT}, null for {@link Scope#GLOBAL}
 * @param excludeSessionId session that should not receive a room event (usually the actor), or null
 */
public record Event(
        Scope scope,
        String target,
        String text,
        String excludeSessionId) {

    public Event {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(text, "text");
        if (scope != Scope.GLOBAL) {
            Objects.requireNonNull(target, "target is required for " + scope);
        }
    }

    public static Event room(String roomId, String text) {
        return new Event(Scope.ROOM, roomId, text, null);
    }

    public static Event roomExcept(String roomId, String excludeSessionId, String text) {
        return new Event(Scope.ROOM, roomId, text, excludeSessionId);
    }

    public static Event global(String text) {
        return new Event(Scope.GLOBAL, null, text, null);
    }

    public static Event direct(String sessionId, String text) {
        return new Event(Scope.DIRECT, sessionId, text, null);
    }
}
