package dev.ebullient.mud.model;

import java.time.Instant;

public record PlayerRecord(
        String username,
        String passwordHash,
        String roomId,
        Instant createdAt,
        Instant lastLogin) {

    public PlayerRecord withRoom(String roomId) {
        return new PlayerRecord(username, passwordHash, roomId, createdAt, lastLogin);
    }

    public PlayerRecord withLastLogin(Instant lastLogin) {
        return new PlayerRecord(username, passwordHash, roomId, createdAt, lastLogin);
    }
}
