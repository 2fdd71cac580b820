package dev.ebullient.mud;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.mud.model.PlayerRecord;

/**
 * One JSON file per player under {@code <mud.data.dir>/players}.
 * Writes for the same username are serialized.
 */
@Singleton
public class PlayerStore {
    private static final Logger log = Logger.getLogger(PlayerStore.class);

    private final ConcurrentHashMap<String, Object> playerLocks = new ConcurrentHashMap<>();

    @ConfigProperty(name = "mud.data.dir", defaultValue = "${user.home}/.samud")
    String dataDir;

    @Inject
    ObjectMapper objectMapper;

    private Path resolvePlayerDir() {
        Path dir = Path.of(dataDir, "players");
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create player directory: " + dir, e);
            }
        }
        return dir;
    }

    private Path playerPath(String username) {
        return resolvePlayerDir().resolve(username.toLowerCase() + ".json");
    }

    private Object lockFor(String username) {
        return playerLocks.computeIfAbsent(username.toLowerCase(), k -> new Object());
    }

    public boolean exists(String username) {
        return Files.exists(playerPath(username));
    }

    /**
     * @return the stored record, or null if there is none
     */
    public PlayerRecord load(String username) {
        Path path = playerPath(username);
        synchronized (lockFor(username)) {
            if (!Files.exists(path)) {
                return null;
            }
            try {
                return objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), PlayerRecord.class);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read player record " + path, e);
            }
        }
    }

    /**
     * Write a brand-new record.
     *
     * @return false if a record for this username already exists
     */
    public boolean create(PlayerRecord record) {
        Path path = playerPath(record.username());
        synchronized (lockFor(record.username())) {
            try {
                Files.writeString(path, toJson(record), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.infof("Created player record for %s", record.username());
                return true;
            } catch (FileAlreadyExistsException e) {
                return false;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create player record " + path, e);
            }
        }
    }

    /**
     * Remember where a player was standing. Failures are logged, not thrown:
     * this runs during teardown and shutdown.
     */
    public void persistLocation(String username, String roomId) {
        update(username, r -> r.withRoom(roomId));
    }

    public void recordLogin(String username, Instant when) {
        update(username, r -> r.withLastLogin(when));
    }

    private void update(String username, UnaryOperator<PlayerRecord> change) {
        Path path = playerPath(username);
        synchronized (lockFor(username)) {
            try {
                if (!Files.exists(path)) {
                    log.warnf("No player record for %s; nothing to update", username);
                    return;
                }
                PlayerRecord current = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8),
                        PlayerRecord.class);
                write(path, change.apply(current));
            } catch (IOException | UncheckedIOException e) {
                log.errorf(e, "Failed to update player record for %s", username);
            }
        }
    }

    private void write(Path path, PlayerRecord record) {
        try {
            Files.writeString(path, toJson(record), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write player record " + path, e);
        }
    }

    private String toJson(PlayerRecord record) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
    }
}
