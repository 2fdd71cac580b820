package dev.ebullient.mud;

import java.time.Instant;
import java.util.regex.Pattern;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import at.favre.lib.crypto.bcrypt.BCrypt;
import dev.ebullient.mud.AccountException.Reason;
import dev.ebullient.mud.model.Account;
import dev.ebullient.mud.model.PlayerRecord;

/**
 * Signup and login against the {@link PlayerStore}. Passwords are stored as BCrypt hashes.
 */
@Singleton
public class AccountService {
    private static final Logger log = Logger.getLogger(AccountService.class);

    private static final Pattern USERNAME = Pattern.compile("[a-z0-9_]{3,16}");
    static final int MIN_PASSWORD_LENGTH = 4;

    @ConfigProperty(name = "mud.bcrypt.cost", defaultValue = "10")
    int bcryptCost;

    @Inject
    PlayerStore store;

    @Inject
    WorldModel world;

    public Account signup(String username, String password) throws AccountException {
        String name = normalizeUsername(username);
        if (!USERNAME.matcher(name).matches()) {
            throw new AccountException(Reason.INVALID_USERNAME,
                    "Usernames are 3-16 characters: letters, digits or underscore");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new AccountException(Reason.INVALID_PASSWORD,
                    "Passwords must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        String hash = BCrypt.with(BCrypt.Version.VERSION_2Y).hashToString(bcryptCost, password.toCharArray());
        Instant now = Instant.now();
        PlayerRecord record = new PlayerRecord(name, hash, world.startRoomId(), now, now);
        if (!store.create(record)) {
            throw new AccountException(Reason.USERNAME_TAKEN, "Username already exists");
        }
        log.infof("New account: %s", name);
        return new Account(name, record.roomId(), true);
    }

    public Account login(String username, String password) throws AccountException {
        String name = normalizeUsername(username);
        PlayerRecord record = name.isEmpty() ? null : store.load(name);
        if (record == null || password == null
                || !BCrypt.verifyer().verify(password.toCharArray(), record.passwordHash()).verified) {
            log.debugf("Failed login for '%s'", name);
            throw new AccountException(Reason.BAD_CREDENTIALS, "Invalid username or password");
        }
        store.recordLogin(name, Instant.now());
        return new Account(name, record.roomId(), false);
    }

    static String normalizeUsername(String username) {
        return username == null ? "" : username.trim().toLowerCase();
    }
}
