package dev.ebullient.mud;

/**
 * Signup or login was refused. The message is safe to show to the client.
 */
public class AccountException extends Exception {

    public enum Reason {
        USERNAME_TAKEN,
        INVALID_USERNAME,
        INVALID_PASSWORD,
        BAD_CREDENTIALS
    }

    private final Reason reason;

    public AccountException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
