package dev.ebullient.mud;

import org.jboss.logging.Logger;

import dev.ebullient.mud.model.Account;
import dev.ebullient.mud.model.SessionState;

/**
 * The login / signup exchange for one session, before it joins the world.
 * One instance per connection.
 */
public class LoginFlow {
    private static final Logger log = Logger.getLogger(LoginFlow.class);

    enum Step {
        WELCOME,
        LOGIN_USERNAME,
        LOGIN_PASSWORD,
        SIGNUP_USERNAME,
        SIGNUP_PASSWORD
    }

    private final PlayerSession session;
    private final AccountService accounts;

    private Step step = Step.WELCOME;
    private String pendingUsername;

    public LoginFlow(PlayerSession session, AccountService accounts) {
        this.session = session;
        this.accounts = accounts;
    }

    Step step() {
        return step;
    }

    /**
     * @return true if this line belongs to the login exchange
     */
    public boolean accepts(String line) {
        if (step != Step.WELCOME) {
            return true;
        }
        String word = StringUtils.normalize(line);
        return word.equals("login") || word.equals("signup");
    }

    /**
     * Advance the exchange by one line.
     *
     * @return the authenticated account once a password has been accepted, otherwise null
     */
    public Account handle(String line) {
        String input = line == null ? "" : line.trim();
        switch (step) {
            case WELCOME -> {
                session.transition(SessionState.CONNECTED, SessionState.AUTHENTICATING);
                if (StringUtils.normalize(input).equals("login")) {
                    step = Step.LOGIN_USERNAME;
                    session.ask("Username: ");
                } else {
                    step = Step.SIGNUP_USERNAME;
                    session.ask("Choose a username: ");
                }
            }
            case LOGIN_USERNAME -> {
                pendingUsername = input;
                step = Step.LOGIN_PASSWORD;
                session.ask("Password: ");
            }
            case SIGNUP_USERNAME -> {
                pendingUsername = input;
                step = Step.SIGNUP_PASSWORD;
                session.ask("Choose a password: ");
            }
            case LOGIN_PASSWORD -> {
                try {
                    return done(accounts.login(pendingUsername, input));
                } catch (AccountException e) {
                    fail("Login failed: " + e.getMessage()
                            + "\nType 'login' to try again or 'signup' to create account");
                }
            }
            case SIGNUP_PASSWORD -> {
                try {
                    return done(accounts.signup(pendingUsername, input));
                } catch (AccountException e) {
                    fail("Signup failed: " + e.getMessage()
                            + "\nType 'signup' to try again or 'login' if you already have an account");
                }
            }
        }
        return null;
    }

    /** The account was accepted but could not enter the world (already online). */
    public void rejected(String message) {
        fail("Login failed: " + message);
    }

    private Account done(Account account) {
        step = Step.WELCOME;
        pendingUsername = null;
        return account;
    }

    private void fail(String message) {
        log.debugf("Authentication for %s failed at %s", session.sessionId(), step);
        step = Step.WELCOME;
        pendingUsername = null;
        session.transition(SessionState.AUTHENTICATING, SessionState.CONNECTED);
        session.deliver(message);
    }
}
