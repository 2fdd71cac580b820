package dev.ebullient.mud;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import dev.ebullient.mud.model.SessionState;

/**
 * Connection-side state of one client: lifecycle, identity and a bounded
 * outbound queue drained by its own writer task.
 * <p>
 * {@link #deliver(String)} never blocks. A full queue means the client is not
 * keeping up; the caller is expected to {@link #disconnect(String)} it.
 */
public class PlayerSession implements Recipient {
    private static final Logger log = Logger.getLogger(PlayerSession.class);

    static final String PROMPT = "> ";

    private static final AtomicLong IDS = new AtomicLong();

    record Outbound(String text, boolean lineBreak, boolean prompt) {
    }

    private static final Outbound END = new Outbound("", false, false);

    private final String sessionId;
    private final LineConnection connection;
    private final BlockingQueue<Outbound> outbound;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTED);
    private volatile String username;
    private volatile boolean writerStarted;

    public PlayerSession(LineConnection connection, int outboundCapacity) {
        this.sessionId = "s" + IDS.incrementAndGet();
        this.connection = connection;
        this.outbound = new ArrayBlockingQueue<>(Math.max(1, outboundCapacity));
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String username() {
        return username;
    }

    void username(String username) {
        this.username = username;
    }

    public SessionState state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    /**
     * Move between live states.
     *
     * @return false if the session is already shutting down
     */
    boolean transition(SessionState from, SessionState to) {
        return state.compareAndSet(from, to);
    }

    public String remoteAddress() {
        return connection.remoteAddress();
    }

    LineConnection connection() {
        return connection;
    }

    /** A full line, followed by the prompt once nothing else is waiting. */
    @Override
    public boolean deliver(String text) {
        return enqueue(new Outbound(text, true, true));
    }

    /** A question on the same line as the answer (no prompt). */
    public boolean ask(String question) {
        return enqueue(new Outbound(question, false, false));
    }

    private boolean enqueue(Outbound message) {
        if (!state.get().isLive()) {
            return false;
        }
        return outbound.offer(message);
    }

    /**
     * Begin teardown from any thread. Closing the connection wakes the reader,
     * which completes the teardown on its own thread.
     */
    @Override
    public void disconnect(String reason) {
        SessionState current = state.get();
        while (current.isLive()) {
            if (state.compareAndSet(current, SessionState.DISCONNECTING)) {
                log.infof("Disconnecting %s (%s): %s", displayName(), remoteAddress(), reason);
                outbound.clear();
                outbound.offer(END);
                connection.close();
                return;
            }
            current = state.get();
        }
    }

    /**
     * Leave the live states without dropping queued output.
     *
     * @return the state the session was in, if it was live; null otherwise
     */
    SessionState markDisconnecting() {
        SessionState current = state.get();
        while (current.isLive()) {
            if (state.compareAndSet(current, SessionState.DISCONNECTING)) {
                return current;
            }
            current = state.get();
        }
        return null;
    }

    /**
     * Stop accepting output and let the writer flush what is already queued,
     * then close the connection. Called once teardown is complete.
     */
    void close() {
        SessionState previous = state.getAndSet(SessionState.CLOSED);
        if (previous == SessionState.CLOSED) {
            return;
        }
        if (!writerStarted) {
            connection.close();
            return;
        }
        if (!outbound.offer(END)) {
            outbound.clear();
            outbound.offer(END);
        }
    }

    void startWriter(Executor executor) {
        writerStarted = true;
        executor.execute(this::drain);
    }

    private void drain() {
        try {
            while (true) {
                Outbound next = outbound.take();
                if (next == END) {
                    break;
                }
                connection.write(next.lineBreak() ? next.text() + "\n" : next.text());
                if (next.prompt() && outbound.isEmpty() && state.get().isLive()) {
                    connection.write(PROMPT);
                }
            }
        } catch (IOException e) {
            log.debugf("Write to %s failed: %s", displayName(), e.getMessage());
            disconnect("write failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            connection.close();
        }
    }

    String displayName() {
        return username == null ? sessionId : username;
    }

    @Override
    public String toString() {
        return "PlayerSession[" + sessionId + ", " + displayName() + ", " + state.get() + "]";
    }
}
