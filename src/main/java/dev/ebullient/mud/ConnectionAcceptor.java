package dev.ebullient.mud;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import io.quarkus.logging.Log;

/**
 * Owns the listening socket. Each accepted connection gets a {@link PlayerSession},
 * a writer task and a {@link SessionHandler} reader, all on the session pool.
 */
@Singleton
public class ConnectionAcceptor {

    @ConfigProperty(name = "mud.host", defaultValue = "0.0.0.0")
    String host;

    @ConfigProperty(name = "mud.port", defaultValue = "2323")
    int port;

    @ConfigProperty(name = "mud.session.outbound-capacity", defaultValue = "256")
    int outboundCapacity;

    @ConfigProperty(name = "mud.session.idle-timeout", defaultValue = "0s")
    Duration idleTimeout;

    @Inject
    WorldModel world;

    @Inject
    CommandDispatcher dispatcher;

    @Inject
    BroadcastRouter router;

    @Inject
    AccountService accounts;

    @Inject
    PlayerStore store;

    private final Set<SessionHandler> handlers = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private ExecutorService sessionPool;
    private Thread acceptThread;

    /**
     * Bind the listening socket and start accepting in the background.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            return;
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(host, port));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;
        sessionPool = Executors.newCachedThreadPool(new NamedThreadFactory("mud-session"));
        acceptThread = new NamedThreadFactory("mud-acceptor").newThread(this::acceptLoop);
        acceptThread.start();

        int bound = socket.getLocalPort();
        Log.infof("San Antonio MUD listening on %s:%d", host, bound);
        Log.infof("Connect locally with: telnet localhost %d", bound);
        Log.infof("Connect from the network with: nc %s %d", networkAddress(), bound);
    }

    /** The bound port (useful when configured as 0), or -1 if not listening. */
    public int localPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public int sessionCount() {
        return handlers.size();
    }

    private void acceptLoop() {
        ServerSocket socket = serverSocket;
        while (!socket.isClosed()) {
            try {
                Socket client = socket.accept();
                startSession(client);
            } catch (SocketException e) {
                if (!socket.isClosed()) {
                    Log.errorf(e, "Accept failed");
                }
            } catch (IOException e) {
                Log.errorf(e, "Accept failed");
            }
        }
        Log.debug("Acceptor stopped");
    }

    private void startSession(Socket client) {
        try {
            LineConnection connection = new SocketLineConnection(client, (int) idleTimeout.toMillis());
            PlayerSession session = new PlayerSession(connection, outboundCapacity);
            SessionHandler handler = new SessionHandler(session, world, dispatcher, router, accounts, store);
            handlers.add(handler);
            Log.infof("New connection from %s (%s)", connection.remoteAddress(), session.sessionId());

            session.startWriter(sessionPool);
            sessionPool.execute(() -> {
                try {
                    handler.run();
                } finally {
                    handlers.remove(handler);
                }
            });
        } catch (IOException e) {
            Log.warnf("Could not set up connection from %s: %s", client.getRemoteSocketAddress(), e.getMessage());
            try {
                client.close();
            } catch (IOException ex) {
                Log.debugf(ex, "Error closing %s", client.getRemoteSocketAddress());
            }
        }
    }

    /**
     * Stop accepting, disconnect every session and wait briefly for their teardown
     * (which persists each player's room).
     */
    @PreDestroy
    public synchronized void stop() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            Log.debugf(e, "Error closing server socket");
        }
        List.copyOf(handlers).forEach(h -> h.session().disconnect("server shutting down"));
        sessionPool.shutdown();
        try {
            if (!sessionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                Log.warnf("%d session(s) did not finish before shutdown", handlers.size());
                sessionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sessionPool.shutdownNow();
        }
        serverSocket = null;
        Log.info("San Antonio MUD stopped");
    }

    private static String networkAddress() {
        try {
            return InetAddress.getLocalHost().getHostAddress();
        } catch (IOException e) {
            return "<server-ip>";
        }
    }
}
