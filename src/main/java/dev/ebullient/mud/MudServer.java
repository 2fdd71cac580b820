package dev.ebullient.mud;

import java.io.IOException;

import jakarta.inject.Inject;

import io.quarkus.logging.Log;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Process entry point: bind the game port, then serve until asked to stop.
 * Exits with 1 if the port cannot be bound.
 */
@QuarkusMain
public class MudServer implements QuarkusApplication {

    @Inject
    ConnectionAcceptor acceptor;

    @Override
    public int run(String... args) {
        try {
            acceptor.start();
        } catch (IOException e) {
            Log.errorf("Cannot listen for players: %s", e.getMessage());
            return 1;
        }
        Quarkus.waitForExit();
        acceptor.stop();
        return 0;
    }

    public static void main(String... args) {
        Quarkus.run(MudServer.class, args);
    }
}
