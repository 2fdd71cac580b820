package dev.ebullient.mud;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import org.jboss.logging.Logger;

/**
 * {@link LineConnection} over a TCP socket, UTF-8 both ways. Telnet clients send
 * CRLF; the CR and any NUL padding are dropped.
 */
public class SocketLineConnection implements LineConnection {
    private static final Logger log = Logger.getLogger(SocketLineConnection.class);

    private final Socket socket;
    private final BufferedReader in;
    private final BufferedWriter out;
    private final String remoteAddress;

    public SocketLineConnection(Socket socket, int idleTimeoutMillis) throws IOException {
        this.socket = socket;
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
        socket.setTcpNoDelay(true);
        socket.setSoTimeout(Math.max(0, idleTimeoutMillis));
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public String readLine() throws IOException {
        String line = in.readLine();
        return line == null ? null : line.replace("\r", "").replace("\0", "");
    }

    @Override
    public void write(String text) throws IOException {
        synchronized (out) {
            out.write(text);
            out.flush();
        }
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debugf(e, "Error closing connection to %s", remoteAddress);
        }
    }
}
