package dev.ebullient.mud;

import java.io.IOException;

/**
 * A line-oriented, bidirectional text stream to one client.
 */
public interface LineConnection extends AutoCloseable {

    /**
     * @return the next line without its terminator, or null at end of stream
     * @throws java.net.SocketTimeoutException if the idle timeout expires
     */
    String readLine() throws IOException;

    /** Write text exactly as given and flush. */
    void write(String text) throws IOException;

    String remoteAddress();

    /** Close both directions. Unblocks a pending {@link #readLine()}. Safe to repeat. */
    @Override
    void close();
}
