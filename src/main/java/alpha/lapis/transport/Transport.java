package alpha.lapis.transport;

import alpha.lapis.Config;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;

/**
 * A source of {@link Exchange}s, consumed by the server's accept loop.<p>
 *
 * The default implementation is {@link SocketTransport}, which serves
 * HTTP/1.1 over TCP. An application may supply its own transport to the
 * server, for example to dispatch requests from an in-memory queue.
 */
public interface Transport extends Closeable
{
    /**
     * Returns a new transport using the default implementation.
     *
     * @param config of server
     * @return a new transport
     */
    static Transport create(Config config) {
        return new SocketTransport(config);
    }

    /**
     * Open the transport on the given address.
     *
     * @param address to bind
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if already opened
     */
    void open(SocketAddress address) throws IOException;

    /**
     * Wait for the next exchange.<p>
     *
     * This method does not read the request.
     *
     * @return the next exchange
     * @throws ClosedChannelException if the transport is closed
     * @throws IOException if an I/O error occurs
     */
    Exchange accept() throws IOException;

    /**
     * Returns the bound address.
     *
     * @return the bound address
     * @throws IllegalStateException if not open
     */
    SocketAddress localAddress();

    /**
     * Returns {@code true} if the transport is open.
     *
     * @return {@code true} if the transport is open
     */
    boolean isOpen();

    /**
     * Close the transport.<p>
     *
     * A thread blocked in {@link #accept()} receives a {@link
     * ClosedChannelException}. Already accepted exchanges are not closed.
     * This method is idempotent.
     *
     * @throws IOException if an I/O error occurs
     */
    @Override
    void close() throws IOException;
}
