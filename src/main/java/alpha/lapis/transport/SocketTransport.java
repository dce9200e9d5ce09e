package alpha.lapis.transport;

import alpha.lapis.Config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Objects.requireNonNull;

/**
 * The default {@link Transport}; HTTP/1.0 and HTTP/1.1 over a blocking
 * {@link ServerSocketChannel}.<p>
 *
 * Each connection serves exactly one request, after which the connection is
 * closed. The transport itself responds to, and closes, a request that
 * <ul>
 *   <li>is malformed, or is HTTP/1.1 without a "Host" header (400),</li>
 *   <li>has a head larger than {@link Config#maxRequestHeadSize()} or a body
 *       larger than {@link Config#maxRequestBodySize()} (413),</li>
 *   <li>has a "Transfer-Encoding" header (501), or</li>
 *   <li>uses an HTTP version other than 1.x (505).</li>
 * </ul>
 */
public final class SocketTransport implements Transport
{
    private static final System.Logger LOG
            = System.getLogger(SocketTransport.class.getPackageName());

    private final Config config;
    private final ExecutorService watchers;
    private ServerSocketChannel channel;

    /**
     * Constructs a {@code SocketTransport}.
     *
     * @param config of server
     */
    public SocketTransport(Config config) {
        this.config = requireNonNull(config);
        AtomicInteger n = new AtomicInteger();
        this.watchers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lapis-watcher-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void open(SocketAddress address) throws IOException {
        if (channel != null) {
            throw new IllegalStateException("Transport has been opened once before.");
        }
        ServerSocketChannel ch = ServerSocketChannel.open();
        try {
            ch.bind(address);
        } catch (IOException e) {
            try {
                ch.close();
            } catch (IOException next) {
                e.addSuppressed(next);
            }
            throw e;
        }
        channel = ch;
        LOG.log(INFO, () -> "Opened server channel: " + ch);
    }

    @Override
    public Exchange accept() throws IOException {
        SocketChannel child = channel().accept();
        LOG.log(DEBUG, () -> "Accepted child: " + child);
        return new SocketExchange(child, config, watchers);
    }

    @Override
    public SocketAddress localAddress() {
        try {
            return channel().getLocalAddress();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized boolean isOpen() {
        return channel != null && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        final ServerSocketChannel ch;
        synchronized (this) {
            ch = channel;
        }
        // Watchers of in-flight exchanges keep running
        watchers.shutdown();
        if (ch != null && ch.isOpen()) {
            LOG.log(INFO, () -> "Closing server channel: " + ch);
            ch.close();
        }
    }

    private synchronized ServerSocketChannel channel() {
        if (channel == null) {
            throw new IllegalStateException("Transport is not open.");
        }
        return channel;
    }
}
