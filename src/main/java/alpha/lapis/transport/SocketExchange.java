package alpha.lapis.transport;

import alpha.lapis.Config;
import alpha.lapis.HttpConstants.StatusCode;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.Response;
import alpha.lapis.message.SerializedResponse;
import alpha.lapis.websocket.ChannelPortal;
import alpha.lapis.websocket.Portal;
import alpha.lapis.websocket.WebSocketHandshake;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static alpha.lapis.HttpConstants.HeaderName.CONNECTION;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * An exchange over a blocking socket channel. One request is served per
 * connection, and every response carries "Connection: close".<p>
 *
 * A client disconnect is detected by a watcher task which blocks reading the
 * channel after the request has been read. Bytes received after the request
 * are discarded. End of stream, which includes a client that half-closes its
 * output, is treated as a disconnect.<p>
 *
 * An exchange upgraded to a WebSocket answers the handshake without
 * "Connection: close" and hands the channel to a {@link ChannelPortal}, whose
 * frame reader runs on the watcher pool. A client must not send frames before
 * it has received the handshake response; bytes that arrive together with the
 * upgrade request are lost.
 */
final class SocketExchange implements Exchange
{
    private static final System.Logger LOG
            = System.getLogger(SocketExchange.class.getPackageName());

    private final SocketChannel ch;
    private final Config config;
    private final Executor watchers;
    private final CompletableFuture<Void> disconnected;
    private final AtomicBoolean watching;

    SocketExchange(SocketChannel ch, Config config, Executor watchers) {
        this.ch = ch;
        this.config = config;
        this.watchers = watchers;
        this.disconnected = new CompletableFuture<>();
        this.watching = new AtomicBoolean();
    }

    @Override
    public Optional<RawRequest> read() throws IOException {
        var r = new RequestReader(ch,
                config.maxRequestHeadSize(), config.maxRequestBodySize());
        try {
            RawRequest req = r.read();
            if (req == null) {
                LOG.log(DEBUG, () -> "Client closed before a complete request was received: " + ch);
                close();
            }
            return Optional.ofNullable(req);
        } catch (RequestRejectedException e) {
            LOG.log(WARNING, () -> "Rejected request: " + e.getMessage());
            try {
                write(SerializedResponse.of(e.response(), config.serverName()));
            } finally {
                close();
            }
            return Optional.empty();
        }
    }

    @Override
    public long write(SerializedResponse response) throws IOException {
        byte[] bytes = response.withHeaderIfAbsent(CONNECTION, "close").toBytes();
        ByteBuffer b = ByteBuffer.wrap(bytes);
        try {
            while (b.hasRemaining()) {
                ch.write(b);
            }
        } catch (IOException e) {
            disconnected.complete(null);
            throw e;
        }
        return bytes.length;
    }

    @Override
    public Optional<Portal> upgrade(RawRequest request, Map<String, String> params) throws IOException {
        final Response r = WebSocketHandshake.respond(request);
        try {
            write(SerializedResponse.of(r, config.serverName()));
        } catch (IOException e) {
            close();
            throw e;
        }
        if (r.statusCode() != StatusCode.ONE_HUNDRED_ONE) {
            LOG.log(DEBUG, () -> "WebSocket handshake rejected with " + r.statusCode() + ": " + request);
            close();
            return Optional.empty();
        }
        // The reader task takes over from the disconnect watcher
        watching.set(true);
        try {
            return Optional.of(ChannelPortal.open(ch, params, config.maxRequestBodySize(), watchers));
        } catch (RejectedExecutionException e) {
            close();
            throw new IOException("Transport closed during WebSocket handshake.", e);
        }
    }

    @Override
    public boolean isOpen() {
        return ch.isOpen();
    }

    @Override
    public CompletionStage<Void> disconnected() {
        if (watching.compareAndSet(false, true) && ch.isOpen()) {
            try {
                watchers.execute(this::watch);
            } catch (RejectedExecutionException e) {
                LOG.log(DEBUG, "Transport closed; client disconnect will not be detected.", e);
            }
        }
        return disconnected.minimalCompletionStage();
    }

    private void watch() {
        ByteBuffer b = ByteBuffer.allocate(512);
        try {
            for (;;) {
                b.clear();
                if (ch.read(b) == -1) {
                    LOG.log(DEBUG, () -> "Client disconnected: " + ch);
                    break;
                }
            }
        } catch (IOException e) {
            LOG.log(DEBUG, () -> "Stopped watching " + ch + ": " + e);
        }
        disconnected.complete(null);
    }

    @Override
    public void close() {
        if (ch.isOpen()) {
            try {
                ch.close();
            } catch (IOException e) {
                LOG.log(DEBUG, "Failed to close child channel.", e);
            }
        }
        disconnected.complete(null);
    }

    @Override
    public String toString() {
        return SocketExchange.class.getSimpleName() + "{" + ch + '}';
    }
}
