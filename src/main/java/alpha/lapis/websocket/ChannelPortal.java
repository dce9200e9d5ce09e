package alpha.lapis.websocket;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static alpha.lapis.websocket.CloseCode.INTERNAL_ERROR;
import static alpha.lapis.websocket.CloseCode.INVALID_PAYLOAD;
import static alpha.lapis.websocket.CloseCode.MESSAGE_TOO_BIG;
import static alpha.lapis.websocket.CloseCode.NORMAL_CLOSURE;
import static alpha.lapis.websocket.CloseCode.PROTOCOL_ERROR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * A {@link Portal} over a blocking byte channel, for a transport that has
 * completed the opening handshake.<p>
 *
 * A task on the given executor reads frames for as long as the portal is
 * open. Closing the portal closes the channel, which stops the task.
 */
public final class ChannelPortal implements Portal
{
    private static final System.Logger LOG
            = System.getLogger(ChannelPortal.class.getPackageName());

    private static final byte[] EMPTY = new byte[0];

    // Queued when the portal closes; compared by identity
    private static final Message END = Message.ofBinary(EMPTY);

    /**
     * Open a portal and start reading frames.
     *
     * @param ch channel to converse over (blocking)
     * @param params of route
     * @param maxMessageSize max bytes of a received message
     * @param reader executes the task reading frames
     * @return the portal
     * @throws NullPointerException if any argument is {@code null}
     * @throws java.util.concurrent.RejectedExecutionException
     *             if the reader does not accept the task
     *             (the portal is then closed)
     */
    public static ChannelPortal open(
            ByteChannel ch, Map<String, String> params, int maxMessageSize, Executor reader)
    {
        ChannelPortal p = new ChannelPortal(ch, params, maxMessageSize);
        try {
            reader.execute(p::readLoop);
        } catch (RuntimeException e) {
            p.terminate();
            throw e;
        }
        return p;
    }

    private final ByteChannel ch;
    private final Map<String, String> params;
    private final int maxMessageSize;
    private final BlockingQueue<Message> inbox;
    private final Set<CompletableFuture<Boolean>> pongWaiters;
    private final AtomicBoolean closed;
    private final Object writeLock;
    private volatile InvalidFrameException failure;

    private ChannelPortal(ByteChannel ch, Map<String, String> params, int maxMessageSize) {
        this.ch = requireNonNull(ch);
        this.params = Map.copyOf(params);
        this.maxMessageSize = maxMessageSize;
        this.inbox = new LinkedBlockingQueue<>();
        this.pongWaiters = ConcurrentHashMap.newKeySet();
        this.closed = new AtomicBoolean();
        this.writeLock = new Object();
    }

    @Override
    public Map<String, String> params() {
        return params;
    }

    @Override
    public Message receive() throws InterruptedException {
        return next(inbox.take());
    }

    @Override
    public Message receive(Duration timeout) throws InterruptedException {
        Message m = inbox.poll(timeout.toNanos(), NANOSECONDS);
        if (m == null) {
            throw new ReceiveTimeoutException(timeout);
        }
        return next(m);
    }

    private Message next(Message m) {
        if (m != END) {
            return m;
        }
        // Leave it for the next receiver
        inbox.add(END);
        final InvalidFrameException f = failure;
        if (f != null) {
            throw new InvalidFrameException(f.getMessage(), f.closeCode());
        }
        throw new PortalClosedException("Tried to receive from a closed portal.");
    }

    @Override
    public void send(String text) throws IOException {
        write(Opcode.TEXT, text.getBytes(UTF_8));
    }

    @Override
    public void send(byte[] bytes) throws IOException {
        write(Opcode.BINARY, requireNonNull(bytes));
    }

    @Override
    public boolean ping(Duration timeout) throws IOException, InterruptedException {
        final long nanos = timeout.toNanos();
        CompletableFuture<Boolean> pong = new CompletableFuture<>();
        pongWaiters.add(pong);
        try {
            write(Opcode.PING, EMPTY);
            return pong.get(nanos, NANOSECONDS);
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new AssertionError("Never completed exceptionally.", e);
        } finally {
            pongWaiters.remove(pong);
        }
    }

    @Override
    public void close() {
        close(NORMAL_CLOSURE);
    }

    @Override
    public void close(int code) {
        if (!CloseCode.isSendable(code)) {
            throw new IllegalArgumentException("Close code not sendable: " + code);
        }
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            writeFully(Frame.encode(Opcode.CLOSE, Frame.closePayload(code)));
            LOG.log(DEBUG, () -> "Closed " + this + " with code " + code + ".");
        } catch (IOException e) {
            LOG.log(DEBUG, () -> "Failed to send close frame to " + ch + ": " + e);
        } finally {
            shutdown();
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    private void write(Opcode op, byte[] payload) throws IOException {
        if (closed.get()) {
            throw new PortalClosedException("Tried to send through a closed portal.");
        }
        writeFully(Frame.encode(op, payload));
    }

    private void writeFully(ByteBuffer b) throws IOException {
        synchronized (writeLock) {
            while (b.hasRemaining()) {
                ch.write(b);
            }
        }
    }

    /**
     * Close without sending a close frame.
     */
    private void terminate() {
        if (closed.compareAndSet(false, true)) {
            shutdown();
        }
    }

    private void shutdown() {
        try {
            ch.close();
        } catch (IOException e) {
            LOG.log(DEBUG, "Failed to close channel.", e);
        }
        inbox.add(END);
        pongWaiters.forEach(w -> w.complete(false));
    }

    private void readLoop() {
        final FrameReader r = new FrameReader(ch, maxMessageSize);
        Opcode type = null;
        ByteArrayOutputStream parts = null;
        try {
            while (!closed.get()) {
                final Frame f = r.read();
                switch (f.opcode()) {
                    case PING:
                        write(Opcode.PONG, f.payload());
                        break;
                    case PONG:
                        pongWaiters.forEach(w -> w.complete(true));
                        break;
                    case CLOSE:
                        onClose(f.payload());
                        return;
                    case CONTINUATION:
                        if (parts == null) {
                            throw new InvalidFrameException(
                                    "Continuation frame without a message to continue.", PROTOCOL_ERROR);
                        }
                        if ((long) parts.size() + f.payload().length > maxMessageSize) {
                            throw new InvalidFrameException(
                                    "Message exceeds " + maxMessageSize + " bytes.", MESSAGE_TOO_BIG);
                        }
                        parts.writeBytes(f.payload());
                        if (f.fin()) {
                            deliver(type, parts.toByteArray());
                            type = null;
                            parts = null;
                        }
                        break;
                    default:
                        if (parts != null) {
                            throw new InvalidFrameException(
                                    "Expected a continuation frame, got " + f.opcode() + ".", PROTOCOL_ERROR);
                        }
                        if (f.fin()) {
                            deliver(f.opcode(), f.payload());
                        } else {
                            type = f.opcode();
                            parts = new ByteArrayOutputStream();
                            parts.writeBytes(f.payload());
                        }
                }
            }
        } catch (InvalidFrameException e) {
            LOG.log(DEBUG, () -> "Invalid frame from " + ch + ": " + e.getMessage());
            failure = e;
            close(e.closeCode());
        } catch (PortalClosedException e) {
            LOG.log(DEBUG, () -> "Portal closed while answering a ping: " + ch);
        } catch (EOFException e) {
            LOG.log(DEBUG, () -> "Client closed the connection without a close frame: " + ch);
            terminate();
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.log(DEBUG, () -> "Failed to read frame from " + ch + ": " + e);
                close(INTERNAL_ERROR);
            }
        } catch (RuntimeException e) {
            LOG.log(WARNING, "Unexpected failure reading frames; closing portal.", e);
            close(INTERNAL_ERROR);
            throw e;
        }
    }

    private void deliver(Opcode type, byte[] payload) {
        if (type == Opcode.TEXT) {
            final String text;
            try {
                text = UTF_8.newDecoder()
                            .onMalformedInput(CodingErrorAction.REPORT)
                            .onUnmappableCharacter(CodingErrorAction.REPORT)
                            .decode(ByteBuffer.wrap(payload))
                            .toString();
            } catch (CharacterCodingException e) {
                throw new InvalidFrameException("Text message is not valid UTF-8.", INVALID_PAYLOAD);
            }
            inbox.add(Message.ofText(text));
        } else {
            inbox.add(Message.ofBinary(payload));
        }
    }

    private void onClose(byte[] payload) {
        final int code = payload.length >= 2 ?
                ((payload[0] & 0xFF) << 8) | (payload[1] & 0xFF) :
                NORMAL_CLOSURE;
        LOG.log(DEBUG, () -> "Client closed " + ch + " with code " + code + ".");
        close(CloseCode.isSendable(code) ? code : PROTOCOL_ERROR);
    }

    @Override
    public String toString() {
        return ChannelPortal.class.getSimpleName() + "{" + ch + '}';
    }
}
