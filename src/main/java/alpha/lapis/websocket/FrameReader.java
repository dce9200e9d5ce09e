package alpha.lapis.websocket;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

import static alpha.lapis.websocket.CloseCode.MESSAGE_TOO_BIG;
import static alpha.lapis.websocket.CloseCode.PROTOCOL_ERROR;

/**
 * Reads client frames from a blocking channel.<p>
 *
 * A client frame must be masked and must not set any of the reserved bits,
 * as no extension is negotiated. A control frame must not be fragmented and
 * its payload must not exceed 125 bytes. A frame breaking these rules, or
 * using an unknown opcode, is rejected with {@link CloseCode#PROTOCOL_ERROR}.
 * A payload larger than the configured maximum is rejected with {@link
 * CloseCode#MESSAGE_TOO_BIG} before it is read.
 */
final class FrameReader
{
    private final ReadableByteChannel ch;
    private final long maxPayload;
    private final ByteBuffer head;

    FrameReader(ReadableByteChannel ch, long maxPayload) {
        this.ch = ch;
        this.maxPayload = maxPayload;
        this.head = ByteBuffer.allocate(8);
    }

    /**
     * Read the next frame.
     *
     * @return the frame (payload unmasked)
     * @throws EOFException if the channel reaches end of stream
     * @throws InvalidFrameException if the frame is rejected
     * @throws IOException if an I/O error occurs
     */
    Frame read() throws IOException {
        ByteBuffer b = fill(2);
        final int b0 = b.get() & 0xFF,
                  b1 = b.get() & 0xFF;

        if ((b0 & 0x70) != 0) {
            throw new InvalidFrameException("Reserved bits set.", PROTOCOL_ERROR);
        }
        final boolean fin = (b0 & 0x80) != 0;
        final Opcode op = Opcode.of(b0 & 0x0F).orElseThrow(() ->
                new InvalidFrameException("Unknown opcode: " + (b0 & 0x0F), PROTOCOL_ERROR));
        if ((b1 & 0x80) == 0) {
            throw new InvalidFrameException("Client frame is not masked.", PROTOCOL_ERROR);
        }

        long len = b1 & 0x7F;
        if (len == 126) {
            len = fill(2).getShort() & 0xFFFF;
        } else if (len == 127) {
            len = fill(8).getLong();
            if (len < 0) {
                throw new InvalidFrameException("Payload length out of range.", PROTOCOL_ERROR);
            }
        }

        if (op.isControl()) {
            if (!fin) {
                throw new InvalidFrameException("Fragmented control frame.", PROTOCOL_ERROR);
            }
            if (len > Frame.MAX_CONTROL_PAYLOAD) {
                throw new InvalidFrameException("Control frame payload too long.", PROTOCOL_ERROR);
            }
        } else if (len > maxPayload) {
            throw new InvalidFrameException(
                    "Frame payload exceeds " + maxPayload + " bytes.", MESSAGE_TOO_BIG);
        }

        final byte[] mask = new byte[4];
        fill(4).get(mask);
        final byte[] payload = new byte[(int) len];
        readFully(ByteBuffer.wrap(payload));
        for (int i = 0; i < payload.length; ++i) {
            payload[i] ^= mask[i & 0x3];
        }
        return new Frame(fin, op, payload);
    }

    private ByteBuffer fill(int n) throws IOException {
        head.clear().limit(n);
        readFully(head);
        return head.flip();
    }

    private void readFully(ByteBuffer b) throws IOException {
        while (b.hasRemaining()) {
            if (ch.read(b) == -1) {
                throw new EOFException("End of stream.");
            }
        }
    }
}
