package alpha.lapis.websocket;

import java.nio.ByteBuffer;

import static java.util.Objects.requireNonNull;

/**
 * One WebSocket frame; the FIN bit, the opcode and the unmasked payload.
 *
 * @param fin {@code true} if this is the final fragment of a message
 * @param opcode of frame
 * @param payload unmasked application data
 */
record Frame(boolean fin, Opcode opcode, byte[] payload)
{
    /** The largest payload of a control frame. */
    static final int MAX_CONTROL_PAYLOAD = 125;

    Frame {
        requireNonNull(opcode);
        requireNonNull(payload);
    }

    /**
     * Encode a final, unmasked frame, as sent by a server.
     *
     * @param opcode of frame
     * @param payload of frame
     * @return a buffer ready to be written
     */
    static ByteBuffer encode(Opcode opcode, byte[] payload) {
        final int len = payload.length;
        final int ext = len < 126 ? 0 : len <= 0xFFFF ? 2 : 8;
        ByteBuffer b = ByteBuffer.allocate(2 + ext + len);
        b.put((byte) (0x80 | opcode.code()));
        if (ext == 0) {
            b.put((byte) len);
        } else if (ext == 2) {
            b.put((byte) 126);
            b.putShort((short) len);
        } else {
            b.put((byte) 127);
            b.putLong(len);
        }
        return b.put(payload).flip();
    }

    /**
     * Encode the payload of a close frame.
     *
     * @param code close code
     * @return two bytes, big-endian
     */
    static byte[] closePayload(int code) {
        return new byte[] { (byte) (code >> 8), (byte) code };
    }

    @Override
    public String toString() {
        return Frame.class.getSimpleName() + "{" +
                "fin=" + fin +
                ", opcode=" + opcode +
                ", payload=" + payload.length + " bytes}";
    }
}
