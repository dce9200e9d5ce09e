package alpha.lapis.websocket;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A complete WebSocket data message; either text or binary.<p>
 *
 * A message received from a client has been reassembled from all of its
 * fragments. The message is immutable.
 */
public final class Message
{
    /**
     * Create a text message.
     *
     * @param text of message
     * @return a new message
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static Message ofText(String text) {
        return new Message(requireNonNull(text), null);
    }

    /**
     * Create a binary message.
     *
     * @param bytes of message (copied)
     * @return a new message
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Message ofBinary(byte[] bytes) {
        return new Message(null, bytes.clone());
    }

    private final String text;
    private final byte[] bytes;

    private Message(String text, byte[] bytes) {
        this.text = text;
        this.bytes = bytes;
    }

    /**
     * Returns {@code true} if this is a text message.
     *
     * @return {@code true} if this is a text message
     */
    public boolean isText() {
        return text != null;
    }

    /**
     * Returns the text of a text message.
     *
     * @return the text
     * @throws IllegalStateException if this is a binary message
     */
    public String text() {
        if (text == null) {
            throw new IllegalStateException("Not a text message.");
        }
        return text;
    }

    /**
     * Returns the payload; the UTF-8 encoded text, or the binary bytes.<p>
     *
     * Each invocation returns a new copy.
     *
     * @return the payload
     */
    public byte[] bytes() {
        return text != null ? text.getBytes(UTF_8) : bytes.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Message)) {
            return false;
        }
        Message that = (Message) obj;
        return text != null ? text.equals(that.text) :
               that.text == null && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return text != null ? text.hashCode() : Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return Message.class.getSimpleName() + "{" +
                (text != null ?
                    "text, " + text.length() + " chars" :
                    "binary, " + bytes.length + " bytes") + '}';
    }
}
