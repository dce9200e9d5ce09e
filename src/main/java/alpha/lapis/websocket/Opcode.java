package alpha.lapis.websocket;

import java.util.Optional;

/**
 * Frame opcodes, RFC 6455 section 5.2.
 */
enum Opcode
{
    CONTINUATION (0x0),
    TEXT         (0x1),
    BINARY       (0x2),
    CLOSE        (0x8),
    PING         (0x9),
    PONG         (0xA);

    private final int code;

    Opcode(int code) {
        this.code = code;
    }

    int code() {
        return code;
    }

    /**
     * Returns {@code true} for CLOSE, PING and PONG.
     */
    boolean isControl() {
        return (code & 0x8) != 0;
    }

    static Optional<Opcode> of(int code) {
        for (Opcode o : values()) {
            if (o.code == code) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }
}
