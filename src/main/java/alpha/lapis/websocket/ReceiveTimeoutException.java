package alpha.lapis.websocket;

import java.time.Duration;

/**
 * No message was received within the timeout given to {@link
 * Portal#receive(Duration)}. The portal remains open.
 */
public class ReceiveTimeoutException extends WebSocketException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code ReceiveTimeoutException}.
     *
     * @param timeout that elapsed
     */
    public ReceiveTimeoutException(Duration timeout) {
        super("No message received within " + timeout + ".");
    }
}
