package alpha.lapis.events;

/**
 * An event emitter to which anyone can dispatch events.<p>
 *
 * The server's event hub receives all events emitted by the server, and the
 * application may use it to dispatch its own events.
 */
public interface EventHub extends EventEmitter
{
    /**
     * Returns a new event hub.
     *
     * @return a new event hub
     */
    static EventHub create() {
        return new DefaultEventHub();
    }

    /**
     * Synchronously dispatch an event.
     *
     * @param event to dispatch
     * @return the number of listeners invoked
     * @throws NullPointerException if {@code event} is {@code null}
     */
    int dispatch(Object event);

    /**
     * Synchronously dispatch an event with an attachment.
     *
     * @param event to dispatch
     * @param attachment of event (may be {@code null})
     * @return the number of listeners invoked
     * @throws NullPointerException if {@code event} is {@code null}
     */
    int dispatch(Object event, Object attachment);

    /**
     * Synchronously dispatch an event with two attachments.
     *
     * @param event to dispatch
     * @param att1 first attachment (may be {@code null})
     * @param att2 second attachment (may be {@code null})
     * @return the number of listeners invoked
     * @throws NullPointerException if {@code event} is {@code null}
     */
    int dispatch(Object event, Object att1, Object att2);
}
