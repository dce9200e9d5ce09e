package alpha.lapis.events;

import alpha.lapis.util.TriConsumer;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Emits events as they happen, to which, event listeners may come and go.<p>
 *
 * An event is typically an enum constant and the emission may carry one or
 * two attachments, which are arbitrary objects for passing event-related
 * data. Which events are emitted, and the types of their attachments, is
 * documented by the event type.
 *
 * <pre>
 *   EventEmitter events = server.events();
 *   events.on(RouteNotFound.class, (ev, req) -&gt; notFoundCounter.increment());
 *   events.on(ResponseSent.class, (ev, rsp, stats) -&gt;
 *           latency.record(((ResponseSent.Stats) stats).elapsedNanos()));
 * </pre>
 *
 * Listeners observe events of the exact runtime type to which they
 * subscribe; there's no support for subscribing to a supertype.<p>
 *
 * The listener's functional type may accept fewer attachments than emitted,
 * in which case the remaining attachments are discarded. A listener that
 * declares an attachment the emitter does not give receives {@code null}.<p>
 *
 * The thread emitting the event is also the thread that invokes the
 * listeners. This may be a server thread and so the listener must not block.
 * Listeners may be invoked concurrently and must be thread-safe. The order
 * of listener invocations is undefined.<p>
 *
 * A listener is stored in a hash-based structure. Each lambda expression
 * evaluation is a new instance; in order to unsubscribe a listener, keep a
 * reference to the same instance that subscribed.<p>
 *
 * If a listener throws an exception, the exception propagates to the
 * emitter and the remaining listeners miss out on the event. The server's
 * components catch and log such an exception.
 */
public interface EventEmitter
{
    /**
     * Subscribe a listener.
     *
     * @param eventType invariant class of events received by the listener
     * @param listener receiver of events
     * @param <T> type argument of event
     * @return {@code true} if subscribed, otherwise {@code false}
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code eventType} is an interface
     */
    <T> boolean on(Class<T> eventType, Consumer<? super T> listener);

    /**
     * Subscribe a listener that expects an attachment.
     *
     * @param eventType invariant class of events received by the listener
     * @param listener receiver of events
     * @param <T> type argument of event
     * @param <U> call-site inferred type of the attachment
     * @return {@code true} if subscribed, otherwise {@code false}
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code eventType} is an interface
     */
    <T, U> boolean on(Class<T> eventType, BiConsumer<? super T, ? super U> listener);

    /**
     * Subscribe a listener that expects two attachments.
     *
     * @param eventType invariant class of events received by the listener
     * @param listener receiver of events
     * @param <T> type argument of event
     * @param <U> call-site inferred type of the first attachment
     * @param <V> call-site inferred type of the second attachment
     * @return {@code true} if subscribed, otherwise {@code false}
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code eventType} is an interface
     */
    <T, U, V> boolean on(Class<T> eventType, TriConsumer<? super T, ? super U, ? super V> listener);

    /**
     * Unsubscribe a listener.
     *
     * @param eventType invariant class of events received by the listener
     * @param listener to unsubscribe
     * @param <T> type argument of event
     * @return {@code true} if removed, otherwise {@code false}
     */
    <T> boolean off(Class<T> eventType, Consumer<? super T> listener);

    /**
     * Unsubscribe a listener.
     *
     * @param eventType invariant class of events received by the listener
     * @param listener to unsubscribe
     * @param <T> type argument of event
     * @return {@code true} if removed, otherwise {@code false}
     */
    <T> boolean off(Class<T> eventType, BiConsumer<? super T, ?> listener);

    /**
     * Unsubscribe a listener.
     *
     * @param eventType invariant class of events received by the listener
     * @param listener to unsubscribe
     * @param <T> type argument of event
     * @return {@code true} if removed, otherwise {@code false}
     */
    <T> boolean off(Class<T> eventType, TriConsumer<? super T, ?, ?> listener);
}
