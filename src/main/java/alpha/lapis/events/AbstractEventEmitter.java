package alpha.lapis.events;

import alpha.lapis.util.TriConsumer;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Thread-safe and non-blocking implementation of {@link EventEmitter}.<p>
 *
 * Listeners are grouped by event type in a concurrent map. Subclasses emit
 * events using {@link #emit(Object, Object, Object)}.
 */
public abstract class AbstractEventEmitter implements EventEmitter
{
    private final Map<Class<?>, Set<Object>> listeners = new ConcurrentHashMap<>();

    /**
     * Emit an event.
     *
     * @param ev event
     * @param att1 first attachment (may be {@code null})
     * @param att2 second attachment (may be {@code null})
     * @return the number of listeners invoked
     */
    protected int emit(Object ev, Object att1, Object att2) {
        int n = 0;
        for (Object l : listeners.getOrDefault(ev.getClass(), Set.of())) {
            if (l instanceof Consumer) {
                Consumer<Object> uni = retype(l);
                uni.accept(ev);
            } else if (l instanceof BiConsumer) {
                BiConsumer<Object, Object> bi = retype(l);
                bi.accept(ev, att1);
            } else {
                TriConsumer<Object, Object, Object> tri = retype(l);
                tri.accept(ev, att1, att2);
            }
            ++n;
        }
        return n;
    }

    @SuppressWarnings("unchecked")
    private static <T> T retype(Object thing) {
        return (T) thing;
    }

    @Override
    public <T> boolean on(Class<T> eventType, Consumer<? super T> listener) {
        return addListener(eventType, listener);
    }

    @Override
    public <T, U> boolean on(Class<T> eventType, BiConsumer<? super T, ? super U> listener) {
        return addListener(eventType, listener);
    }

    @Override
    public <T, U, V> boolean on(Class<T> eventType, TriConsumer<? super T, ? super U, ? super V> listener) {
        return addListener(eventType, listener);
    }

    @Override
    public <T> boolean off(Class<T> eventType, Consumer<? super T> listener) {
        return removeListener(eventType, listener);
    }

    @Override
    public <T> boolean off(Class<T> eventType, BiConsumer<? super T, ?> listener) {
        return removeListener(eventType, listener);
    }

    @Override
    public <T> boolean off(Class<T> eventType, TriConsumer<? super T, ?, ?> listener) {
        return removeListener(eventType, listener);
    }

    private boolean addListener(Class<?> eventType, Object listener) {
        requireNotInterface(eventType);
        requireNonNull(listener);
        return listeners.computeIfAbsent(eventType, k -> ConcurrentHashMap.newKeySet())
                        .add(listener);
    }

    private boolean removeListener(Class<?> eventType, Object listener) {
        requireNonNull(listener);
        var set = listeners.get(requireNonNull(eventType));
        return set != null && set.remove(listener);
    }

    private static void requireNotInterface(Class<?> eventType) {
        if (eventType.isInterface()) {
            throw new IllegalArgumentException("Event type can not be an interface.");
        }
    }
}
