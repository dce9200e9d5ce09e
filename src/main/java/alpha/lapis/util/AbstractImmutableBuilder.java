package alpha.lapis.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Abstract base class of an immutable builder.<p>
 *
 * Each builder instance holds a reference to the previous builder and a
 * modifier of the mutable state. No state is actually constructed until
 * {@link #constructState(Supplier)} is called, at which point all modifiers
 * of the chain are replayed, oldest first, on a fresh state object.<p>
 *
 * A builder instance can therefore be shared freely across threads and be
 * used as a template for an unlimited number of derived builders.
 *
 * @param <S> type of the mutable state
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;

    /**
     * Constructs a root builder (no previous builder, no modifier).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }

    /**
     * Constructs a builder derived from another builder.
     *
     * @param prev previous builder
     * @param modifier of state
     * @throws NullPointerException if any argument is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }

    /**
     * Replay all modifiers of the chain on a new state object.
     *
     * @param factory of the state
     * @return the state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();

        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }

        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
