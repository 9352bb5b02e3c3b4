package alpha.nomagicdispatch.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 * 
 * Each builder instance links back to the builder it was derived from, and
 * stores only one modifying action. The actions are replayed, oldest first,
 * against a fresh mutable state container when the built object is
 * constructed. A builder is therefore safe to share between threads and to
 * keep as a template.
 * 
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder (no modifier).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a builder derived from {@code prev}.
     * 
     * @param prev builder
     * @param modifier action to apply on mutable state
     * 
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a state container and replays all modifiers against it.<p>
     * 
     * The concrete builder's {@code build()} method calls this method and
     * passes the result to the constructor of the built object.
     * 
     * @param factory of state
     * 
     * @return the populated state
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
