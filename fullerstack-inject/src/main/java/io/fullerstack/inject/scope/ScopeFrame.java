package io.fullerstack.inject.scope;

import java.util.Objects;

/**
 * One entry of a thread's ambient scope stack.
 *
 * <p>Frames are immutable and link to the frame that was active when they were pushed.
 * Exactly one of {@link #namespaceScope()} and {@link #scopeOwner()} is set, matching
 * {@link #kind()}.
 */
public final class ScopeFrame {

    private final ScopeKind kind;
    private final String namespaceScope;
    private final Object scopeOwner;
    private final ScopeFrame previous;
    private final long epoch;

    ScopeFrame(ScopeKind kind, String namespaceScope, Object scopeOwner, ScopeFrame previous, long epoch) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.namespaceScope = namespaceScope;
        this.scopeOwner = scopeOwner;
        this.previous = previous;
        this.epoch = epoch;
    }

    public ScopeKind kind() {
        return kind;
    }

    public String namespaceScope() {
        return namespaceScope;
    }

    public Object scopeOwner() {
        return scopeOwner;
    }

    /**
     * @return the enclosing frame, or null for the outermost one
     */
    public ScopeFrame previous() {
        return previous;
    }

    long epoch() {
        return epoch;
    }

    @Override
    public String toString() {
        return kind == ScopeKind.NAMESPACE
            ? "ScopeFrame[namespace=" + namespaceScope + "]"
            : "ScopeFrame[owner=" + scopeOwner.getClass().getName() + "@"
                + Integer.toHexString(System.identityHashCode(scopeOwner)) + "]";
    }
}
