package io.fullerstack.inject.registry;

import java.util.Objects;

/**
 * Map key that compares its referent by identity rather than {@code equals}.
 *
 * <p>Lets a {@link java.util.concurrent.ConcurrentHashMap} act as a concurrent identity map,
 * so two scope owners that are {@code equals} but distinct objects stay distinct keys.
 */
final class IdentityKey {

    private final Object referent;
    private final int hash;

    private IdentityKey(Object referent) {
        this.referent = referent;
        this.hash = System.identityHashCode(referent);
    }

    static IdentityKey of(Object referent) {
        return new IdentityKey(Objects.requireNonNull(referent, "Referent cannot be null"));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IdentityKey other && other.referent == referent;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return referent.getClass().getName() + "@" + Integer.toHexString(hash);
    }
}
