package io.fullerstack.inject;

/**
 * How long an instance produced for a registration lives.
 */
public enum Lifetime {

    /**
     * A new instance is created on every resolution.
     */
    TRANSIENT,

    /**
     * One instance is created on first resolution and reused afterwards.
     */
    SINGLETON
}
