package io.fullerstack.inject.scope;

/**
 * What an ambient scope frame selects containers by.
 */
public enum ScopeKind {

    /** A dot-delimited namespace scope string. */
    NAMESPACE,

    /** The identity of a scope-owner object. */
    OBJECT
}
