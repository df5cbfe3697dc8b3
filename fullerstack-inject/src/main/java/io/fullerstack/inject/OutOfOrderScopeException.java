package io.fullerstack.inject;

/**
 * An ambient scope handle was closed while a scope opened after it was still active,
 * or on a thread other than the one that opened it.
 */
public class OutOfOrderScopeException extends InjectionException {

    public OutOfOrderScopeException(String message) {
        super(message);
    }
}
