package io.fullerstack.inject;

/**
 * Base type for every failure raised while registering, resolving or tearing down
 * containers.
 * <p>
 * All subclasses are fatal to the call that raised them: nothing in this library
 * retries or recovers on the caller's behalf.
 */
public class InjectionException extends RuntimeException {

    public InjectionException(String message) {
        super(message);
    }

    public InjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
