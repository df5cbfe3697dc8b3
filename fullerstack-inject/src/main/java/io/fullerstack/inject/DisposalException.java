package io.fullerstack.inject;

/**
 * One or more tracked instances failed to close while their container was being closed.
 * <p>
 * The first failure is the cause; later ones are attached as suppressed exceptions.
 * Teardown still runs to completion before this is thrown.
 */
public class DisposalException extends InjectionException {

    public DisposalException(String message, Throwable cause) {
        super(message, cause);
    }
}
