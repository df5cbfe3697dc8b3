package io.fullerstack.inject;

/**
 * Operation attempted on a container that has already been closed.
 */
public class ContainerDisposedException extends InjectionException {

    public ContainerDisposedException(String message) {
        super(message);
    }
}
