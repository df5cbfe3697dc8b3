package io.fullerstack.inject;

/**
 * A container, namespace scope or scope owner is already bound in the registry.
 */
public class DuplicateRegistrationException extends InjectionException {

    public DuplicateRegistrationException(String message) {
        super(message);
    }
}
