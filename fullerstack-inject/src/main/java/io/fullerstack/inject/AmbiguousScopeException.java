package io.fullerstack.inject;

/**
 * More than one container is registered and neither an explicit nor an ambient
 * scope narrows resolution down to one of them.
 */
public class AmbiguousScopeException extends InjectionException {

    public AmbiguousScopeException(Class<?> serviceType, int containerCount) {
        super(containerCount + " containers are registered but no scope is set for "
            + serviceType.getName()
            + ". Use beginScope(...) or resolve(type, scope).");
    }

    public AmbiguousScopeException(Class<?> serviceType, String namespaceScope, int containerCount) {
        super("No container is bound to namespace scope '" + namespaceScope + "' or its ancestors, and "
            + containerCount + " unrelated containers are registered for " + serviceType.getName() + ".");
    }
}
