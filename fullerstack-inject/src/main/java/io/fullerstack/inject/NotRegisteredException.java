package io.fullerstack.inject;

/**
 * No registration for the requested type was found in the set of containers
 * reachable from the current resolution context.
 */
public class NotRegisteredException extends InjectionException {

    private final Class<?> serviceType;

    public NotRegisteredException(Class<?> serviceType, String message) {
        super(message);
        this.serviceType = serviceType;
    }

    public NotRegisteredException(Class<?> serviceType) {
        this(serviceType, "Service of type " + serviceType.getName() + " is not registered.");
    }

    /**
     * @return the type that could not be resolved
     */
    public Class<?> serviceType() {
        return serviceType;
    }
}
