package io.fullerstack.inject;

/**
 * A factory produced an instance that is not assignable to the type it was registered under.
 */
public class TypeMismatchException extends InjectionException {

    public TypeMismatchException(Class<?> requested, Object produced) {
        super("Dependency type mismatch. Requested " + requested.getName()
            + " but the registered factory produced "
            + (produced == null ? "null" : produced.getClass().getName())
            + ". The type may have been registered under a different key.");
    }
}
