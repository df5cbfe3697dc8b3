package io.fullerstack.inject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A type was requested again while its own resolution was still in progress on the
 * same thread. Only raised by containers created with cycle detection enabled.
 */
public class CircularDependencyException extends InjectionException {

    private final List<Class<?>> path;

    public CircularDependencyException(List<Class<?>> path) {
        super("Circular dependency detected: " + path.stream()
            .map(Class::getName)
            .collect(Collectors.joining(" -> ")));
        this.path = List.copyOf(path);
    }

    /**
     * @return the resolution path, outermost first, ending with the re-entered type
     */
    public List<Class<?>> path() {
        return path;
    }
}
