package io.fullerstack.inject.container;

import io.fullerstack.inject.CircularDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Per-thread stack of the types a container is currently resolving.
 *
 * <p>Used only when cycle detection is enabled. Entering a type that is already on
 * the calling thread's stack raises {@link CircularDependencyException}.
 *
 * <pre>{@code
 * try (ResolutionStack.Entry ignored = stack.enter(type)) {
 *     return doResolve(type);
 * }
 * }</pre>
 */
final class ResolutionStack {

    private final ThreadLocal<Deque<Class<?>>> inProgress = ThreadLocal.withInitial(ArrayDeque::new);

    Entry enter(Class<?> type) {
        Deque<Class<?>> stack = inProgress.get();
        if (stack.contains(type)) {
            List<Class<?>> path = new ArrayList<>(stack.size() + 1);
            // Deque is used LIFO, so the outermost type is at the tail
            Iterator<Class<?>> outermostFirst = stack.descendingIterator();
            while (outermostFirst.hasNext()) {
                path.add(outermostFirst.next());
            }
            path.add(type);
            throw new CircularDependencyException(path);
        }
        stack.push(type);
        return new Entry(stack);
    }

    /**
     * @return the depth of the calling thread's stack
     */
    int depth() {
        return inProgress.get().size();
    }

    /**
     * Pops its type when closed and drops the thread's stack once it is empty.
     */
    final class Entry implements AutoCloseable {
        private final Deque<Class<?>> stack;

        private Entry(Deque<Class<?>> stack) {
            this.stack = stack;
        }

        @Override
        public void close() {
            stack.pop();
            if (stack.isEmpty()) {
                inProgress.remove();
            }
        }
    }
}
