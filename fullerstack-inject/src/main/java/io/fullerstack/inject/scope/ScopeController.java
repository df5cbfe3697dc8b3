package io.fullerstack.inject.scope;

import io.fullerstack.inject.OutOfOrderScopeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-thread stack of ambient scope frames.
 *
 * <p>A frame pushed on one thread is invisible to every other thread. Frames must be
 * released in exact reverse order of creation; anything else raises
 * {@link OutOfOrderScopeException} and leaves the stack untouched.
 *
 * <p><b>Reset:</b> {@link #reset()} advances an epoch shared by all threads. A thread
 * whose top frame belongs to an older epoch discards its whole stack the next time it
 * touches the controller, and releasing a handle from an older epoch is a no-op. This
 * makes a reset effective on every thread, not just the caller's.
 */
public final class ScopeController {

    private static final Logger logger = LoggerFactory.getLogger(ScopeController.class);

    private final AtomicLong epoch = new AtomicLong();
    private final ThreadLocal<ScopeFrame> top = new ThreadLocal<>();

    /**
     * @return the innermost active frame of the calling thread, or null if none
     */
    public ScopeFrame current() {
        ScopeFrame frame = top.get();
        if (frame != null && frame.epoch() != epoch.get()) {
            top.remove();
            return null;
        }
        return frame;
    }

    /**
     * Opens a namespace frame on the calling thread.
     */
    public ScopeHandle pushNamespace(String namespaceScope) {
        Objects.requireNonNull(namespaceScope, "Namespace scope cannot be null");
        return push(ScopeKind.NAMESPACE, namespaceScope, null);
    }

    /**
     * Opens an owner frame on the calling thread.
     */
    public ScopeHandle pushOwner(Object scopeOwner) {
        Objects.requireNonNull(scopeOwner, "Scope owner cannot be null");
        return push(ScopeKind.OBJECT, null, scopeOwner);
    }

    private ScopeHandle push(ScopeKind kind, String namespaceScope, Object scopeOwner) {
        ScopeFrame frame = new ScopeFrame(kind, namespaceScope, scopeOwner, current(), epoch.get());
        top.set(frame);
        logger.trace("Entered {}", frame);
        return new FrameHandle(frame);
    }

    private void release(ScopeFrame frame) {
        if (frame.epoch() != epoch.get()) {
            return;
        }
        ScopeFrame current = top.get();
        if (current != frame) {
            throw new OutOfOrderScopeException("Scope closed out of order: " + frame
                + " is not the innermost active scope of thread '" + Thread.currentThread().getName()
                + "' (innermost is " + current + ")");
        }
        if (frame.previous() == null) {
            top.remove();
        } else {
            top.set(frame.previous());
        }
        logger.trace("Exited {}", frame);
    }

    /**
     * @return number of active frames on the calling thread
     */
    public int depth() {
        int depth = 0;
        for (ScopeFrame frame = current(); frame != null; frame = frame.previous()) {
            depth++;
        }
        return depth;
    }

    /**
     * Invalidates the stacks of all threads.
     */
    public void reset() {
        epoch.incrementAndGet();
        top.remove();
    }

    private final class FrameHandle implements ScopeHandle {
        private final ScopeFrame frame;
        private volatile boolean closed;

        private FrameHandle(ScopeFrame frame) {
            this.frame = frame;
        }

        @Override
        public ScopeFrame frame() {
            return frame;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            release(frame);
            closed = true;
        }

        @Override
        public String toString() {
            return "ScopeHandle[" + frame + (closed ? ", closed" : "") + "]";
        }
    }
}
