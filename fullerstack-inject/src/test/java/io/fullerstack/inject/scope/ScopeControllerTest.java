package io.fullerstack.inject.scope;

import io.fullerstack.inject.OutOfOrderScopeException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the thread-local scope stack.
 */
class ScopeControllerTest {

    private final ScopeController controller = new ScopeController();

    @Test
    void emptyByDefault() {
        assertThat(controller.current()).isNull();
        assertThat(controller.depth()).isZero();
    }

    @Test
    void framesNestAndUnwindInReverseOrder() {
        Object owner = new Object();

        try (ScopeHandle outer = controller.pushNamespace("App")) {
            try (ScopeHandle inner = controller.pushOwner(owner)) {
                ScopeFrame top = controller.current();
                assertThat(top.kind()).isEqualTo(ScopeKind.OBJECT);
                assertThat(top.scopeOwner()).isSameAs(owner);
                assertThat(top.previous()).isSameAs(outer.frame());
                assertThat(controller.depth()).isEqualTo(2);
            }
            assertThat(controller.current()).isSameAs(outer.frame());
            assertThat(outer.frame().namespaceScope()).isEqualTo("App");
        }

        assertThat(controller.current()).isNull();
    }

    @Test
    void outOfOrderReleaseLeavesStackUntouched() {
        ScopeHandle a = controller.pushNamespace("A");
        ScopeHandle b = controller.pushNamespace("B");

        assertThatThrownBy(a::close)
            .isInstanceOf(OutOfOrderScopeException.class)
            .hasMessageContaining("out of order");

        assertThat(controller.current()).isSameAs(b.frame());
        assertThat(controller.depth()).isEqualTo(2);

        b.close();
        a.close();
        assertThat(controller.depth()).isZero();
    }

    @Test
    void closingTwiceIsNoOp() {
        ScopeHandle outer = controller.pushNamespace("A");
        ScopeHandle inner = controller.pushNamespace("B");

        inner.close();
        inner.close();

        assertThat(controller.current()).isSameAs(outer.frame());
        outer.close();
    }

    @Test
    void framesAreThreadLocal() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (ScopeHandle ignored = controller.pushNamespace("Main")) {
            Future<ScopeFrame> seen = executor.submit(controller::current);

            assertThat(seen.get(5, TimeUnit.SECONDS)).isNull();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void resetDiscardsCallerStackAndStaleHandles() {
        ScopeHandle handle = controller.pushNamespace("A");

        controller.reset();

        assertThat(controller.current()).isNull();
        assertThatCode(handle::close).doesNotThrowAnyException();
    }

    @Test
    void resetReachesOtherThreads() throws Exception {
        CountDownLatch opened = new CountDownLatch(1);
        CountDownLatch resetDone = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ScopeFrame> afterReset = executor.submit(() -> {
                ScopeHandle handle = controller.pushNamespace("Worker");
                opened.countDown();
                resetDone.await(5, TimeUnit.SECONDS);
                ScopeFrame frame = controller.current();
                handle.close();
                return frame;
            });

            assertThat(opened.await(5, TimeUnit.SECONDS)).isTrue();
            controller.reset();
            resetDone.countDown();

            assertThat(afterReset.get(5, TimeUnit.SECONDS)).isNull();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void framesPushedAfterResetAreLive() {
        controller.pushNamespace("Old");
        controller.reset();

        try (ScopeHandle handle = controller.pushNamespace("New")) {
            assertThat(controller.current()).isSameAs(handle.frame());
            assertThat(handle.frame().previous()).isNull();
        }
        assertThat(controller.depth()).isZero();
    }
}
