package express.mvp.retry.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CancellationToken}. */
@DisplayName("CancellationToken")
class CancellationTokenTest {

    @Test
    @DisplayName("Only the first cancel() reports a change")
    void cancelOnce() {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
    }

    @Test
    @DisplayName("Callbacks run once on cancellation")
    void callbacksRunOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Callbacks registered after cancellation run immediately")
    void lateCallbackRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A failing callback does not stop the others")
    void failingCallbackIsolated() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("callback bug");
        });
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Deregistered callbacks are released and never run")
    void deregisteredCallbackReleased() {
        CancellationToken token = new CancellationToken();
        AtomicInteger removed = new AtomicInteger();
        AtomicInteger kept = new AtomicInteger();
        Runnable deregister = token.onCancel(removed::incrementAndGet);
        token.onCancel(kept::incrementAndGet);
        assertEquals(2, token.getCallbackCount());

        deregister.run();
        deregister.run();

        assertEquals(1, token.getCallbackCount());
        assertTrue(token.cancel());
        assertEquals(0, removed.get());
        assertEquals(1, kept.get());
        assertEquals(0, token.getCallbackCount());
    }

    @Test
    @DisplayName("The same callback registered twice is removed one registration at a time")
    void duplicateRegistrations() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        Runnable callback = calls::incrementAndGet;
        Runnable first = token.onCancel(callback);
        token.onCancel(callback);

        first.run();
        token.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("The handle returned after cancellation is a no-op")
    void lateHandleIsNoOp() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        Runnable deregister = token.onCancel(() -> {});

        assertDoesNotThrow(deregister::run);
        assertEquals("CancellationToken[cancelled=true, callbacks=0]", token.toString());
    }
}
