package express.mvp.retry.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-held handle used to abort asynchronous retry sessions.
 *
 * <p>A token may be shared by several sessions; cancelling it aborts all of them. Cancellation is
 * one-way: once cancelled, a token stays cancelled, and callbacks registered afterwards run
 * immediately.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CompletableFuture<Page> page = session.runAsync(() -> client.fetchAsync(url), token);
 *
 * // later, e.g. when the user navigates away
 * token.cancel();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Callbacks run on the thread calling {@link #cancel()}, or on the
 * registering thread if the token is already cancelled.
 */
public final class CancellationToken {

    private static final Logger LOGGER = Logger.getLogger(CancellationToken.class.getName());

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    /**
     * Cancels the token and runs the registered callbacks.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            run(callback);
        }
        return true;
    }

    /**
     * Checks if the token was cancelled.
     *
     * @return true once {@link #cancel()} was called
     */
    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a callback to run on cancellation.
     *
     * <p>The returned handle removes the callback again. Sessions call it when they complete, so a
     * long-lived token shared by many sessions only holds callbacks for the ones still running.
     *
     * @param callback the callback
     * @return a handle that deregisters the callback; a no-op if the token was already cancelled
     */
    public Runnable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> remove(callback);
            }
        }
        run(callback);
        return () -> {};
    }

    private synchronized void remove(Runnable callback) {
        for (int i = callbacks.size() - 1; i >= 0; i--) {
            if (callbacks.get(i) == callback) {
                callbacks.remove(i);
                return;
            }
        }
    }

    /**
     * Returns the number of callbacks waiting for cancellation.
     *
     * @return registered callback count
     */
    public synchronized int getCallbackCount() {
        return callbacks.size();
    }

    private static void run(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cancellation callback failed", e);
        }
    }

    @Override
    public synchronized String toString() {
        return "CancellationToken[cancelled=" + cancelled + ", callbacks=" + callbacks.size() + "]";
    }
}
