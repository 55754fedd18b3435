package express.mvp.retry;

/**
 * Blocking wait used by synchronous sessions between attempts.
 *
 * <p>The default implementation is {@link Thread#sleep(long)}. Replacing it is mainly useful in
 * tests that want to record delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeper backed by {@link Thread#sleep(long)}. */
    Sleeper THREAD_SLEEP = Thread::sleep;

    /**
     * Blocks the calling thread.
     *
     * @param millis time to wait in milliseconds
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(long millis) throws InterruptedException;
}
