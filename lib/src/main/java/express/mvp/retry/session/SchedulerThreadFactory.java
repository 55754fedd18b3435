package express.mvp.retry.session;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for {@link RetryScheduler} threads.
 *
 * <p>Created threads are named "{prefix}-{counter}".
 */
final class SchedulerThreadFactory implements ThreadFactory {

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;
    private final boolean daemon;

    SchedulerThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }

    long getThreadCount() {
        return threadCount.get();
    }

    String getNamePrefix() {
        return namePrefix;
    }

    boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "SchedulerThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
