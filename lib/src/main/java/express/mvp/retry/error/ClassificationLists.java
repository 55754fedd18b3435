package express.mvp.retry.error;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Whitelist and blacklist of failure kinds consulted by every {@link ErrorClassifier}.
 *
 * <p>A failure kind is an exception class; a failure matches a kind when it is an instance of it,
 * so registering a supertype covers its whole hierarchy.
 *
 * <ul>
 *   <li><b>Whitelist:</b> matching failures are never retried. Takes precedence over everything
 *       else, including the blacklist and custom evaluators.
 *   <li><b>Blacklist:</b> matching failures are retried when no custom evaluator decides.
 * </ul>
 *
 * <h2>Instances</h2>
 *
 * <p>{@link #global()} is the process-wide instance used by default. Tests and embedders that need
 * isolation construct their own with {@link #ClassificationLists()} or {@link #empty()} and pass it
 * to the {@link express.mvp.retry.Retrier}.
 *
 * <h2>Default Whitelist</h2>
 *
 * <ul>
 *   <li>{@link PermanentFailureException}
 *   <li>{@link SecurityException}
 *   <li>{@link UnsupportedOperationException}
 * </ul>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Mutations are serialized and publish a new immutable {@link Snapshot}. Readers take one
 * snapshot per classification and therefore decide against a single coherent view, while updates
 * become visible to the next classification.
 */
public final class ClassificationLists {

    private static final ClassificationLists GLOBAL = new ClassificationLists();

    private volatile Snapshot snapshot;

    /** Creates lists holding the default whitelist and an empty blacklist. */
    public ClassificationLists() {
        this.snapshot = new Snapshot(defaultWhitelist(), Set.of());
    }

    private ClassificationLists(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Returns the process-wide instance.
     *
     * @return shared lists
     */
    public static ClassificationLists global() {
        return GLOBAL;
    }

    /**
     * Creates lists with nothing registered.
     *
     * @return new empty lists
     */
    public static ClassificationLists empty() {
        return new ClassificationLists(new Snapshot(Set.of(), Set.of()));
    }

    private static Set<Class<? extends Throwable>> defaultWhitelist() {
        return Set.of(
                PermanentFailureException.class,
                SecurityException.class,
                UnsupportedOperationException.class);
    }

    /**
     * Registers a failure kind that must never be retried.
     *
     * @param kind the exception class
     */
    public synchronized void addWhitelisted(Class<? extends Throwable> kind) {
        Objects.requireNonNull(kind, "kind");
        Snapshot current = snapshot;
        snapshot = new Snapshot(with(current.whitelist, kind), current.blacklist);
    }

    /**
     * Removes a failure kind from the whitelist.
     *
     * @param kind the exception class
     * @return true if it was registered
     */
    public synchronized boolean removeWhitelisted(Class<? extends Throwable> kind) {
        Snapshot current = snapshot;
        if (!current.whitelist.contains(kind)) {
            return false;
        }
        snapshot = new Snapshot(without(current.whitelist, kind), current.blacklist);
        return true;
    }

    /**
     * Registers a failure kind that should be retried.
     *
     * @param kind the exception class
     */
    public synchronized void addBlacklisted(Class<? extends Throwable> kind) {
        Objects.requireNonNull(kind, "kind");
        Snapshot current = snapshot;
        snapshot = new Snapshot(current.whitelist, with(current.blacklist, kind));
    }

    /**
     * Removes a failure kind from the blacklist.
     *
     * @param kind the exception class
     * @return true if it was registered
     */
    public synchronized boolean removeBlacklisted(Class<? extends Throwable> kind) {
        Snapshot current = snapshot;
        if (!current.blacklist.contains(kind)) {
            return false;
        }
        snapshot = new Snapshot(current.whitelist, without(current.blacklist, kind));
        return true;
    }

    /** Clears both lists, dropping the default whitelist as well. */
    public synchronized void clear() {
        snapshot = new Snapshot(Set.of(), Set.of());
    }

    /** Restores the default whitelist and an empty blacklist. */
    public synchronized void resetToDefaults() {
        snapshot = new Snapshot(defaultWhitelist(), Set.of());
    }

    /**
     * Returns the current immutable view of both lists.
     *
     * @return the snapshot
     */
    public Snapshot snapshot() {
        return snapshot;
    }

    private static Set<Class<? extends Throwable>> with(
            Set<Class<? extends Throwable>> set, Class<? extends Throwable> kind) {
        Set<Class<? extends Throwable>> copy = new LinkedHashSet<>(set);
        copy.add(kind);
        return Collections.unmodifiableSet(copy);
    }

    private static Set<Class<? extends Throwable>> without(
            Set<Class<? extends Throwable>> set, Class<? extends Throwable> kind) {
        Set<Class<? extends Throwable>> copy = new LinkedHashSet<>(set);
        copy.remove(kind);
        return Collections.unmodifiableSet(copy);
    }

    @Override
    public String toString() {
        Snapshot current = snapshot;
        return "ClassificationLists[whitelist=" + current.whitelist.size()
                + ", blacklist=" + current.blacklist.size() + "]";
    }

    /** Immutable, point-in-time view of the whitelist and blacklist. */
    public static final class Snapshot {

        private final Set<Class<? extends Throwable>> whitelist;
        private final Set<Class<? extends Throwable>> blacklist;

        private Snapshot(
                Set<Class<? extends Throwable>> whitelist,
                Set<Class<? extends Throwable>> blacklist) {
            this.whitelist = whitelist;
            this.blacklist = blacklist;
        }

        /**
         * Returns the whitelisted kinds.
         *
         * @return unmodifiable set
         */
        public Set<Class<? extends Throwable>> whitelist() {
            return whitelist;
        }

        /**
         * Returns the blacklisted kinds.
         *
         * @return unmodifiable set
         */
        public Set<Class<? extends Throwable>> blacklist() {
            return blacklist;
        }

        /**
         * Checks if the failure matches a whitelisted kind.
         *
         * <p>A {@link PermanentFailureException} that reports itself retriable never matches.
         *
         * @param failure the failure
         * @return true if whitelisted
         */
        public boolean isWhitelisted(Throwable failure) {
            if (failure instanceof PermanentFailureException
                    && ((PermanentFailureException) failure).isRetriable()) {
                return false;
            }
            return matches(whitelist, failure);
        }

        /**
         * Checks if the failure matches a blacklisted kind.
         *
         * @param failure the failure
         * @return true if blacklisted
         */
        public boolean isBlacklisted(Throwable failure) {
            return matches(blacklist, failure);
        }

        private static boolean matches(Set<Class<? extends Throwable>> kinds, Throwable failure) {
            if (failure == null) {
                return false;
            }
            for (Class<? extends Throwable> kind : kinds) {
                if (kind.isInstance(failure)) {
                    return true;
                }
            }
            return false;
        }
    }
}
