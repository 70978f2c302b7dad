package tagcache.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

import com.google.common.util.concurrent.Striped;
import org.jboss.logging.Logger;

import tagcache.core.config.CacheSettings;
import tagcache.core.exception.CacheException;
import tagcache.core.model.CacheEntry;
import tagcache.core.model.CacheKeys;
import tagcache.core.model.CacheStatistics;
import tagcache.core.model.InvalidationResult;
import tagcache.core.port.out.BackingStore;
import tagcache.core.port.out.CacheMetrics;
import tagcache.core.port.out.ValueCodec;

/**
 * Key/value cache with TTL expiry, tag-based group invalidation and hit/miss accounting.
 *
 * <p>Payloads live in the {@link BackingStore}; tag memberships and expiry instants
 * live in a process-local {@link TagIndex} owned by this instance. The index is
 * authoritative for liveness: a key is a hit only while it has an unexpired index
 * record and the store still returns its payload.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Mutations of one key ({@code set}, {@code delete}, pruning, tag invalidation of
 *       that key) run under a striped per-key lock, store write and index refresh
 *       together.</li>
 *   <li>{@link #invalidateTag} holds at most one key lock at a time, so there is no
 *       lock ordering to get wrong.</li>
 *   <li>{@link #writeThrough} holds the key lock across the upstream update and the
 *       cache write, so concurrent updates of one key are cached in commit order.</li>
 *   <li>{@link #get} does not lock; it only locks to prune a key it found stale.</li>
 * </ul>
 *
 * <p>Entries have their own TTL, but the index assumes this instance is the only
 * writer under its key prefix: {@link #start()} deletes every payload there that
 * it has no record of.
 *
 * <p>Store calls block the calling thread for at most the operation timeout. Never
 * call this class from an event-loop thread.
 */
public class TaggedCache implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(TaggedCache.class);

    /**
     * Longest accepted TTL. Longer durations overflow instant and nanosecond arithmetic.
     */
    public static final Duration MAX_TTL = Duration.ofDays(365L * 100);

    private final BackingStore store;
    private final ValueCodec codec;
    private final CacheMetrics metrics;
    private final Clock clock;
    private final CacheSettings settings;
    private final StoreOperationGuard guard;
    private final TagIndex index = new TagIndex();
    private final HitMissCounters counters = new HitMissCounters();
    private final Striped<Lock> keyLocks;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public TaggedCache(
            BackingStore store, ValueCodec codec, CacheMetrics metrics, Clock clock, CacheSettings settings) {
        this.store = store;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
        this.guard = new StoreOperationGuard(store.name(), metrics);
        this.keyLocks = Striped.lock(settings.lockStripes());
    }

    /**
     * Prepare the cache for use.
     *
     * <p>Entries left under the key prefix by a previous process have no index
     * record, so no tag could ever invalidate them; they are deleted here.
     *
     * @return number of orphaned entries removed
     */
    public int start() {
        ensureOpen();
        if (!started.compareAndSet(false, true)) {
            return 0;
        }
        metrics.bindIndexSize(this::size);
        final var removed = removeOrphans(settings.operationTimeout());
        LOG.infov("Tagged cache started on store {0}, removed {1} orphaned entries", store.name(), removed);
        return removed;
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, type, settings.operationTimeout());
    }

    /**
     * Look up a live entry.
     *
     * <p>Every call counts exactly one hit or one miss for the key's namespace.
     *
     * @param key the cache key
     * @param type the expected value type
     * @param timeout maximum time to wait for the backing store
     * @param <T> the value type
     * @return the value, or empty if absent or expired
     * @throws IllegalArgumentException if the key is blank
     * @throws tagcache.core.exception.CacheTimeoutException if the store did not answer in time
     * @throws tagcache.core.exception.BackingStoreUnavailableException if the store failed
     */
    public <T> Optional<T> get(String key, Class<T> type, Duration timeout) {
        requireKey(key);
        requireTimeout(timeout);
        ensureOpen();

        final var namespace = namespaceOf(key);
        final var startNanos = System.nanoTime();
        try {
            return lookup(key, type, namespace, timeout);
        } finally {
            metrics.recordOperation("get", namespace, System.nanoTime() - startNanos);
        }
    }

    private <T> Optional<T> lookup(String key, Class<T> type, String namespace, Duration timeout) {
        final var indexed = index.entry(key);
        if (indexed.isEmpty()) {
            return miss(namespace);
        }

        final var entry = indexed.get();
        if (entry.isExpiredAt(clock.instant())) {
            prune(entry);
            return miss(namespace);
        }

        final Optional<byte[]> payload = guard.await(store.rawGet(storeKey(key)), "get", timeout);
        if (payload.isEmpty()) {
            // Evicted or expired by the store ahead of the index
            prune(entry);
            return miss(namespace);
        }

        final var value = codec.decode(payload.get(), type);
        counters.hit(namespace);
        metrics.recordHit(namespace);
        return Optional.ofNullable(value);
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    public void set(String key, Object value, Set<String> tags) {
        set(key, value, settings.defaultTtl(), tags, settings.operationTimeout());
    }

    public void set(String key, Object value, Duration ttl, Set<String> tags) {
        set(key, value, ttl, tags, settings.operationTimeout());
    }

    /**
     * Store a value, replacing any previous entry for the key.
     *
     * <p>Tags carried by the previous entry but not by the new one are released, so
     * invalidating an old tag no longer reaches this key. If the store write fails,
     * the key is dropped from the index: the store may hold either value, and a key
     * without an index record always reads as a miss.
     *
     * @param key the cache key
     * @param value the value, never null
     * @param ttl time-to-live, must be positive
     * @param tags tags to register the entry under (may be empty)
     * @param timeout maximum time to wait for the backing store
     * @throws IllegalArgumentException on a blank key, non-positive TTL, null value or blank tag
     */
    public void set(String key, Object value, Duration ttl, Set<String> tags, Duration timeout) {
        requireKey(key);
        requireTtl(ttl);
        final var tagSet = requireTags(tags);
        requireTimeout(timeout);
        if (value == null) {
            throw new IllegalArgumentException("Cache value must not be null: " + key);
        }
        ensureOpen();

        final var startNanos = System.nanoTime();
        final var payload = codec.encode(value);
        final var lock = lockFor(key);
        lock.lock();
        try {
            final var entry = new CacheEntry(key, clock.instant().plus(ttl), tagSet);
            try {
                guard.await(store.rawSet(storeKey(key), payload, ttl), "set", timeout);
            } catch (CacheException e) {
                index.remove(key);
                throw e;
            }
            index.put(entry);
        } finally {
            lock.unlock();
            metrics.recordOperation("set", namespaceOf(key), System.nanoTime() - startNanos);
        }
        LOG.debugv("Cached {0} for {1} with tags {2}", key, ttl, tagSet);
    }

    public boolean delete(String key) {
        return delete(key, settings.operationTimeout());
    }

    /**
     * Remove an entry and all of its tag memberships. Idempotent.
     *
     * @param key the cache key
     * @param timeout maximum time to wait for the backing store
     * @return true if the key was indexed or the store held a payload for it
     */
    public boolean delete(String key, Duration timeout) {
        requireKey(key);
        requireTimeout(timeout);
        ensureOpen();

        final var lock = lockFor(key);
        lock.lock();
        try {
            final boolean removedFromStore = guard.await(store.rawDelete(storeKey(key)), "delete", timeout);
            final var removedFromIndex = index.remove(key).isPresent();
            return removedFromStore || removedFromIndex;
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Invalidation
    // -------------------------------------------------------------------------

    public InvalidationResult invalidateTag(String tag) {
        return invalidateTag(tag, settings.operationTimeout());
    }

    /**
     * Remove every entry carrying a tag.
     *
     * <p>Each member key is re-checked under its own lock before it is deleted, and
     * is removed from all of its tags, not just this one. A key set with this tag
     * while the invalidation runs either gets invalidated too or survives together
     * with its membership; the tag is only dropped once no key carries it.
     *
     * <p>The timeout applies to each store call. If the store fails part way, the
     * keys not yet processed stay indexed under the tag and a retry picks them up.
     *
     * @param tag the tag to invalidate
     * @param timeout maximum time to wait for each backing store call
     * @return the keys that were removed
     */
    public InvalidationResult invalidateTag(String tag, Duration timeout) {
        requireTag(tag);
        requireTimeout(timeout);
        ensureOpen();

        final var startNanos = System.nanoTime();
        try {
            return invalidateMembers(tag, timeout);
        } finally {
            metrics.recordOperation("invalidateTag", namespaceOf(tag), System.nanoTime() - startNanos);
        }
    }

    private InvalidationResult invalidateMembers(String tag, Duration timeout) {
        final var members = index.keysFor(tag).stream().sorted().toList();
        if (members.isEmpty()) {
            index.dropTagIfEmpty(tag);
            return InvalidationResult.none(tag);
        }

        final var invalidated = new ArrayList<String>(members.size());
        for (String key : members) {
            final var lock = lockFor(key);
            lock.lock();
            try {
                final var entry = index.entry(key);
                if (entry.isPresent() && entry.get().hasTag(tag)) {
                    guard.await(store.rawDelete(storeKey(key)), "invalidateTag", timeout);
                    index.remove(key);
                    invalidated.add(key);
                }
            } finally {
                lock.unlock();
            }
        }
        index.dropTagIfEmpty(tag);

        metrics.recordInvalidation(tag, invalidated.size());
        LOG.infov("Invalidated tag {0}: {1} entries removed", tag, invalidated.size());
        return new InvalidationResult(tag, invalidated);
    }

    /**
     * Invalidate several tags in order.
     *
     * @param tags the tags to invalidate
     * @return one result per tag
     */
    public List<InvalidationResult> invalidateTags(Collection<String> tags) {
        final var results = new ArrayList<InvalidationResult>(tags.size());
        for (String tag : tags) {
            results.add(invalidateTag(tag));
        }
        return results;
    }

    // -------------------------------------------------------------------------
    // Compositions
    // -------------------------------------------------------------------------

    /**
     * Update the system of record, then cache the committed value.
     *
     * <p>The cache is written only after {@code authoritativeUpdate} returned. If it
     * throws, the cache is not touched and the exception, checked or not, reaches the
     * caller unchanged. A null result means there is nothing to cache and any existing
     * entry for the key is removed. If the cache write fails after the commit, the
     * key reads as a miss from then on and the cache failure propagates.
     *
     * <p>The key lock is held for the whole call, so writers of the same key, and of
     * keys sharing its lock stripe, wait for the upstream update to finish.
     *
     * @param key the cache key
     * @param ttl time-to-live of the cached value
     * @param tags tags of the cached value
     * @param authoritativeUpdate performs and commits the upstream write, returning the stored value
     * @param <T> the value type
     * @return the committed value
     * @throws Exception whatever {@code authoritativeUpdate} threw
     */
    public <T> T writeThrough(String key, Duration ttl, Set<String> tags, Callable<T> authoritativeUpdate)
            throws Exception {
        requireKey(key);
        requireTtl(ttl);
        requireTags(tags);
        ensureOpen();

        final var lock = lockFor(key);
        lock.lock();
        try {
            final var committed = authoritativeUpdate.call();
            if (committed == null) {
                delete(key);
                return null;
            }
            set(key, committed, ttl, tags);
            return committed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cache-aside lookup: return the cached value or load, cache and return it.
     *
     * <p>Store failures during the lookup propagate; treating them as a miss is a
     * decision left to the caller. Loader failures propagate and nothing is cached.
     *
     * @param key the cache key
     * @param type the value type
     * @param ttl time-to-live of a loaded value
     * @param tags tags of a loaded value
     * @param loader computes the value from the system of record
     * @param <T> the value type
     * @return the cached or loaded value (null only if the loader returned null)
     */
    public <T> T getOrCompute(String key, Class<T> type, Duration ttl, Set<String> tags, Supplier<T> loader) {
        requireTtl(ttl);
        requireTags(tags);

        final var cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        final var loaded = loader.get();
        if (loaded != null) {
            set(key, loaded, ttl, tags);
        }
        return loaded;
    }

    // -------------------------------------------------------------------------
    // Statistics
    // -------------------------------------------------------------------------

    public CacheStatistics statistics(String namespace) {
        return counters.snapshot(namespace);
    }

    /**
     * Snapshot of every namespace seen since start or the last reset.
     *
     * @return statistics keyed by namespace, sorted by name
     */
    public Map<String, CacheStatistics> statistics() {
        return counters.snapshotAll();
    }

    public void resetStatistics() {
        counters.reset();
        LOG.info("Cache statistics reset");
    }

    public void resetStatistics(String namespace) {
        counters.reset(namespace);
        LOG.infov("Cache statistics reset for namespace {0}", namespace);
    }

    // -------------------------------------------------------------------------
    // Maintenance and index views
    // -------------------------------------------------------------------------

    /**
     * Drop index records of expired entries.
     *
     * <p>Payloads are not touched; the store expires them with the same TTL.
     *
     * @return number of records dropped
     */
    public int purgeExpired() {
        final var now = clock.instant();
        var purged = 0;
        for (CacheEntry entry : index.expiredAt(now)) {
            if (prune(entry)) {
                purged++;
            }
        }
        if (purged > 0) {
            LOG.debugv("Purged {0} expired index records", purged);
        }
        return purged;
    }

    /**
     * Remove every entry this cache owns, indexed or orphaned.
     *
     * @return number of entries removed
     */
    public int clear() {
        ensureOpen();
        final var timeout = settings.operationTimeout();
        var removed = 0;
        for (String key : index.keys()) {
            if (delete(key, timeout)) {
                removed++;
            }
        }
        removed += removeOrphans(timeout);
        LOG.infov("Cache cleared: {0} entries removed", removed);
        return removed;
    }

    public Optional<CacheEntry> entry(String key) {
        return index.entry(key);
    }

    public Set<String> keys(String tag) {
        return index.keysFor(tag);
    }

    public Set<String> tags() {
        return index.tags();
    }

    public int size() {
        return index.size();
    }

    public String storeName() {
        return store.name();
    }

    /**
     * Release the backing store. Further operations fail.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.infov("Closing tagged cache on store {0}", store.name());
            store.close();
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private <T> Optional<T> miss(String namespace) {
        counters.miss(namespace);
        metrics.recordMiss(namespace);
        return Optional.empty();
    }

    private boolean prune(CacheEntry stale) {
        final var lock = lockFor(stale.key());
        lock.lock();
        try {
            return index.removeIfSame(stale);
        } finally {
            lock.unlock();
        }
    }

    private int removeOrphans(Duration timeout) {
        final var prefix = settings.keyPrefix();
        if (prefix.isEmpty()) {
            // Without a private prefix every store key would look orphaned
            LOG.debug("No key prefix configured, skipping orphan removal");
            return 0;
        }
        final List<String> storeKeys = guard.await(store.rawScanByPrefix(prefix), "scan", timeout);
        var removed = 0;
        for (String storeKey : storeKeys) {
            final var key = storeKey.substring(prefix.length());
            final var lock = lockFor(key);
            lock.lock();
            try {
                if (index.entry(key).isEmpty()
                        && Boolean.TRUE.equals(guard.await(store.rawDelete(storeKey), "delete", timeout))) {
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }
        return removed;
    }

    private Lock lockFor(String key) {
        return keyLocks.get(key);
    }

    private String storeKey(String key) {
        return settings.keyPrefix() + key;
    }

    private String namespaceOf(String key) {
        return CacheKeys.namespaceOf(key, settings.namespaceSeparator());
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Tagged cache is closed");
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        if (ttl.compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException("TTL must not exceed " + MAX_TTL + ", got: " + ttl);
        }
    }

    private static void requireTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }
    }

    private static void requireTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag must not be blank");
        }
    }

    private static Set<String> requireTags(Set<String> tags) {
        if (tags == null) {
            return Set.of();
        }
        tags.forEach(TaggedCache::requireTag);
        return Set.copyOf(tags);
    }
}
