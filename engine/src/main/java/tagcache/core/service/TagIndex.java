package tagcache.core.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import tagcache.core.model.CacheEntry;

/**
 * Process-local index of cache entries and their tag memberships.
 *
 * <p>Kept apart from the stored payloads so it never expires or gets evicted
 * together with ordinary entries. Mutations for a key must happen while the
 * caller holds that key's lock; tag sets are only ever touched through atomic
 * map operations, so a key is never added to a tag set that is concurrently
 * being dropped.
 */
final class TagIndex {

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> keysByTag = new ConcurrentHashMap<>();

    Optional<CacheEntry> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Register an entry, replacing the memberships of any previous entry for the key.
     *
     * @param entry the new entry
     * @return the replaced entry, if any
     */
    Optional<CacheEntry> put(CacheEntry entry) {
        final var previous = entries.put(entry.key(), entry);
        if (previous != null) {
            for (String tag : previous.tags()) {
                if (!entry.hasTag(tag)) {
                    unlink(tag, entry.key());
                }
            }
        }
        for (String tag : entry.tags()) {
            link(tag, entry.key());
        }
        return Optional.ofNullable(previous);
    }

    Optional<CacheEntry> remove(String key) {
        final var removed = entries.remove(key);
        if (removed != null) {
            removed.tags().forEach(tag -> unlink(tag, key));
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Remove an entry only if it is still the given instance.
     *
     * @param expected the entry observed earlier
     * @return true if it was removed
     */
    boolean removeIfSame(CacheEntry expected) {
        if (entries.remove(expected.key(), expected)) {
            expected.tags().forEach(tag -> unlink(tag, expected.key()));
            return true;
        }
        return false;
    }

    /**
     * Snapshot of the keys registered under a tag.
     *
     * @param tag the tag
     * @return keys in no particular order (empty if the tag is unknown)
     */
    Set<String> keysFor(String tag) {
        final var keys = keysByTag.get(tag);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    Set<String> tags() {
        return Set.copyOf(keysByTag.keySet());
    }

    Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    List<CacheEntry> expiredAt(Instant now) {
        final var expired = new ArrayList<CacheEntry>();
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpiredAt(now)) {
                expired.add(entry);
            }
        }
        return expired;
    }

    /**
     * Drop a tag if no key carries it any more.
     *
     * @param tag the tag
     */
    void dropTagIfEmpty(String tag) {
        keysByTag.computeIfPresent(tag, (t, keys) -> keys.isEmpty() ? null : keys);
    }

    int size() {
        return entries.size();
    }

    private void link(String tag, String key) {
        keysByTag.compute(tag, (t, keys) -> {
            final var target = keys == null ? ConcurrentHashMap.<String>newKeySet() : keys;
            target.add(key);
            return target;
        });
    }

    private void unlink(String tag, String key) {
        keysByTag.computeIfPresent(tag, (t, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }
}
