package tagcache.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for the key-value store holding cache payloads.
 *
 * <p>Any store with get/set/delete/expire semantics can back the engine. Keys
 * passed here are already prefixed with the engine's own namespace. Stores do
 * not know about tags; tag membership is tracked by the engine.
 *
 * <p>Implementations must be thread-safe and must expire entries on their own
 * once the TTL passed to {@link #rawSet} has elapsed.
 */
public interface BackingStore {

    /**
     * Short name used in logs, metrics and errors.
     *
     * @return the store name
     */
    String name();

    /**
     * Read a payload.
     *
     * @param key the store key
     * @return Uni with the payload, or empty if absent or expired
     */
    Uni<Optional<byte[]>> rawGet(String key);

    /**
     * Write a payload, replacing any existing one.
     *
     * @param key   the store key
     * @param value the payload
     * @param ttl   time-to-live, always positive
     * @return Uni completing when the write is acknowledged
     */
    Uni<Void> rawSet(String key, byte[] value, Duration ttl);

    /**
     * Delete a payload. Deleting an absent key is not an error.
     *
     * @param key the store key
     * @return Uni with true if a payload was removed
     */
    Uni<Boolean> rawDelete(String key);

    /**
     * List the keys starting with a prefix.
     *
     * @param prefix the key prefix
     * @return Uni with the matching keys (full store keys, prefix included)
     */
    Uni<List<String>> rawScanByPrefix(String prefix);

    /**
     * Release resources held by the store. Called once on shutdown.
     */
    default void close() {}
}
