package tagcache.adapter.out.store.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import tagcache.core.port.out.BackingStore;

/**
 * Redis implementation of BackingStore.
 *
 * <p>Payloads are stored as binary strings with a millisecond TTL, so Redis
 * discards them on its own once they expire. Timeouts are applied by the engine,
 * not here.
 */
public class RedisBackingStore implements BackingStore {

    public static final String NAME = "redis";

    static final long SCAN_COUNT = 500;

    private final ReactiveValueCommands<String, byte[]> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;

    public RedisBackingStore(ReactiveRedisDataSource redisDataSource) {
        this.valueCommands = redisDataSource.value(String.class, byte[].class);
        this.keyCommands = redisDataSource.key(String.class);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<Optional<byte[]>> rawGet(String key) {
        return valueCommands.get(key).map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> rawSet(String key, byte[] value, Duration ttl) {
        // PSETEX rejects zero, sub-millisecond TTLs round up
        return valueCommands.psetex(key, Math.max(1, ttl.toMillis()), value);
    }

    @Override
    public Uni<Boolean> rawDelete(String key) {
        return keyCommands.del(key).map(count -> count > 0);
    }

    @Override
    public Uni<List<String>> rawScanByPrefix(String prefix) {
        final var args = new KeyScanArgs().match(escapeGlob(prefix) + "*").count(SCAN_COUNT);
        return keyCommands.scan(args).toMulti().collect().asList();
    }

    /**
     * Escape characters Redis treats as glob syntax in a MATCH pattern.
     */
    static String escapeGlob(String literal) {
        final var escaped = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            final char c = literal.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
