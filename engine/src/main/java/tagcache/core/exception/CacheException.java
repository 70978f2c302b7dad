package tagcache.core.exception;

/**
 * Base class for failures of the cache layer itself.
 *
 * <p>A missing entry is never a {@code CacheException}; lookups report absence
 * through an empty {@link java.util.Optional}.
 */
public abstract class CacheException extends RuntimeException {

    protected CacheException(String message) {
        super(message);
    }

    protected CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
