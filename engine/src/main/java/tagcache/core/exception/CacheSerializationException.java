package tagcache.core.exception;

/**
 * A value could not be encoded for, or decoded from, the backing store.
 */
public class CacheSerializationException extends CacheException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
