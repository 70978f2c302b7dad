package tagcache.core.port.out;

/**
 * Port interface for turning cached values into store payloads and back.
 *
 * <p>Every value crosses this boundary, so callers never hold a reference to
 * the cached copy.
 */
public interface ValueCodec {

    /**
     * Encode a value.
     *
     * @param value the value, never null
     * @return the payload
     * @throws tagcache.core.exception.CacheSerializationException if the value cannot be encoded
     */
    byte[] encode(Object value);

    /**
     * Decode a payload.
     *
     * @param payload the payload read from the store
     * @param type    the expected value type
     * @param <T>     the value type
     * @return the decoded value
     * @throws tagcache.core.exception.CacheSerializationException if the payload does not match {@code type}
     */
    <T> T decode(byte[] payload, Class<T> type);
}
