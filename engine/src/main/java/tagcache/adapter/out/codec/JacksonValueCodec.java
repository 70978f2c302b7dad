package tagcache.adapter.out.codec;

import java.io.IOException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import tagcache.core.exception.CacheSerializationException;
import tagcache.core.port.out.ValueCodec;

/**
 * JSON codec for cached values.
 *
 * <p>Uses the application's ObjectMapper, so any Jackson customization applies to
 * cached values as well.
 */
@ApplicationScoped
public class JacksonValueCodec implements ValueCodec {

    private final ObjectMapper objectMapper;

    @Inject
    public JacksonValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(
                    "Failed to encode value of type " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (IOException e) {
            throw new CacheSerializationException("Failed to decode cached value as " + type.getName(), e);
        }
    }
}
