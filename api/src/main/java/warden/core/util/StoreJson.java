package warden.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding for values kept in the key-value store.
 *
 * <p>Instants are written as ISO-8601 strings. Unknown properties are ignored
 * on read so older instances can read records written by newer ones.
 */
public final class StoreJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StoreJson() {}

    public static String write(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreSerializationException(
                    "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(String json, Class<T> type) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * Exception thrown when a stored value cannot be encoded or decoded.
     */
    public static class StoreSerializationException extends RuntimeException {
        public StoreSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
