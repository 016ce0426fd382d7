package org.optimax.rogue.server.codec;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.NamedType;

import java.io.IOException;

/**
 * Encodes wire values as UTF-8 JSON and back.
 * <p>
 * Polymorphic values carry their {@link TypeRegistry} tag in a {@code "type"} property. Only
 * fields annotated with {@code @JsonProperty} are written; getters are never auto-detected.
 * Byte arrays such as dungeon tiles travel as Base64 text. Thread-safe once constructed.
 */
public final class WireCodec {

    private final ObjectMapper mapper;

    public WireCodec(TypeRegistry registry) {
        this.mapper = new ObjectMapper()
                .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.NONE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        this.mapper.registerSubtypes(registry.namedTypes().toArray(new NamedType[0]));
    }

    /**
     * @throws CodecException if the value cannot be serialised
     */
    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws CodecException if the bytes are not a valid encoding of {@code type}
     */
    public <T> T decode(byte[] bytes, Class<T> type) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new CodecException("Failed to decode " + type.getSimpleName() + " from " + bytes.length + " bytes", e);
        }
    }
}
