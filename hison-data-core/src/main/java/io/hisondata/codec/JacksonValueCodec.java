package io.hisondata.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hisondata.core.ValueEncodingException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Jackson implementation of {@link ValueCodec}.
 * <p>
 * The default mapper keeps map insertion order, writes java.time values as ISO strings,
 * writes integral floating-point values as integers and non-finite values as {@code null}.
 */
public final class JacksonValueCodec implements ValueCodec {
    private static final JacksonValueCodec SHARED = new JacksonValueCodec();

    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default mapper.
     */
    public JacksonValueCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonValueCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static JacksonValueCodec shared() {
        return SHARED;
    }

    /**
     * Build the mapper used by {@link #JacksonValueCodec()}.
     */
    public static ObjectMapper defaultMapper() {
        SimpleModule numbers = new SimpleModule("hison-canonical-numbers");
        CanonicalNumberSerializer serializer = new CanonicalNumberSerializer();
        numbers.addSerializer(Double.class, serializer);
        numbers.addSerializer(Float.class, serializer);
        numbers.addSerializer(BigDecimal.class, serializer);
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(numbers)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String writeString(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValueEncodingException("Failed to encode value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public Object readValue(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json required");
        }
        try {
            return mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new ValueEncodingException("Failed to parse JSON document", e);
        }
    }

    static final class CanonicalNumberSerializer extends StdSerializer<Number> {
        private static final double MAX_EXACT_INTEGRAL = 1e15;

        CanonicalNumberSerializer() {
            super(Number.class);
        }

        @Override
        public void serialize(Number value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value instanceof BigDecimal decimal) {
                BigDecimal stripped = decimal.stripTrailingZeros();
                if (stripped.scale() <= 0) {
                    gen.writeNumber(stripped.toBigIntegerExact());
                } else {
                    gen.writeNumber(stripped);
                }
                return;
            }
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                gen.writeNull();
                return;
            }
            if (d == Math.rint(d) && Math.abs(d) < MAX_EXACT_INTEGRAL) {
                gen.writeNumber((long) d);
                return;
            }
            if (value instanceof Float f) {
                gen.writeNumber(f.floatValue());
            } else {
                gen.writeNumber(d);
            }
        }
    }
}
