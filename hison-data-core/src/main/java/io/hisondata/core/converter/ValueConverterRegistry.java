package io.hisondata.core.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayDeque;
import java.util.Date;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link ValueConverter} that dispatches on the runtime class of the value to a
 * registered {@link TypeConverter}.
 * <p>
 * Lookup tries the exact class first, then its superclasses, then its interfaces.
 * Values with no matching converter pass through unchanged.
 * <pre>
 * ValueConverterRegistry registry = ValueConverterRegistry.withDefaults();
 * HisonDataConfiguration config = HisonDataConfiguration.builder()
 *     .valueConverter(registry)
 *     .build();
 * </pre>
 */
public final class ValueConverterRegistry implements ValueConverter {
    private static final Logger LOG = LoggerFactory.getLogger(ValueConverterRegistry.class);

    private final Map<Class<?>, TypeConverter<?, ?>> converters = new ConcurrentHashMap<>();
    private final Map<Class<?>, Optional<TypeConverter<?, ?>>> resolved = new ConcurrentHashMap<>();

    /**
     * Create an empty registry.
     */
    public ValueConverterRegistry() {
    }

    /**
     * Create a registry holding the default temporal, UUID and enum converters.
     * <ul>
     *   <li>{@link Instant}, {@link Date} → epoch milliseconds</li>
     *   <li>{@link LocalDate}, {@link LocalDateTime}, {@link LocalTime} → ISO-8601 string</li>
     *   <li>{@link java.sql.Date}, {@link java.sql.Timestamp} → ISO-8601 string</li>
     *   <li>{@link UUID} → canonical string</li>
     *   <li>any enum → its constant name</li>
     * </ul>
     */
    public static ValueConverterRegistry withDefaults() {
        ValueConverterRegistry registry = new ValueConverterRegistry();
        registry.register(new InstantEpochMillisConverter());
        registry.register(new DateEpochMillisConverter());
        registry.register(new IsoStringConverter<>(LocalDate.class));
        registry.register(new IsoStringConverter<>(LocalDateTime.class));
        registry.register(new IsoStringConverter<>(LocalTime.class));
        registry.register(new IsoStringConverter<>(UUID.class));
        registry.register(new SqlDateConverter());
        registry.register(new SqlTimestampConverter());
        registry.register(new EnumNameConverter());
        return registry;
    }

    public <J, S> ValueConverterRegistry register(TypeConverter<J, S> converter) {
        if (converter == null) {
            throw new IllegalArgumentException("converter required");
        }
        TypeConverter<?, ?> previous = converters.put(converter.javaType(), converter);
        resolved.clear();
        if (previous != null) {
            LOG.debug("Replaced converter for {}: {} -> {}", converter.javaType().getName(),
                    previous.getClass().getSimpleName(), converter.getClass().getSimpleName());
        } else {
            LOG.debug("Registered converter for {}", converter.javaType().getName());
        }
        return this;
    }

    public boolean hasConverter(Class<?> javaType) {
        return lookup(javaType).isPresent();
    }

    @SuppressWarnings("unchecked")
    public <J> Optional<TypeConverter<J, ?>> getConverter(Class<J> javaType) {
        return lookup(javaType).map(converter -> (TypeConverter<J, ?>) converter);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object convert(Object value) {
        if (value == null) {
            return null;
        }
        Optional<TypeConverter<?, ?>> converter = lookup(value.getClass());
        if (converter.isEmpty()) {
            return null;
        }
        return ((TypeConverter<Object, ?>) converter.get()).toStorage(value);
    }

    private Optional<TypeConverter<?, ?>> lookup(Class<?> type) {
        return resolved.computeIfAbsent(type, this::resolve);
    }

    private Optional<TypeConverter<?, ?>> resolve(Class<?> type) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            TypeConverter<?, ?> converter = converters.get(current);
            if (converter != null) {
                return Optional.of(converter);
            }
        }
        // breadth-first over the interface graph
        Deque<Class<?>> pending = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            for (Class<?> iface : current.getInterfaces()) {
                pending.add(iface);
            }
        }
        while (!pending.isEmpty()) {
            Class<?> iface = pending.poll();
            if (!seen.add(iface)) {
                continue;
            }
            TypeConverter<?, ?> converter = converters.get(iface);
            if (converter != null) {
                return Optional.of(converter);
            }
            for (Class<?> parent : iface.getInterfaces()) {
                pending.add(parent);
            }
        }
        return Optional.empty();
    }

    // Default converters

    private record IsoStringConverter<J>(Class<J> javaType) implements TypeConverter<J, String> {

        @Override
        public Class<String> storageType() {
            return String.class;
        }

        @Override
        public String toStorage(J javaValue) {
            return javaValue == null ? null : javaValue.toString();
        }
    }

    private static final class InstantEpochMillisConverter implements TypeConverter<Instant, Long> {
        @Override
        public Class<Instant> javaType() {
            return Instant.class;
        }

        @Override
        public Class<Long> storageType() {
            return Long.class;
        }

        @Override
        public Long toStorage(Instant javaValue) {
            return javaValue == null ? null : javaValue.toEpochMilli();
        }
    }

    private static final class DateEpochMillisConverter implements TypeConverter<Date, Long> {
        @Override
        public Class<Date> javaType() {
            return Date.class;
        }

        @Override
        public Class<Long> storageType() {
            return Long.class;
        }

        @Override
        public Long toStorage(Date javaValue) {
            return javaValue == null ? null : javaValue.getTime();
        }
    }

    private static final class SqlDateConverter implements TypeConverter<java.sql.Date, String> {
        @Override
        public Class<java.sql.Date> javaType() {
            return java.sql.Date.class;
        }

        @Override
        public Class<String> storageType() {
            return String.class;
        }

        @Override
        public String toStorage(java.sql.Date javaValue) {
            return javaValue == null ? null : javaValue.toLocalDate().toString();
        }
    }

    private static final class SqlTimestampConverter implements TypeConverter<java.sql.Timestamp, String> {
        @Override
        public Class<java.sql.Timestamp> javaType() {
            return java.sql.Timestamp.class;
        }

        @Override
        public Class<String> storageType() {
            return String.class;
        }

        @Override
        public String toStorage(java.sql.Timestamp javaValue) {
            return javaValue == null ? null : javaValue.toLocalDateTime().toString();
        }
    }
}
