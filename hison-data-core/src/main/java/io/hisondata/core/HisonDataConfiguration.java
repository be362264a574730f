package io.hisondata.core;

import io.hisondata.codec.JacksonValueCodec;
import io.hisondata.codec.ValueCodec;
import io.hisondata.core.converter.ValueConverter;

/**
 * Immutable configuration for tables and wrappers.
 * <p>
 * Use the builder to create custom configurations:
 * <pre>
 * HisonDataConfiguration config = HisonDataConfiguration.builder()
 *     .valueConverter(ValueConverterRegistry.withDefaults())
 *     .typeCheckMode(TypeCheckMode.DECLARED_KIND)
 *     .build();
 * </pre>
 *
 * @see HisonData#configure(HisonDataConfiguration)
 */
public final class HisonDataConfiguration {
    private static final HisonDataConfiguration DEFAULTS = builder().build();

    // Hook for opaque values met while copying
    private final ValueConverter valueConverter;

    private final TypeCheckMode typeCheckMode;

    // Canonical encoding and serialization
    private final ValueCodec valueCodec;

    private HisonDataConfiguration(Builder builder) {
        this.valueConverter = builder.valueConverter != null
                ? builder.valueConverter
                : ValueConverter.identity();
        this.typeCheckMode = builder.typeCheckMode != null
                ? builder.typeCheckMode
                : TypeCheckMode.BACKWARD_SCAN;
        this.valueCodec = builder.valueCodec != null
                ? builder.valueCodec
                : JacksonValueCodec.shared();
    }

    /**
     * Create a new builder for HisonDataConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used when nothing else is installed: pass-through converter,
     * backward-scan type checks, shared Jackson codec.
     */
    public static HisonDataConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the hook applied to opaque values when they are copied into a table.
     *
     * @return the value converter, never {@code null}
     */
    public ValueConverter valueConverter() {
        return valueConverter;
    }

    /**
     * Get the type-consistency strategy.
     *
     * @return the mode (default: BACKWARD_SCAN)
     */
    public TypeCheckMode typeCheckMode() {
        return typeCheckMode;
    }

    public ValueCodec valueCodec() {
        return valueCodec;
    }

    /**
     * Copy this configuration into a builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .valueConverter(valueConverter)
                .typeCheckMode(typeCheckMode)
                .valueCodec(valueCodec);
    }

    @Override
    public String toString() {
        return "HisonDataConfiguration{typeCheckMode=" + typeCheckMode
                + ", valueConverter=" + valueConverter.getClass().getSimpleName()
                + ", valueCodec=" + valueCodec.getClass().getSimpleName() + '}';
    }

    /**
     * Builder for HisonDataConfiguration.
     */
    public static class Builder {
        private ValueConverter valueConverter;
        private TypeCheckMode typeCheckMode;
        private ValueCodec valueCodec;

        private Builder() {
        }

        /**
         * Set the hook for values that are neither scalars, lists nor maps.
         *
         * @param valueConverter the converter, or {@code null} for pass-through
         * @return this builder for method chaining
         */
        public Builder valueConverter(ValueConverter valueConverter) {
            this.valueConverter = valueConverter;
            return this;
        }

        /**
         * Set the type-consistency strategy.
         *
         * @param typeCheckMode the mode, or {@code null} for BACKWARD_SCAN
         * @return this builder for method chaining
         */
        public Builder typeCheckMode(TypeCheckMode typeCheckMode) {
            this.typeCheckMode = typeCheckMode;
            return this;
        }

        public Builder valueCodec(ValueCodec valueCodec) {
            this.valueCodec = valueCodec;
            return this;
        }

        /**
         * Build the immutable HisonDataConfiguration.
         *
         * @return a new HisonDataConfiguration instance
         */
        public HisonDataConfiguration build() {
            return new HisonDataConfiguration(this);
        }
    }
}
