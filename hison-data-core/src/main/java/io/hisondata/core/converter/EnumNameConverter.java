package io.hisondata.core.converter;

final class EnumNameConverter implements TypeConverter<Enum<?>, String> {

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Class<Enum<?>> javaType() {
        return (Class) Enum.class;
    }

    @Override
    public Class<String> storageType() {
        return String.class;
    }

    @Override
    public String toStorage(Enum<?> javaValue) {
        return javaValue == null ? null : javaValue.name();
    }
}
