package io.hisondata.kernel;

/**
 * Marker for "no value supplied", distinct from {@code null}.
 * <p>
 * Tables and wrappers reject it wherever a concrete value is required.
 */
public enum Undefined {
    VALUE;

    @Override
    public String toString() {
        return "undefined";
    }
}
