package io.hisondata.kernel;

/**
 * Implemented by tables and wrappers. Instances are never accepted as values inside
 * another container, at any depth.
 */
public interface DataContainer {

    /**
     * Plain snapshot of the container contents, safe to hand to a serializer.
     */
    Object getObject();

    /**
     * JSON encoding of the container as sent over the wire.
     */
    String getSerialized();
}
