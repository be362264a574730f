package io.hisondata.core;

/**
 * A table or wrapper was offered as a value inside another container.
 */
public class NestedContainerException extends HisonDataException {

    public NestedContainerException(String message) {
        super(message);
    }
}
