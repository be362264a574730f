package io.hisondata.core;

/**
 * Base type of every failure raised by tables, wrappers and the value codec.
 * <p>
 * All failures are reported synchronously at the call site; nothing in the library
 * retries or degrades silently.
 */
public class HisonDataException extends RuntimeException {

    public HisonDataException(Throwable cause) {
        super(cause);
    }

    public HisonDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public HisonDataException(String message) {
        super(message);
    }

}
