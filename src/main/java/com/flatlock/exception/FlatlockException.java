package com.flatlock.exception;

/**
 * Base type for every failure raised while detecting, parsing or traversing a lockfile.
 */
public class FlatlockException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FlatlockException(String message) {
        super(message);
    }

    public FlatlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
