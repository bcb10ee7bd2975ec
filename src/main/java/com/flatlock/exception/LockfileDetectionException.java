package com.flatlock.exception;

/**
 * Lockfile content (or, for blank content, the path hint) matches no known format.
 */
public class LockfileDetectionException extends FlatlockException {

    private static final long serialVersionUID = 1L;

    public LockfileDetectionException(String message) {
        super(message);
    }
}
