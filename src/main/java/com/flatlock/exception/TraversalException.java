package com.flatlock.exception;

/**
 * Transitive resolution was requested on a set that cannot traverse, or with invalid arguments.
 */
public class TraversalException extends FlatlockException {

    private static final long serialVersionUID = 1L;

    public TraversalException(String message) {
        super(message);
    }
}
