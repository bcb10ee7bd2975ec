package com.flatlock.exception;

/**
 * A package.json could not be read or is not a JSON object.
 */
public class ManifestException extends FlatlockException {

    private static final long serialVersionUID = 1L;

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
