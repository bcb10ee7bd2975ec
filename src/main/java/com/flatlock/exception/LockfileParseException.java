package com.flatlock.exception;

import com.flatlock.model.LockfileFormat;

/**
 * Content is structurally invalid for the format it was parsed as.
 */
public class LockfileParseException extends FlatlockException {

    private static final long serialVersionUID = 1L;

    private final LockfileFormat format;
    private final int line;

    public LockfileParseException(LockfileFormat format, String message) {
        this(format, message, -1, null);
    }

    public LockfileParseException(LockfileFormat format, String message, Throwable cause) {
        this(format, message, -1, cause);
    }

    public LockfileParseException(LockfileFormat format, String message, int line) {
        this(format, message, line, null);
    }

    private LockfileParseException(LockfileFormat format, String message, int line, Throwable cause) {
        super("Failed to parse " + format + " lockfile: " + message + (line > 0 ? " (line " + line + ")" : ""),
                cause);
        this.format = format;
        this.line = line;
    }

    public LockfileFormat getFormat() {
        return format;
    }

    /**
     * @return the 1-based line of the failure, or -1 when unknown
     */
    public int getLine() {
        return line;
    }
}
