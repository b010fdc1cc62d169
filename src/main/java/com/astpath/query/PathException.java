package com.astpath.query;

/**
 * Base of all failures raised while lexing, parsing or evaluating a path.
 */
public abstract class PathException extends RuntimeException {

    private final int position;

    protected PathException(String message, int position) {
        super(message);
        this.position = position;
    }

    protected PathException(String message, int position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /** Offset into the path string the failure refers to, or -1 when it has none. */
    public int getPosition() {
        return position;
    }
}
