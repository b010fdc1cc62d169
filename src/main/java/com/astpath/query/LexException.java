package com.astpath.query;

public class LexException extends PathException {

    private final String reason;

    public LexException(String reason, int position) {
        super(reason + " at position " + position, position);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
