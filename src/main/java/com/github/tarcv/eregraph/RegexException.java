package com.github.tarcv.eregraph;

public class RegexException extends RuntimeException {
    private final RegexErrorCode status;

    public RegexException(final RegexErrorCode status, final String message) {
        super(message);
        this.status = status;
    }

    public RegexException(final RegexErrorCode status, final String message, final Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public RegexErrorCode getErrorCode() {
        return status;
    }

    @Override
    public String toString() {
        return "RegexException{" +
                "status=" + status +
                ", message=" + getMessage() +
                '}';
    }
}
