package com.xammer.cloudaudit.exception;

/**
 * Unrecoverable setup failure. The audit cannot start without a usable identity.
 */
public class AuthException extends RuntimeException {

    public enum Reason {
        NO_USABLE_IDENTITY,
        ASSUME_ROLE_FAILED
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
