package com.xammer.cloudaudit.exception;

/**
 * Raised to the in-flight API call when assumed-role credentials could not be renewed.
 */
public class CredentialRefreshException extends RuntimeException {

    public CredentialRefreshException(String message) {
        super(message);
    }

    public CredentialRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
