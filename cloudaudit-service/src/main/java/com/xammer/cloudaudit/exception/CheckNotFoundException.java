package com.xammer.cloudaudit.exception;

public class CheckNotFoundException extends RuntimeException {

    public CheckNotFoundException(String service) {
        super("No checks registered for service: " + service);
    }
}
