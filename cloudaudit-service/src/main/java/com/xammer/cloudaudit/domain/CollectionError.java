package com.xammer.cloudaudit.domain;

import lombok.Value;

/**
 * A listing failure in one region, kept so the audit can report partial coverage.
 */
@Value
public class CollectionError {

    String service;
    String region;
    String operation;
    String errorType;
    String message;

    public static CollectionError of(String service, String region, String operation, Throwable error) {
        return new CollectionError(service, region, operation, error.getClass().getSimpleName(), error.getMessage());
    }
}
