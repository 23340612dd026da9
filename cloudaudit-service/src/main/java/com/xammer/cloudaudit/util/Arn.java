package com.xammer.cloudaudit.util;

import com.xammer.cloudaudit.exception.MalformedArnException;

/**
 * Positional view over a colon-delimited resource identifier:
 * {@code arn:partition:service:region:account:resource}.
 */
public final class Arn {

    private static final int MIN_FIELDS = 6;

    private final String value;
    private final String partition;
    private final String service;
    private final String region;
    private final String account;
    private final String resource;

    private Arn(String value, String[] fields) {
        this.value = value;
        this.partition = fields[1];
        this.service = fields[2];
        this.region = fields[3];
        this.account = fields[4];
        this.resource = fields[5];
    }

    public static Arn parse(String value) {
        if (value == null) {
            throw new MalformedArnException("null");
        }
        String[] fields = value.split(":", -1);
        if (fields.length < MIN_FIELDS) {
            throw new MalformedArnException(value);
        }
        return new Arn(value, fields);
    }

    public String getPartition() {
        return partition;
    }

    public String getService() {
        return service;
    }

    public String getRegion() {
        return region;
    }

    public String getAccount() {
        return account;
    }

    /**
     * The resource field only, without any further colon-delimited qualifiers.
     */
    public String getResource() {
        return resource;
    }

    /**
     * First slash-delimited segment of the resource, e.g. {@code security-group} for
     * {@code security-group/sg-123}.
     */
    public String getResourceType() {
        int slash = resource.indexOf('/');
        return slash < 0 ? resource : resource.substring(0, slash);
    }

    public boolean hasRegion() {
        return !region.isEmpty();
    }

    @Override
    public String toString() {
        return value;
    }
}
