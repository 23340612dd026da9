package com.xammer.cloudaudit.domain;

import lombok.Value;
import software.amazon.awssdk.core.SdkClient;

/**
 * A provider client bound to exactly one region of one service.
 */
@Value
public class RegionalClient<C extends SdkClient> implements AutoCloseable {

    String service;
    String region;
    C client;

    @Override
    public void close() {
        client.close();
    }
}
