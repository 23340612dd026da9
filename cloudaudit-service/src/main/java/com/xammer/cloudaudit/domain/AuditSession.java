package com.xammer.cloudaudit.domain;

import lombok.Builder;
import lombok.Value;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;

/**
 * An authenticated session. Every client built for the audit takes its credentials from here.
 */
@Value
@Builder
public class AuditSession {

    AwsCredentialsProvider credentialsProvider;
    String profileRegion;
    String partition;
    ClientOverrideConfiguration overrideConfiguration;
    boolean assumedRole;
}
