package com.xammer.cloudaudit.domain.cognito;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A Cognito user pool with its app clients keyed by client id.
 */
@Value
@Builder
public class UserPool {
    String arn;
    String id;
    String name;
    String region;
    String status;
    Instant creationDate;
    Instant lastModified;
    @Singular
    Map<String, UserPoolClient> userPoolClients;
}
