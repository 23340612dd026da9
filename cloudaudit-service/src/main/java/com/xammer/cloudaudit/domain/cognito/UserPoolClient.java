package com.xammer.cloudaudit.domain.cognito;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UserPoolClient {
    String id;
    String name;
    String arn;
    String region;
    boolean enableTokenRevocation;
}
