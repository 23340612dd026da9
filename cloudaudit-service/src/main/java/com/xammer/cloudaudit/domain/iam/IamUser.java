package com.xammer.cloudaudit.domain.iam;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class IamUser {
    String arn;
    String name;
    String region;
    Instant createDate;
    Instant passwordLastUsed;
}
