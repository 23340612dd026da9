package com.xammer.cloudaudit.domain.backup;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BackupReportPlan {
    String arn;
    String region;
    String name;
    Instant lastAttemptedExecution;
    Instant lastSuccessfulExecution;
}
