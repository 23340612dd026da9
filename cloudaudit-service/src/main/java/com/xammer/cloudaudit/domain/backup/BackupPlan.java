package com.xammer.cloudaudit.domain.backup;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class BackupPlan {
    String arn;
    String id;
    String region;
    String name;
    String versionId;
    Instant lastExecutionDate;
    @Singular
    List<AdvancedSetting> advancedSettings;

    @Value
    public static class AdvancedSetting {
        String resourceType;
        Map<String, String> backupOptions;
    }
}
