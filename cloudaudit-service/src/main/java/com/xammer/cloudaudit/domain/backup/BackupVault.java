package com.xammer.cloudaudit.domain.backup;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BackupVault {
    String arn;
    String name;
    String region;
    String encryptionKeyArn;
    long recoveryPoints;
    boolean locked;
    Long minRetentionDays;
    Long maxRetentionDays;

    public boolean isEncrypted() {
        return encryptionKeyArn != null && !encryptionKeyArn.isEmpty();
    }
}
