package com.xammer.cloudaudit.service.check.backup;

import com.xammer.cloudaudit.domain.backup.BackupVault;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.SecurityCheck;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.BackupCollector;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Account-level: at least one vault must exist in some audited region.
 */
@Component
public class BackupVaultsExistCheck implements SecurityCheck {

    @Override
    public String getCheckId() {
        return "backup_vaults_exist";
    }

    @Override
    public String getService() {
        return BackupCollector.SERVICE;
    }

    @Override
    public List<CheckFinding> execute(AuditInventory inventory) {
        return inventory.get(BackupCollector.class)
                .map(backup -> {
                    List<BackupVault> vaults = backup.getBackupVaults();
                    if (vaults.isEmpty()) {
                        return List.of(finding(CheckFinding.Status.FAIL)
                                .region(backup.getRegion())
                                .resourceId(backup.getAuditedAccount())
                                .statusExtended("No Backup Vault exists.")
                                .build());
                    }
                    BackupVault first = vaults.get(0);
                    return List.of(finding(CheckFinding.Status.PASS)
                            .region(first.getRegion())
                            .resourceId(first.getName())
                            .resourceArn(first.getArn())
                            .statusExtended("At least one backup vault exists: " + first.getName() + ".")
                            .build());
                })
                .orElse(List.of());
    }
}
