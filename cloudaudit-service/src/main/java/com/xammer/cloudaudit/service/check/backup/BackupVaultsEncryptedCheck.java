package com.xammer.cloudaudit.service.check.backup;

import com.xammer.cloudaudit.domain.backup.BackupVault;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.SecurityCheck;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.BackupCollector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class BackupVaultsEncryptedCheck implements SecurityCheck {

    @Override
    public String getCheckId() {
        return "backup_vaults_encrypted";
    }

    @Override
    public String getService() {
        return BackupCollector.SERVICE;
    }

    @Override
    public List<CheckFinding> execute(AuditInventory inventory) {
        List<CheckFinding> findings = new ArrayList<>();
        inventory.get(BackupCollector.class).ifPresent(backup -> {
            for (BackupVault vault : backup.getBackupVaults()) {
                boolean encrypted = vault.isEncrypted();
                findings.add(finding(encrypted ? CheckFinding.Status.PASS : CheckFinding.Status.FAIL)
                        .region(vault.getRegion())
                        .resourceId(vault.getName())
                        .resourceArn(vault.getArn())
                        .statusExtended("Backup Vault " + vault.getName()
                                + (encrypted ? " is encrypted." : " is not encrypted."))
                        .build());
            }
        });
        return findings;
    }
}
