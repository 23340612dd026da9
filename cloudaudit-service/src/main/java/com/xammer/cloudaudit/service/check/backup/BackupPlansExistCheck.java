package com.xammer.cloudaudit.service.check.backup;

import com.xammer.cloudaudit.domain.backup.BackupPlan;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.SecurityCheck;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.BackupCollector;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BackupPlansExistCheck implements SecurityCheck {

    @Override
    public String getCheckId() {
        return "backup_plans_exist";
    }

    @Override
    public String getService() {
        return BackupCollector.SERVICE;
    }

    @Override
    public List<CheckFinding> execute(AuditInventory inventory) {
        return inventory.get(BackupCollector.class)
                .map(backup -> {
                    List<BackupPlan> plans = backup.getBackupPlans();
                    if (plans.isEmpty()) {
                        return List.of(finding(CheckFinding.Status.FAIL)
                                .region(backup.getRegion())
                                .resourceId(backup.getAuditedAccount())
                                .statusExtended("No Backup Plan exists.")
                                .build());
                    }
                    BackupPlan first = plans.get(0);
                    return List.of(finding(CheckFinding.Status.PASS)
                            .region(first.getRegion())
                            .resourceId(first.getName())
                            .resourceArn(first.getArn())
                            .statusExtended("At least one backup plan exists: " + first.getName() + ".")
                            .build());
                })
                .orElse(List.of());
    }
}
