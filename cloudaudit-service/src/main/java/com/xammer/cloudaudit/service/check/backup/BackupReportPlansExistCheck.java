package com.xammer.cloudaudit.service.check.backup;

import com.xammer.cloudaudit.domain.backup.BackupReportPlan;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.SecurityCheck;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.BackupCollector;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BackupReportPlansExistCheck implements SecurityCheck {

    @Override
    public String getCheckId() {
        return "backup_reportplans_exist";
    }

    @Override
    public String getService() {
        return BackupCollector.SERVICE;
    }

    @Override
    public List<CheckFinding> execute(AuditInventory inventory) {
        return inventory.get(BackupCollector.class)
                // Report plans only matter once something is being backed up.
                .filter(backup -> !backup.getBackupPlans().isEmpty())
                .map(backup -> {
                    List<BackupReportPlan> reportPlans = backup.getBackupReportPlans();
                    if (reportPlans.isEmpty()) {
                        return List.of(finding(CheckFinding.Status.FAIL)
                                .region(backup.getRegion())
                                .resourceId(backup.getAuditedAccount())
                                .statusExtended("No Backup Report Plan exists.")
                                .build());
                    }
                    BackupReportPlan first = reportPlans.get(0);
                    return List.of(finding(CheckFinding.Status.PASS)
                            .region(first.getRegion())
                            .resourceId(first.getName())
                            .resourceArn(first.getArn())
                            .statusExtended("At least one backup report plan exists: " + first.getName() + ".")
                            .build());
                })
                .orElse(List.of());
    }
}
