package com.xammer.cloudaudit.service.check;

import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.collector.AuditInventory;

import java.util.List;

/**
 * A pass/fail evaluation over already-collected inventory.
 */
public interface SecurityCheck {

    String getCheckId();

    String getService();

    List<CheckFinding> execute(AuditInventory inventory);

    default CheckFinding.CheckFindingBuilder finding(CheckFinding.Status status) {
        return CheckFinding.builder()
                .checkId(getCheckId())
                .service(getService())
                .status(status);
    }
}
