package com.xammer.cloudaudit.service.check.iam;

import com.xammer.cloudaudit.domain.iam.PasswordPolicy;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.SecurityCheck;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.IamCollector;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class IamPasswordPolicyMinimumLength14Check implements SecurityCheck {

    private static final int MINIMUM_LENGTH = 14;

    @Override
    public String getCheckId() {
        return "iam_password_policy_minimum_length_14";
    }

    @Override
    public String getService() {
        return IamCollector.SERVICE;
    }

    @Override
    public List<CheckFinding> execute(AuditInventory inventory) {
        return inventory.get(IamCollector.class)
                .map(iam -> {
                    PasswordPolicy policy = iam.getPasswordPolicy().orElse(null);
                    boolean compliant = policy != null && policy.getMinimumLength() != null
                            && policy.getMinimumLength() >= MINIMUM_LENGTH;
                    String detail = policy == null
                            ? "Password policy cannot be found."
                            : "IAM password policy " + (compliant ? "requires" : "does not require")
                                    + " minimum length of " + MINIMUM_LENGTH + " characters.";
                    return List.of(finding(compliant ? CheckFinding.Status.PASS : CheckFinding.Status.FAIL)
                            .region(iam.getRegion())
                            .resourceId(iam.getAuditedAccount())
                            .statusExtended(detail)
                            .build());
                })
                .orElse(List.of());
    }
}
