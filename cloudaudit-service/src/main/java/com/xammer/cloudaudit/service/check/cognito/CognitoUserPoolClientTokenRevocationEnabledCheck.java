package com.xammer.cloudaudit.service.check.cognito;

import com.xammer.cloudaudit.domain.cognito.UserPool;
import com.xammer.cloudaudit.domain.cognito.UserPoolClient;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.check.SecurityCheck;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.CognitoIdpCollector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CognitoUserPoolClientTokenRevocationEnabledCheck implements SecurityCheck {

    @Override
    public String getCheckId() {
        return "cognito_user_pool_client_token_revocation_enabled";
    }

    @Override
    public String getService() {
        return CognitoIdpCollector.AUDIT_SERVICE;
    }

    @Override
    public List<CheckFinding> execute(AuditInventory inventory) {
        List<CheckFinding> findings = new ArrayList<>();
        inventory.get(CognitoIdpCollector.class).ifPresent(cognito -> {
            for (UserPool pool : cognito.getUserPools().values()) {
                for (UserPoolClient client : pool.getUserPoolClients().values()) {
                    boolean enabled = client.isEnableTokenRevocation();
                    findings.add(finding(enabled ? CheckFinding.Status.PASS : CheckFinding.Status.FAIL)
                            .region(client.getRegion())
                            .resourceId(client.getId())
                            .resourceArn(client.getArn())
                            .statusExtended("User pool client " + client.getName() + " in user pool " + pool.getName()
                                    + (enabled ? " has token revocation enabled." : " has token revocation disabled."))
                            .build());
                }
            }
        });
        return findings;
    }
}
