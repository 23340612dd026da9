package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.RegionalClient;
import com.xammer.cloudaudit.domain.backup.BackupPlan;
import com.xammer.cloudaudit.domain.backup.BackupReportPlan;
import com.xammer.cloudaudit.domain.backup.BackupVault;
import com.xammer.cloudaudit.service.ResourceScopeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.backup.BackupClient;
import software.amazon.awssdk.services.backup.model.BackupPlansListMember;
import software.amazon.awssdk.services.backup.model.BackupVaultListMember;
import software.amazon.awssdk.services.backup.model.ListBackupPlansRequest;
import software.amazon.awssdk.services.backup.model.ListBackupPlansResponse;
import software.amazon.awssdk.services.backup.model.ListBackupVaultsRequest;
import software.amazon.awssdk.services.backup.model.ListBackupVaultsResponse;
import software.amazon.awssdk.services.backup.model.ListReportPlansRequest;
import software.amazon.awssdk.services.backup.model.ListReportPlansResponse;
import software.amazon.awssdk.services.backup.model.ReportPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * AWS Backup inventory: vaults, plans and report plans in every audited region.
 */
public final class BackupCollector extends AwsServiceCollector<BackupClient> {

    public static final String SERVICE = "backup";

    private static final Logger logger = LoggerFactory.getLogger(BackupCollector.class);

    private final List<BackupVault> backupVaults = Collections.synchronizedList(new ArrayList<>());
    private final List<BackupPlan> backupPlans = Collections.synchronizedList(new ArrayList<>());
    private final List<BackupReportPlan> backupReportPlans = Collections.synchronizedList(new ArrayList<>());

    public BackupCollector(Map<String, RegionalClient<BackupClient>> regionalClients,
                           AuditIdentity identity,
                           ResourceScopeFilter scopeFilter,
                           Executor executor) {
        super(SERVICE, regionalClients, identity, scopeFilter, executor);
        threadingCall("ListBackupVaults", this::listBackupVaults);
        threadingCall("ListBackupPlans", this::listBackupPlans);
        threadingCall("ListReportPlans", this::listBackupReportPlans);
        logger.info("Backup - Collected {} vaults, {} plans, {} report plans",
                backupVaults.size(), backupPlans.size(), backupReportPlans.size());
    }

    private void listBackupVaults(RegionalClient<BackupClient> regionalClient) {
        logger.info("Backup - Listing Backup Vaults in {}...", regionalClient.getRegion());
        for (ListBackupVaultsResponse page : regionalClient.getClient()
                .listBackupVaultsPaginator(ListBackupVaultsRequest.builder().build())) {
            for (BackupVaultListMember vault : page.backupVaultList()) {
                if (isIncluded(vault.backupVaultArn())) {
                    backupVaults.add(BackupVault.builder()
                            .arn(vault.backupVaultArn())
                            .name(vault.backupVaultName())
                            .region(regionalClient.getRegion())
                            .encryptionKeyArn(vault.encryptionKeyArn())
                            .recoveryPoints(vault.numberOfRecoveryPoints() == null ? 0 : vault.numberOfRecoveryPoints())
                            .locked(Boolean.TRUE.equals(vault.locked()))
                            .minRetentionDays(vault.minRetentionDays())
                            .maxRetentionDays(vault.maxRetentionDays())
                            .build());
                }
            }
        }
    }

    private void listBackupPlans(RegionalClient<BackupClient> regionalClient) {
        logger.info("Backup - Listing Backup Plans in {}...", regionalClient.getRegion());
        for (ListBackupPlansResponse page : regionalClient.getClient()
                .listBackupPlansPaginator(ListBackupPlansRequest.builder().build())) {
            for (BackupPlansListMember plan : page.backupPlansList()) {
                if (isIncluded(plan.backupPlanArn())) {
                    BackupPlan.BackupPlanBuilder builder = BackupPlan.builder()
                            .arn(plan.backupPlanArn())
                            .id(plan.backupPlanId())
                            .region(regionalClient.getRegion())
                            .name(plan.backupPlanName())
                            .versionId(plan.versionId())
                            .lastExecutionDate(plan.lastExecutionDate());
                    plan.advancedBackupSettings().forEach(setting -> builder.advancedSetting(
                            new BackupPlan.AdvancedSetting(setting.resourceType(), Map.copyOf(setting.backupOptions()))));
                    backupPlans.add(builder.build());
                }
            }
        }
    }

    // Paged on NextToken by hand; the SDK has no paginator for this operation.
    private void listBackupReportPlans(RegionalClient<BackupClient> regionalClient) {
        logger.info("Backup - Listing Backup Report Plans in {}...", regionalClient.getRegion());
        String nextToken = null;
        do {
            ListReportPlansResponse page = regionalClient.getClient().listReportPlans(
                    ListReportPlansRequest.builder().nextToken(nextToken).build());
            for (ReportPlan reportPlan : page.reportPlans()) {
                if (isIncluded(reportPlan.reportPlanArn())) {
                    backupReportPlans.add(BackupReportPlan.builder()
                            .arn(reportPlan.reportPlanArn())
                            .region(regionalClient.getRegion())
                            .name(reportPlan.reportPlanName())
                            .lastAttemptedExecution(reportPlan.lastAttemptedExecutionTime())
                            .lastSuccessfulExecution(reportPlan.lastSuccessfulExecutionTime())
                            .build());
                }
            }
            nextToken = page.nextToken();
        } while (nextToken != null && !nextToken.isEmpty());
    }

    public List<BackupVault> getBackupVaults() {
        return List.copyOf(backupVaults);
    }

    public List<BackupPlan> getBackupPlans() {
        return List.copyOf(backupPlans);
    }

    public List<BackupReportPlan> getBackupReportPlans() {
        return List.copyOf(backupReportPlans);
    }
}
