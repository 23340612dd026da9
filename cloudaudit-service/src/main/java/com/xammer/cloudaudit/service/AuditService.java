package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.config.AuditProperties;
import com.xammer.cloudaudit.domain.AssumedRoleDescriptor;
import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.AuditSession;
import com.xammer.cloudaudit.domain.ScopeDecision;
import com.xammer.cloudaudit.domain.TemporaryCredential;
import com.xammer.cloudaudit.dto.AuditReport;
import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.exception.AuthException;
import com.xammer.cloudaudit.service.check.CheckExecutionService;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import com.xammer.cloudaudit.service.collector.InventoryCollectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.sts.StsClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One audit run: authenticate, scope, collect, check.
 */
@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditProperties properties;
    private final AuditSessionManager sessionManager;
    private final ArnScopeResolver scopeResolver;
    private final CheckRegistry checkRegistry;
    private final RegionalClientFactory clientFactory;
    private final InventoryCollectionService inventoryCollectionService;
    private final CheckExecutionService checkExecutionService;

    public AuditService(AuditProperties properties,
                        AuditSessionManager sessionManager,
                        ArnScopeResolver scopeResolver,
                        CheckRegistry checkRegistry,
                        RegionalClientFactory clientFactory,
                        InventoryCollectionService inventoryCollectionService,
                        CheckExecutionService checkExecutionService) {
        this.properties = properties;
        this.sessionManager = sessionManager;
        this.scopeResolver = scopeResolver;
        this.checkRegistry = checkRegistry;
        this.clientFactory = clientFactory;
        this.inventoryCollectionService = inventoryCollectionService;
        this.checkExecutionService = checkExecutionService;
    }

    /**
     * @throws AuthException when the audit cannot authenticate; callers treat it as fatal
     */
    public AuditReport runAudit() {
        AuditIdentity identity = identityFromProperties();
        if (identity.getAssumedRole() != null) {
            TemporaryCredential credential = sessionManager.assumeRole(identity.getAssumedRole());
            identity = identity.toBuilder().credentials(credential).build();
        }

        AuditSession session = sessionManager.establish(identity);
        if (!StringUtils.hasText(identity.getAuditedAccount())) {
            identity = identity.toBuilder().auditedAccount(resolveAuditedAccount(session)).build();
        }
        logger.info("Auditing account {} in partition {}", identity.getAuditedAccount(), identity.getPartition());

        ScopeDecision scope = scopeResolver.resolve(identity.getAuditResources());
        if (scope.hasRegionScope()) {
            identity = identity.toBuilder().clearAuditedRegions().auditedRegions(scope.getRegions()).build();
        }

        List<String> services = servicesInScope(scope);
        List<String> checks = scope.isScoped()
                ? checkRegistry.selectChecks(scope.getServices(), scope.getSubserviceTokens())
                : new ArrayList<>(checkRegistry.checksForServices(services));
        logger.info("Collecting {} for {} checks", services, checks.size());

        AuditInventory inventory = inventoryCollectionService.collect(session, identity, services);
        List<CheckFinding> findings = checkExecutionService.execute(checks, inventory);

        AuditReport report = new AuditReport(identity.getAuditedAccount(), identity.getPartition(),
                services, checks, findings, inventory.getErrors());
        logger.info("Audit finished for account {}: {} PASS, {} FAIL, {} collection errors",
                report.getAuditedAccount(),
                report.countByStatus(CheckFinding.Status.PASS),
                report.countByStatus(CheckFinding.Status.FAIL),
                report.getCollectionErrors().size());
        return report;
    }

    AuditIdentity identityFromProperties() {
        AuditIdentity.AuditIdentityBuilder builder = AuditIdentity.builder()
                .auditedAccount(properties.getAccountId())
                .partition(properties.getPartition())
                .profile(StringUtils.hasText(properties.getProfile()) ? properties.getProfile() : null)
                .profileRegion(properties.getProfileRegion())
                .auditedRegions(properties.getRegions())
                .auditResources(properties.getResourceArns());

        AuditProperties.Role role = properties.getRole();
        if (role.isConfigured()) {
            int duration = role.getSessionDuration();
            if (duration < AssumedRoleDescriptor.MIN_SESSION_DURATION
                    || duration > AssumedRoleDescriptor.MAX_SESSION_DURATION) {
                throw new IllegalArgumentException("audit.role.session-duration must be between "
                        + AssumedRoleDescriptor.MIN_SESSION_DURATION + " and "
                        + AssumedRoleDescriptor.MAX_SESSION_DURATION + " seconds, got " + duration);
            }
            builder.assumedRole(AssumedRoleDescriptor.builder()
                    .roleArn(role.getArn())
                    .externalId(StringUtils.hasText(role.getExternalId()) ? role.getExternalId() : null)
                    .sessionDurationSeconds(duration)
                    .sessionName(StringUtils.hasText(role.getSessionName()) ? role.getSessionName() : null)
                    .build());
        }
        return builder.build();
    }

    private String resolveAuditedAccount(AuditSession session) {
        try (StsClient sts = clientFactory.buildClient(StsClient::builder, session, session.getProfileRegion())) {
            return sts.getCallerIdentity().account();
        } catch (RuntimeException e) {
            throw new AuthException(AuthException.Reason.NO_USABLE_IDENTITY,
                    "Unable to resolve the audited account: " + e.getMessage(), e);
        }
    }

    private List<String> servicesInScope(ScopeDecision scope) {
        Set<String> services = new TreeSet<>(properties.getServices().isEmpty()
                ? InventoryCollectionService.SUPPORTED_SERVICES
                : properties.getServices());
        if (scope.isScoped()) {
            services.retainAll(scope.getServices());
        }
        return new ArrayList<>(services);
    }
}
