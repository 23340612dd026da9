package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.domain.ScopeDecision;
import com.xammer.cloudaudit.exception.CheckNotFoundException;
import com.xammer.cloudaudit.util.Arn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Narrows an audit to the services, subservices and regions named by a list of resource ARNs.
 */
@Service
public class ArnScopeResolver {

    private static final Logger logger = LoggerFactory.getLogger(ArnScopeResolver.class);

    /** ARN service tokens with no checks behind them. */
    private static final Set<String> SERVICES_WITHOUT_CHECKS = Set.of("waf", "wafv2");

    private static final Map<String, String> SERVICE_ALIASES = Map.of(
            "lambda", "awslambda",
            "elasticloadbalancing", "elb",
            "logs", "cloudwatch",
            "cognito-idp", "cognito");

    /** Services checked as a whole; their resource path carries no useful subservice. */
    private static final Set<String> SERVICES_WITHOUT_SUBSERVICES = Set.of("guardduty", "kms", "s3", "elb");

    private static final Map<String, Map<String, String>> SUBSERVICE_ALIASES = Map.of(
            "ec2", Map.of(
                    "security_group", "securitygroup",
                    "network_acl", "networkacl",
                    "image", "ami"),
            "rds", Map.of(
                    "cluster_snapshot", "snapshot"));

    private final CheckRegistry checkRegistry;

    public ArnScopeResolver(CheckRegistry checkRegistry) {
        this.checkRegistry = checkRegistry;
    }

    /**
     * @throws com.xammer.cloudaudit.exception.MalformedArnException if any ARN has fewer than six fields
     */
    public ScopeDecision resolve(List<String> resourceArns) {
        if (resourceArns == null || resourceArns.isEmpty()) {
            return ScopeDecision.unscoped();
        }

        Set<String> services = new HashSet<>();
        Set<String> subserviceTokens = new HashSet<>();
        List<String> regions = new ArrayList<>();

        for (String value : resourceArns) {
            Arn arn = Arn.parse(value);
            if (arn.hasRegion() && !regions.contains(arn.getRegion())) {
                regions.add(arn.getRegion());
            }

            if (SERVICES_WITHOUT_CHECKS.contains(arn.getService())) {
                continue;
            }
            String service = normalizeService(arn.getService());
            if (hasChecks(service)) {
                services.add(service);
            }
            subserviceTokens.add(subserviceToken(service, arn));
        }

        ScopeDecision decision = ScopeDecision.of(services, subserviceTokens, regions);
        logger.info("Resource scope: services={}, subservices={}, regions={}",
                decision.getServices(), decision.getSubserviceTokens(),
                decision.hasRegionScope() ? decision.getRegions() : "all");
        return decision;
    }

    static String normalizeService(String arnService) {
        return SERVICE_ALIASES.getOrDefault(arnService, arnService);
    }

    static String subserviceToken(String service, Arn arn) {
        if (SERVICES_WITHOUT_SUBSERVICES.contains(service)) {
            return service;
        }
        String token = arn.getResourceType().replace('-', '_');
        return SUBSERVICE_ALIASES.getOrDefault(service, Map.of()).getOrDefault(token, token);
    }

    private boolean hasChecks(String service) {
        try {
            checkRegistry.listChecksForService(service);
            return true;
        } catch (CheckNotFoundException e) {
            logger.debug("Service {} has no checks and is left out of the scope", service);
            return false;
        }
    }
}
