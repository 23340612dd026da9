package com.xammer.cloudaudit.service.check;

import com.xammer.cloudaudit.dto.CheckFinding;
import com.xammer.cloudaudit.service.collector.AuditInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the selected checks that have an implementation against the collected inventory.
 */
@Service
public class CheckExecutionService {

    private static final Logger logger = LoggerFactory.getLogger(CheckExecutionService.class);

    private final Map<String, SecurityCheck> checksById;

    public CheckExecutionService(List<SecurityCheck> checks) {
        this.checksById = checks.stream()
                .collect(Collectors.toMap(SecurityCheck::getCheckId, Function.identity()));
        logger.info("{} executable checks registered", checksById.size());
    }

    public List<CheckFinding> execute(Collection<String> checkIds, AuditInventory inventory) {
        List<CheckFinding> findings = new ArrayList<>();
        for (String checkId : checkIds) {
            SecurityCheck check = checksById.get(checkId);
            if (check == null) {
                logger.debug("Check {} has no implementation, skipping", checkId);
                continue;
            }
            if (!inventory.getServices().contains(check.getService())) {
                logger.debug("Check {} skipped, service {} was not collected", checkId, check.getService());
                continue;
            }
            try {
                List<CheckFinding> result = check.execute(inventory);
                logger.debug("Check {} produced {} findings", checkId, result.size());
                findings.addAll(result);
            } catch (RuntimeException e) {
                logger.error("Check {} failed -- {}: {}", checkId, e.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        return findings;
    }

    public boolean isExecutable(String checkId) {
        return checksById.containsKey(checkId);
    }
}
