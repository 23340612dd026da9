package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.exception.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the audit once at startup. Authentication failures end the process with status 1.
 */
@Component
@ConditionalOnProperty(prefix = "audit", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class AuditRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AuditRunner.class);

    static final int FATAL_EXIT_STATUS = 1;

    private final AuditService auditService;
    private final ProcessTerminator terminator;

    public AuditRunner(AuditService auditService, ProcessTerminator terminator) {
        this.auditService = auditService;
        this.terminator = terminator;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            auditService.runAudit();
        } catch (AuthException e) {
            logger.error("{} -- {}", e.getClass().getSimpleName(), e.getMessage());
            terminator.terminate(FATAL_EXIT_STATUS);
        }
    }
}
