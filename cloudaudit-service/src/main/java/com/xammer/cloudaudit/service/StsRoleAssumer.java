package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.domain.AssumedRoleDescriptor;
import com.xammer.cloudaudit.domain.TemporaryCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

/**
 * Performs the security-token exchange for a role. Errors are not caught here: the caller
 * decides whether a failure is fatal (initial assumption) or belongs to the API call (refresh).
 */
@Service
public class StsRoleAssumer {

    private static final Logger logger = LoggerFactory.getLogger(StsRoleAssumer.class);

    private final StsClient stsClient;

    public StsRoleAssumer(StsClient stsClient) {
        this.stsClient = stsClient;
    }

    public TemporaryCredential assume(AssumedRoleDescriptor role) {
        AssumeRoleRequest.Builder request = AssumeRoleRequest.builder()
                .roleArn(role.getRoleArn())
                .roleSessionName(role.effectiveSessionName())
                .durationSeconds(role.getSessionDurationSeconds());
        if (role.hasExternalId()) {
            request.externalId(role.getExternalId());
        }

        logger.debug("Assuming role {} with session {}", role.getRoleArn(), role.effectiveSessionName());
        AssumeRoleResponse response = stsClient.assumeRole(request.build());
        Credentials credentials = response.credentials();
        return new TemporaryCredential(
                credentials.accessKeyId(),
                credentials.secretAccessKey(),
                credentials.sessionToken(),
                credentials.expiration());
    }
}
