package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.config.AuditProperties;
import com.xammer.cloudaudit.domain.AssumedRoleDescriptor;
import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.AuditSession;
import com.xammer.cloudaudit.domain.TemporaryCredential;
import com.xammer.cloudaudit.exception.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;

import java.time.Clock;

/**
 * Owns the authenticated session of an audit run.
 */
@Service
public class AuditSessionManager {

    private static final Logger logger = LoggerFactory.getLogger(AuditSessionManager.class);

    private final BaseCredentialsProviderFactory credentialsProviderFactory;
    private final StsRoleAssumer roleAssumer;
    private final AuditProperties properties;
    private final ClientOverrideConfiguration overrideConfiguration;
    private final Clock clock;

    public AuditSessionManager(BaseCredentialsProviderFactory credentialsProviderFactory,
                               StsRoleAssumer roleAssumer,
                               AuditProperties properties,
                               ClientOverrideConfiguration overrideConfiguration,
                               Clock clock) {
        this.credentialsProviderFactory = credentialsProviderFactory;
        this.roleAssumer = roleAssumer;
        this.properties = properties;
        this.overrideConfiguration = overrideConfiguration;
        this.clock = clock;
    }

    /**
     * Builds the session for {@code identity}. Without credentials the local profile (or the
     * default chain) is adopted; with credentials the session wraps a provider that assumes
     * the role again whenever they expire.
     *
     * @throws AuthException if no usable identity can be resolved
     */
    public AuditSession establish(AuditIdentity identity) {
        if (identity.hasCredentials()) {
            return assumedRoleSession(identity);
        }

        logger.info("Creating session for not assumed identity ...");
        AwsCredentialsProvider provider = credentialsProviderFactory.forProfile(identity.getProfile());
        try {
            provider.resolveCredentials();
        } catch (RuntimeException e) {
            throw new AuthException(AuthException.Reason.NO_USABLE_IDENTITY,
                    "Unable to resolve credentials" + (identity.getProfile() != null
                            ? " for profile " + identity.getProfile() : "") + ": " + e.getMessage(), e);
        }
        return baseSession(identity, provider).assumedRole(false).build();
    }

    /**
     * Initial role assumption with the base credentials.
     *
     * @throws AuthException on any failure, throttling included
     */
    public TemporaryCredential assumeRole(AssumedRoleDescriptor role) {
        try {
            TemporaryCredential credential = roleAssumer.assume(role);
            logger.info("Assumed role {}, credentials expire at {}", role.getRoleArn(), credential.getExpiration());
            return credential;
        } catch (RuntimeException e) {
            throw new AuthException(AuthException.Reason.ASSUME_ROLE_FAILED,
                    "Unable to assume role " + role.getRoleArn() + ": " + e.getMessage(), e);
        }
    }

    private AuditSession assumedRoleSession(AuditIdentity identity) {
        if (identity.getAssumedRole() == null) {
            throw new AuthException(AuthException.Reason.NO_USABLE_IDENTITY,
                    "Assumed credentials were supplied without the role they belong to");
        }
        logger.info("Creating session for assumed role ...");
        RefreshableRoleCredentialsProvider provider = new RefreshableRoleCredentialsProvider(
                roleAssumer,
                identity.getAssumedRole(),
                identity.getCredentials(),
                properties.getAws().getRefreshWindow(),
                clock);
        return baseSession(identity, provider).assumedRole(true).build();
    }

    private AuditSession.AuditSessionBuilder baseSession(AuditIdentity identity, AwsCredentialsProvider provider) {
        return AuditSession.builder()
                .credentialsProvider(provider)
                .profileRegion(identity.getProfileRegion())
                .partition(identity.getPartition())
                .overrideConfiguration(overrideConfiguration);
    }
}
