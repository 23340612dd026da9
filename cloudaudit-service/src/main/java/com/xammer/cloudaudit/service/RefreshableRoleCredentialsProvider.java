package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.domain.AssumedRoleDescriptor;
import com.xammer.cloudaudit.domain.TemporaryCredential;
import com.xammer.cloudaudit.exception.CredentialRefreshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Assumed-role credentials that renew themselves. The SDK calls {@link #resolveCredentials()}
 * before every request; when the active credential has expired or is inside the refresh
 * window the role is assumed again. Only one exchange runs at a time, and callers that
 * arrive during it wait and reuse its result.
 */
public class RefreshableRoleCredentialsProvider implements AwsCredentialsProvider {

    private static final Logger logger = LoggerFactory.getLogger(RefreshableRoleCredentialsProvider.class);

    private final StsRoleAssumer roleAssumer;
    private final AssumedRoleDescriptor role;
    private final Duration refreshWindow;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile TemporaryCredential current;

    public RefreshableRoleCredentialsProvider(StsRoleAssumer roleAssumer,
                                              AssumedRoleDescriptor role,
                                              TemporaryCredential initial,
                                              Duration refreshWindow,
                                              Clock clock) {
        this.roleAssumer = roleAssumer;
        this.role = role;
        this.current = initial;
        this.refreshWindow = refreshWindow;
        this.clock = clock;
    }

    @Override
    public AwsCredentials resolveCredentials() {
        return currentValid().toAwsCredentials();
    }

    /**
     * Returns a credential that is valid now, refreshing it first if needed.
     *
     * @throws CredentialRefreshException if the exchange fails or returns an expired credential
     */
    public TemporaryCredential currentValid() {
        TemporaryCredential snapshot = current;
        if (!snapshot.expiresWithin(refreshWindow, clock.instant())) {
            return snapshot;
        }
        refreshLock.lock();
        try {
            snapshot = current;
            if (snapshot.expiresWithin(refreshWindow, clock.instant())) {
                current = refresh(snapshot);
            }
            return current;
        } finally {
            refreshLock.unlock();
        }
    }

    private TemporaryCredential refresh(TemporaryCredential replaced) {
        logger.info("Refreshing assumed credentials for role {}...", role.getRoleArn());
        TemporaryCredential fresh;
        try {
            fresh = roleAssumer.assume(role);
        } catch (RuntimeException e) {
            throw new CredentialRefreshException("Failed to refresh credentials for role " + role.getRoleArn()
                    + ": " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        if (fresh.getExpiration() == null || !fresh.isValidAt(now)) {
            throw new CredentialRefreshException("Refreshed credentials for role " + role.getRoleArn()
                    + " are already expired (expiration " + fresh.getExpiration() + ")");
        }
        if (!fresh.getExpiration().isAfter(replaced.getExpiration())) {
            throw new CredentialRefreshException("Refreshed credentials for role " + role.getRoleArn()
                    + " do not outlive the previous ones (" + fresh.getExpiration() + " <= "
                    + replaced.getExpiration() + ")");
        }
        logger.info("Refreshed credentials for role {}, new expiration {}", role.getRoleArn(), fresh.getExpiration());
        return fresh;
    }
}
