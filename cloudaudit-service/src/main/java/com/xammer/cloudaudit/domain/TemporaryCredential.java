package com.xammer.cloudaudit.domain;

import lombok.ToString;
import lombok.Value;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;

import java.time.Duration;
import java.time.Instant;

/**
 * Short-lived credentials returned by the token exchange.
 */
@Value
@ToString(onlyExplicitlyIncluded = true)
public class TemporaryCredential {

    @ToString.Include
    String accessKeyId;
    String secretAccessKey;
    String sessionToken;
    @ToString.Include
    Instant expiration;

    public boolean isValidAt(Instant now) {
        return expiration.isAfter(now);
    }

    /**
     * True when the credential has expired, or will within {@code window} of {@code now}.
     */
    public boolean expiresWithin(Duration window, Instant now) {
        return !expiration.isAfter(now.plus(window));
    }

    public AwsSessionCredentials toAwsCredentials() {
        return AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken);
    }
}
