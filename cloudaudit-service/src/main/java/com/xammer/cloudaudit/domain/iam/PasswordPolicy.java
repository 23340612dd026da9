package com.xammer.cloudaudit.domain.iam;

import lombok.Builder;
import lombok.Value;

/**
 * The account password policy. Fields left null by the provider stay null.
 */
@Value
@Builder
public class PasswordPolicy {
    String region;
    Integer minimumLength;
    boolean requireSymbols;
    boolean requireNumbers;
    boolean requireUppercase;
    boolean requireLowercase;
    boolean expirePasswords;
    Integer maxPasswordAge;
    Integer reusePrevention;
}
