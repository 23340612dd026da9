package com.xammer.cloudaudit.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Who and what is being audited. Immutable; use {@link #toBuilder()} to derive a narrowed copy.
 */
@Value
@Builder(toBuilder = true)
public class AuditIdentity {

    String auditedAccount;
    @Builder.Default
    String partition = "aws";
    String profile;
    String profileRegion;
    @Singular
    List<String> auditedRegions;
    @Singular
    List<String> auditResources;
    AssumedRoleDescriptor assumedRole;
    TemporaryCredential credentials;

    public boolean hasCredentials() {
        return credentials != null;
    }

    public boolean hasAuditResources() {
        return !auditResources.isEmpty();
    }
}
