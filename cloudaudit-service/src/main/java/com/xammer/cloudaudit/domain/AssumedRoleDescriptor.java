package com.xammer.cloudaudit.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Describes the role an audit runs under when it is entered via role assumption.
 */
@Value
@Builder
public class AssumedRoleDescriptor {

    public static final String EXTERNAL_ID_SESSION_NAME = "CloudAuditAssessmentSession";
    public static final String DEFAULT_SESSION_NAME = "CloudAuditProAssessmentSession";

    public static final int MIN_SESSION_DURATION = 900;
    public static final int MAX_SESSION_DURATION = 43200;

    String roleArn;
    String externalId;
    @Builder.Default
    int sessionDurationSeconds = 3600;
    String sessionName;

    public boolean hasExternalId() {
        return externalId != null && !externalId.isEmpty();
    }

    /**
     * The configured session name, or the convention for the calling trust boundary:
     * callers that present an external id use a different session name from those that don't.
     */
    public String effectiveSessionName() {
        if (sessionName != null && !sessionName.isEmpty()) {
            return sessionName;
        }
        return hasExternalId() ? EXTERNAL_ID_SESSION_NAME : DEFAULT_SESSION_NAME;
    }
}
