package com.xammer.cloudaudit.service;

import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Decides whether a listed resource belongs to the caller's ARN scope.
 */
@Component
public class ResourceScopeFilter {

    private static final String S3_BUCKET_ARN = ":s3:::";

    /**
     * A candidate is in scope when a filter entry is the candidate itself, a child of it
     * (e.g. a user pool client scopes its user pool), or, for a bare bucket name, the
     * bucket's ARN.
     */
    public boolean isIncluded(String candidateArn, Collection<String> filterArns) {
        if (candidateArn == null || candidateArn.isEmpty()) {
            return false;
        }
        String childPrefix = candidateArn + "/";
        for (String filter : filterArns) {
            if (filter.equals(candidateArn) || filter.startsWith(childPrefix)) {
                return true;
            }
            if (!candidateArn.startsWith("arn:") && filter.endsWith(S3_BUCKET_ARN + candidateArn)) {
                return true;
            }
        }
        return false;
    }
}
