package com.xammer.cloudaudit.domain;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Services, subservice tokens and regions derived from a list of resource ARNs.
 * An unscoped decision narrows nothing.
 */
@Value
public class ScopeDecision {

    private static final ScopeDecision UNSCOPED = new ScopeDecision(false, Set.of(), Set.of(), List.of());

    boolean scoped;
    Set<String> services;
    Set<String> subserviceTokens;
    List<String> regions;

    public static ScopeDecision unscoped() {
        return UNSCOPED;
    }

    public static ScopeDecision of(Set<String> services, Set<String> subserviceTokens, List<String> regions) {
        return new ScopeDecision(true,
                Collections.unmodifiableSet(new TreeSet<>(services)),
                Collections.unmodifiableSet(new TreeSet<>(subserviceTokens)),
                List.copyOf(new LinkedHashSet<>(regions)));
    }

    /**
     * False when no ARN carried a region, meaning every region stays in scope.
     */
    public boolean hasRegionScope() {
        return scoped && !regions.isEmpty();
    }
}
