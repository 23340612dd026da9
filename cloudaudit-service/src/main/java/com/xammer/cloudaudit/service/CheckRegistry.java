package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.exception.CheckNotFoundException;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Catalog of check names per service.
 */
public interface CheckRegistry {

    String POLICY_TOKEN = "policy";
    String PASSWORD_POLICY = "password_policy";

    /**
     * @throws CheckNotFoundException when the service has no checks
     */
    List<String> listChecksForService(String service);

    SortedSet<String> checksForServices(Collection<String> services);

    /**
     * Checks of {@code services} whose name contains at least one of {@code subserviceTokens}.
     * The token {@code policy} never selects a {@code password_policy} check.
     */
    default List<String> selectChecks(Collection<String> services, Collection<String> subserviceTokens) {
        SortedSet<String> candidates = checksForServices(services);
        return candidates.stream()
                .filter(check -> subserviceTokens.stream().anyMatch(token -> matches(check, token)))
                .collect(Collectors.toList());
    }

    // Substring matching is loose; password_policy checks are the one known collision.
    private static boolean matches(String check, String token) {
        if (!check.contains(token)) {
            return false;
        }
        return !(POLICY_TOKEN.equals(token) && check.contains(PASSWORD_POLICY));
    }
}
