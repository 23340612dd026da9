package com.xammer.cloudaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.cloudaudit.config.AuditProperties;
import com.xammer.cloudaudit.exception.CheckNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathCheckRegistryTest {

    private final ClasspathCheckRegistry registry = new ClasspathCheckRegistry(Map.of(
            "iam", List.of(
                    "iam_password_policy_minimum_length_14",
                    "iam_policy_no_administrative_privileges",
                    "iam_user_mfa_enabled_console_access"),
            "ec2", List.of(
                    "ec2_securitygroup_default_restrict_traffic",
                    "ec2_instance_public_ip"),
            "empty", List.of()));

    @Test
    void listsChecksOfAService() {
        assertThat(registry.listChecksForService("ec2")).hasSize(2);
    }

    @Test
    void unknownOrEmptyServiceIsNotFound() {
        assertThatThrownBy(() -> registry.listChecksForService("shield")).isInstanceOf(CheckNotFoundException.class);
        assertThatThrownBy(() -> registry.listChecksForService("empty")).isInstanceOf(CheckNotFoundException.class);
    }

    @Test
    void checksForServicesIsSortedUnion() {
        assertThat(registry.checksForServices(Set.of("ec2", "iam", "shield")))
                .containsExactly(
                        "ec2_instance_public_ip",
                        "ec2_securitygroup_default_restrict_traffic",
                        "iam_password_policy_minimum_length_14",
                        "iam_policy_no_administrative_privileges",
                        "iam_user_mfa_enabled_console_access");
    }

    @Test
    void selectsChecksContainingAToken() {
        assertThat(registry.selectChecks(Set.of("ec2", "iam"), Set.of("securitygroup", "user")))
                .containsExactly("ec2_securitygroup_default_restrict_traffic", "iam_user_mfa_enabled_console_access");
    }

    @Test
    void policyTokenDoesNotSelectPasswordPolicyChecks() {
        assertThat(registry.selectChecks(Set.of("iam"), Set.of("policy")))
                .containsExactly("iam_policy_no_administrative_privileges");
    }

    @Test
    void passwordPolicyStillSelectedByAnotherToken() {
        assertThat(registry.selectChecks(Set.of("iam"), Set.of("policy", "minimum_length")))
                .containsExactly("iam_password_policy_minimum_length_14", "iam_policy_no_administrative_privileges");
    }

    @Test
    void packagedCatalogCoversCollectedServices() {
        ClasspathCheckRegistry packaged = new ClasspathCheckRegistry(new ObjectMapper(), new AuditProperties());

        assertThat(packaged.listChecksForService("backup"))
                .contains("backup_vaults_encrypted", "backup_plans_exist", "backup_reportplans_exist");
        assertThat(packaged.listChecksForService("cognito"))
                .contains("cognito_user_pool_client_token_revocation_enabled");
        assertThat(packaged.listChecksForService("iam")).contains("iam_password_policy_minimum_length_14");
    }
}
