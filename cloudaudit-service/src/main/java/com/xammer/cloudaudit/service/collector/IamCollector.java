package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.RegionalClient;
import com.xammer.cloudaudit.domain.iam.IamRole;
import com.xammer.cloudaudit.domain.iam.IamUser;
import com.xammer.cloudaudit.domain.iam.PasswordPolicy;
import com.xammer.cloudaudit.service.ResourceScopeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.GetAccountPasswordPolicyRequest;
import software.amazon.awssdk.services.iam.model.ListRolesRequest;
import software.amazon.awssdk.services.iam.model.ListRolesResponse;
import software.amazon.awssdk.services.iam.model.ListUsersRequest;
import software.amazon.awssdk.services.iam.model.ListUsersResponse;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.Role;
import software.amazon.awssdk.services.iam.model.User;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * IAM users, roles and the account password policy. IAM is global, so this collector
 * normally receives a single regional client.
 */
public final class IamCollector extends AwsServiceCollector<IamClient> {

    public static final String SERVICE = "iam";

    private static final Logger logger = LoggerFactory.getLogger(IamCollector.class);

    private final List<IamUser> users = Collections.synchronizedList(new ArrayList<>());
    private final List<IamRole> roles = Collections.synchronizedList(new ArrayList<>());
    private final AtomicReference<PasswordPolicy> passwordPolicy = new AtomicReference<>();

    public IamCollector(Map<String, RegionalClient<IamClient>> regionalClients,
                        AuditIdentity identity,
                        ResourceScopeFilter scopeFilter,
                        Executor executor) {
        super(SERVICE, regionalClients, identity, scopeFilter, executor);
        threadingCall("ListUsers", this::listUsers);
        threadingCall("ListRoles", this::listRoles);
        threadingCall("GetAccountPasswordPolicy", this::fetchPasswordPolicy);
        logger.info("IAM - Collected {} users, {} roles, password policy {}",
                users.size(), roles.size(), passwordPolicy.get() == null ? "not set" : "present");
    }

    private void listUsers(RegionalClient<IamClient> regionalClient) {
        logger.info("IAM - Listing Users...");
        for (ListUsersResponse page : regionalClient.getClient().listUsersPaginator(ListUsersRequest.builder().build())) {
            for (User user : page.users()) {
                if (isIncluded(user.arn())) {
                    users.add(IamUser.builder()
                            .arn(user.arn())
                            .name(user.userName())
                            .region(regionalClient.getRegion())
                            .createDate(user.createDate())
                            .passwordLastUsed(user.passwordLastUsed())
                            .build());
                }
            }
        }
    }

    private void listRoles(RegionalClient<IamClient> regionalClient) {
        logger.info("IAM - Listing Roles...");
        for (ListRolesResponse page : regionalClient.getClient().listRolesPaginator(ListRolesRequest.builder().build())) {
            for (Role role : page.roles()) {
                if (isIncluded(role.arn())) {
                    roles.add(IamRole.builder()
                            .arn(role.arn())
                            .name(role.roleName())
                            .region(regionalClient.getRegion())
                            .createDate(role.createDate())
                            .build());
                }
            }
        }
    }

    private void fetchPasswordPolicy(RegionalClient<IamClient> regionalClient) {
        logger.info("IAM - Getting Account Password Policy...");
        software.amazon.awssdk.services.iam.model.PasswordPolicy policy;
        try {
            policy = regionalClient.getClient()
                    .getAccountPasswordPolicy(GetAccountPasswordPolicyRequest.builder().build())
                    .passwordPolicy();
        } catch (NoSuchEntityException e) {
            logger.info("IAM - No custom password policy is set for account {}", getAuditedAccount());
            return;
        }
        passwordPolicy.set(PasswordPolicy.builder()
                .region(regionalClient.getRegion())
                .minimumLength(policy.minimumPasswordLength())
                .requireSymbols(Boolean.TRUE.equals(policy.requireSymbols()))
                .requireNumbers(Boolean.TRUE.equals(policy.requireNumbers()))
                .requireUppercase(Boolean.TRUE.equals(policy.requireUppercaseCharacters()))
                .requireLowercase(Boolean.TRUE.equals(policy.requireLowercaseCharacters()))
                .expirePasswords(Boolean.TRUE.equals(policy.expirePasswords()))
                .maxPasswordAge(policy.maxPasswordAge())
                .reusePrevention(policy.passwordReusePrevention())
                .build());
    }

    public List<IamUser> getUsers() {
        return List.copyOf(users);
    }

    public List<IamRole> getRoles() {
        return List.copyOf(roles);
    }

    public Optional<PasswordPolicy> getPasswordPolicy() {
        return Optional.ofNullable(passwordPolicy.get());
    }
}
