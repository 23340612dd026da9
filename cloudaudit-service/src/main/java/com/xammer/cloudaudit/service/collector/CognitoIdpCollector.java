package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.RegionalClient;
import com.xammer.cloudaudit.domain.cognito.UserPool;
import com.xammer.cloudaudit.domain.cognito.UserPoolClient;
import com.xammer.cloudaudit.service.ResourceScopeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.DescribeUserPoolClientRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolClientsRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolClientsResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolsRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolsResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolClientDescription;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolClientType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolDescriptionType;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Cognito user pools and their app clients, keyed by user pool ARN.
 */
public final class CognitoIdpCollector extends AwsServiceCollector<CognitoIdentityProviderClient> {

    /** Region catalog and ARN name of the service. */
    public static final String SERVICE = "cognito-idp";
    /** Name the checks are registered under. */
    public static final String AUDIT_SERVICE = "cognito";

    private static final Logger logger = LoggerFactory.getLogger(CognitoIdpCollector.class);
    private static final int MAX_USER_POOLS_PER_PAGE = 60;

    private final Map<String, UserPool> userPools = new ConcurrentHashMap<>();

    public CognitoIdpCollector(Map<String, RegionalClient<CognitoIdentityProviderClient>> regionalClients,
                               AuditIdentity identity,
                               ResourceScopeFilter scopeFilter,
                               Executor executor) {
        super(SERVICE, regionalClients, identity, scopeFilter, executor);
        threadingCall("ListUserPools", this::listUserPools);
        logger.info("Cognito - Collected {} user pools", userPools.size());
    }

    private void listUserPools(RegionalClient<CognitoIdentityProviderClient> regionalClient) {
        logger.info("Cognito - Listing User Pools in {}...", regionalClient.getRegion());
        CognitoIdentityProviderClient client = regionalClient.getClient();
        ListUserPoolsRequest request = ListUserPoolsRequest.builder().maxResults(MAX_USER_POOLS_PER_PAGE).build();
        for (ListUserPoolsResponse page : client.listUserPoolsPaginator(request)) {
            for (UserPoolDescriptionType pool : page.userPools()) {
                String arn = userPoolArn(regionalClient.getRegion(), pool.id());
                if (!isIncluded(arn)) {
                    continue;
                }
                UserPool.UserPoolBuilder builder = UserPool.builder()
                        .arn(arn)
                        .id(pool.id())
                        .name(pool.name())
                        .region(regionalClient.getRegion())
                        .status(pool.statusAsString())
                        .creationDate(pool.creationDate())
                        .lastModified(pool.lastModifiedDate());
                listUserPoolClients(client, regionalClient.getRegion(), pool.id(), arn, builder);
                userPools.put(arn, builder.build());
            }
        }
    }

    private void listUserPoolClients(CognitoIdentityProviderClient client, String region, String userPoolId,
                                     String userPoolArn, UserPool.UserPoolBuilder builder) {
        ListUserPoolClientsRequest request = ListUserPoolClientsRequest.builder().userPoolId(userPoolId).build();
        for (ListUserPoolClientsResponse page : client.listUserPoolClientsPaginator(request)) {
            for (UserPoolClientDescription description : page.userPoolClients()) {
                UserPoolClientType details = client.describeUserPoolClient(DescribeUserPoolClientRequest.builder()
                        .userPoolId(userPoolId)
                        .clientId(description.clientId())
                        .build()).userPoolClient();
                builder.userPoolClient(description.clientId(), UserPoolClient.builder()
                        .id(description.clientId())
                        .name(description.clientName())
                        .arn(userPoolArn + "/client/" + description.clientId())
                        .region(region)
                        .enableTokenRevocation(Boolean.TRUE.equals(details.enableTokenRevocation()))
                        .build());
            }
        }
    }

    private String userPoolArn(String region, String userPoolId) {
        return String.format("arn:%s:cognito-idp:%s:%s:userpool/%s",
                getAuditedPartition(), region, getAuditedAccount(), userPoolId);
    }

    public Map<String, UserPool> getUserPools() {
        return Map.copyOf(userPools);
    }
}
