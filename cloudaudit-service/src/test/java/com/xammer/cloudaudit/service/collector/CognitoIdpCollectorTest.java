package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.RegionalClient;
import com.xammer.cloudaudit.domain.cognito.UserPool;
import com.xammer.cloudaudit.domain.cognito.UserPoolClient;
import com.xammer.cloudaudit.service.ResourceScopeFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.DescribeUserPoolClientRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.DescribeUserPoolClientResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolClientsRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolClientsResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolsRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.ListUserPoolsResponse;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolClientDescription;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolClientType;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolDescriptionType;
import software.amazon.awssdk.services.cognitoidentityprovider.paginators.ListUserPoolClientsIterable;
import software.amazon.awssdk.services.cognitoidentityprovider.paginators.ListUserPoolsIterable;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CognitoIdpCollectorTest {

    private static final String ACCOUNT = "123456789012";
    private static final String REGION = "eu-west-1";
    private static final String POOL_ID = "eu-west-1_abc";
    private static final String POOL_ARN = "arn:aws:cognito-idp:eu-west-1:" + ACCOUNT + ":userpool/" + POOL_ID;

    private ExecutorService executor;
    private CognitoIdentityProviderClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        client = mock(CognitoIdentityProviderClient.class);
        when(client.listUserPoolsPaginator(any(ListUserPoolsRequest.class)))
                .thenAnswer(inv -> new ListUserPoolsIterable(client, inv.getArgument(0)));
        when(client.listUserPools(any(ListUserPoolsRequest.class))).thenReturn(ListUserPoolsResponse.builder()
                .userPools(UserPoolDescriptionType.builder().id(POOL_ID).name("customers").status("Enabled").build())
                .build());
        when(client.listUserPoolClientsPaginator(any(ListUserPoolClientsRequest.class)))
                .thenAnswer(inv -> new ListUserPoolClientsIterable(client, inv.getArgument(0)));
        when(client.listUserPoolClients(any(ListUserPoolClientsRequest.class))).thenReturn(ListUserPoolClientsResponse.builder()
                .userPoolClients(
                        UserPoolClientDescription.builder().clientId("web").clientName("web-app").userPoolId(POOL_ID).build(),
                        UserPoolClientDescription.builder().clientId("cli").clientName("cli-app").userPoolId(POOL_ID).build())
                .build());
        stubClientDetails("web", true);
        stubClientDetails("cli", false);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void userPoolsAreKeyedByArnWithTheirClients() {
        CognitoIdpCollector collector = new CognitoIdpCollector(
                Map.of(REGION, new RegionalClient<>("cognito-idp", REGION, client)),
                AuditIdentity.builder().auditedAccount(ACCOUNT).build(), new ResourceScopeFilter(), executor);

        assertThat(collector.getUserPools()).containsOnlyKeys(POOL_ARN);
        UserPool pool = collector.getUserPools().get(POOL_ARN);
        assertThat(pool.getName()).isEqualTo("customers");
        assertThat(pool.getRegion()).isEqualTo(REGION);
        assertThat(pool.getUserPoolClients()).containsOnlyKeys("web", "cli");

        UserPoolClient web = pool.getUserPoolClients().get("web");
        assertThat(web.getArn()).isEqualTo(POOL_ARN + "/client/web");
        assertThat(web.isEnableTokenRevocation()).isTrue();
        assertThat(pool.getUserPoolClients().get("cli").isEnableTokenRevocation()).isFalse();
        assertThat(collector.getService()).isEqualTo("cognito-idp");
    }

    @Test
    void clientArnInScopeKeepsItsUserPool() {
        AuditIdentity identity = AuditIdentity.builder()
                .auditedAccount(ACCOUNT)
                .auditResource(POOL_ARN + "/client/web")
                .build();

        CognitoIdpCollector collector = new CognitoIdpCollector(
                Map.of(REGION, new RegionalClient<>("cognito-idp", REGION, client)),
                identity, new ResourceScopeFilter(), executor);

        assertThat(collector.getUserPools()).containsOnlyKeys(POOL_ARN);
    }

    @Test
    void poolOutsideScopeIsSkipped() {
        AuditIdentity identity = AuditIdentity.builder()
                .auditedAccount(ACCOUNT)
                .auditResource("arn:aws:cognito-idp:eu-west-1:" + ACCOUNT + ":userpool/eu-west-1_other")
                .build();

        CognitoIdpCollector collector = new CognitoIdpCollector(
                Map.of(REGION, new RegionalClient<>("cognito-idp", REGION, client)),
                identity, new ResourceScopeFilter(), executor);

        assertThat(collector.getUserPools()).isEmpty();
        assertThat(collector.getErrors()).isEmpty();
    }

    private void stubClientDetails(String clientId, boolean tokenRevocation) {
        when(client.describeUserPoolClient(argThat((DescribeUserPoolClientRequest request) ->
                request != null && clientId.equals(request.clientId()))))
                .thenReturn(DescribeUserPoolClientResponse.builder()
                        .userPoolClient(UserPoolClientType.builder()
                                .clientId(clientId)
                                .userPoolId(POOL_ID)
                                .enableTokenRevocation(tokenRevocation)
                                .build())
                        .build());
    }
}
