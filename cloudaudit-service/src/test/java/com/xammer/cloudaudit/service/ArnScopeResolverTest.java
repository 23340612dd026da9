package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.domain.ScopeDecision;
import com.xammer.cloudaudit.exception.MalformedArnException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArnScopeResolverTest {

    private static final String ACCOUNT = "111111111111";

    private ArnScopeResolver resolver;

    @BeforeEach
    void setUp() {
        CheckRegistry registry = new ClasspathCheckRegistry(Map.of(
                "awslambda", List.of("awslambda_function_url_public"),
                "ec2", List.of("ec2_securitygroup_default_restrict_traffic", "ec2_networkacl_allow_ingress_any_port", "ec2_ami_public"),
                "rds", List.of("rds_snapshots_public_access"),
                "s3", List.of("s3_bucket_public_access"),
                "elb", List.of("elb_logging_enabled"),
                "cloudwatch", List.of("cloudwatch_log_group_kms_encryption_enabled"),
                "iam", List.of("iam_password_policy_symbol", "iam_policy_no_administrative_privileges")));
        resolver = new ArnScopeResolver(registry);
    }

    @Test
    void emptyInputIsUnscoped() {
        ScopeDecision decision = resolver.resolve(List.of());

        assertThat(decision.isScoped()).isFalse();
        assertThat(decision.hasRegionScope()).isFalse();
        assertThat(resolver.resolve(null)).isEqualTo(ScopeDecision.unscoped());
    }

    @Test
    void wafResourcesContributeNoService() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:lambda:us-east-1:" + ACCOUNT + ":function/my-fn",
                "arn:aws:waf:us-east-1:" + ACCOUNT + ":webacl/abc"));

        assertThat(decision.getServices()).containsExactly("awslambda");
        assertThat(decision.getSubserviceTokens()).containsExactly("function");
        assertThat(decision.getRegions()).containsExactly("us-east-1");
    }

    @Test
    void ec2SubservicesAreAliased() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:ec2:us-east-1:" + ACCOUNT + ":security-group/sg-123",
                "arn:aws:ec2:us-east-1:" + ACCOUNT + ":network-acl/acl-1",
                "arn:aws:ec2:us-east-1::image/ami-1"));

        assertThat(decision.getServices()).containsExactly("ec2");
        assertThat(decision.getSubserviceTokens()).containsExactlyInAnyOrder("securitygroup", "networkacl", "ami");
    }

    @Test
    void rdsClusterSnapshotBecomesSnapshot() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:rds:eu-west-1:" + ACCOUNT + ":cluster-snapshot/snap-1"));

        assertThat(decision.getSubserviceTokens()).containsExactly("snapshot");
    }

    @Test
    void aliasesApplyOnlyToTheirOwnService() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:iam::" + ACCOUNT + ":image/not-ec2"));

        assertThat(decision.getSubserviceTokens()).containsExactly("image");
    }

    @Test
    void flatServicesUseServiceAsToken() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:s3:::my-bucket",
                "arn:aws:elasticloadbalancing:us-east-1:" + ACCOUNT + ":loadbalancer/my-lb",
                "arn:aws:logs:us-east-1:" + ACCOUNT + ":log-group:/aws/lambda/x"));

        assertThat(decision.getServices()).containsExactlyInAnyOrder("s3", "elb", "cloudwatch");
        assertThat(decision.getSubserviceTokens()).containsExactlyInAnyOrder("s3", "elb", "log_group");
    }

    @Test
    void serviceWithoutChecksKeepsItsSubserviceToken() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:dynamodb:us-east-1:" + ACCOUNT + ":table/orders"));

        assertThat(decision.isScoped()).isTrue();
        assertThat(decision.getServices()).isEmpty();
        assertThat(decision.getSubserviceTokens()).containsExactly("table");
    }

    @Test
    void regionsKeepFirstAppearanceOrderAndSkipGlobalResources() {
        ScopeDecision decision = resolver.resolve(List.of(
                "arn:aws:ec2:eu-west-1:" + ACCOUNT + ":instance/i-1",
                "arn:aws:iam::" + ACCOUNT + ":user/alice",
                "arn:aws:ec2:us-east-1:" + ACCOUNT + ":instance/i-2",
                "arn:aws:ec2:eu-west-1:" + ACCOUNT + ":instance/i-3"));

        assertThat(decision.getRegions()).containsExactly("eu-west-1", "us-east-1");
        assertThat(decision.hasRegionScope()).isTrue();
    }

    @Test
    void onlyGlobalResourcesLeaveRegionsUnscoped() {
        ScopeDecision decision = resolver.resolve(List.of("arn:aws:iam::" + ACCOUNT + ":user/alice"));

        assertThat(decision.isScoped()).isTrue();
        assertThat(decision.getRegions()).isEmpty();
        assertThat(decision.hasRegionScope()).isFalse();
    }

    @Test
    void serviceAndTokenSetsIgnoreInputOrder() {
        List<String> arns = new ArrayList<>(List.of(
                "arn:aws:ec2:us-east-1:" + ACCOUNT + ":security-group/sg-1",
                "arn:aws:iam::" + ACCOUNT + ":policy/p1",
                "arn:aws:lambda:eu-west-1:" + ACCOUNT + ":function/f1"));
        ScopeDecision forward = resolver.resolve(arns);
        Collections.reverse(arns);
        ScopeDecision reversed = resolver.resolve(arns);

        assertThat(reversed.getServices()).isEqualTo(forward.getServices());
        assertThat(reversed.getSubserviceTokens()).isEqualTo(forward.getSubserviceTokens());
        assertThat(forward.getRegions()).containsExactly("us-east-1", "eu-west-1");
        assertThat(reversed.getRegions()).containsExactly("eu-west-1", "us-east-1");
    }

    @Test
    void malformedArnFailsLoudly() {
        assertThatThrownBy(() -> resolver.resolve(List.of("arn:aws:ec2:us-east-1")))
                .isInstanceOf(MalformedArnException.class);
    }
}
