package com.xammer.cloudaudit.config;

import com.xammer.cloudaudit.service.BaseCredentialsProviderFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;

import java.time.Clock;

@Configuration
public class AwsConfig {

    /**
     * STS bound to the base (profile or default chain) credentials. Used for the initial
     * role assumption and for every refresh, never with the assumed credentials themselves.
     */
    @Bean
    public StsClient stsClient(AuditProperties properties, BaseCredentialsProviderFactory credentialsProviderFactory) {
        return StsClient.builder()
                .region(Region.of(properties.getProfileRegion()))
                .credentialsProvider(credentialsProviderFactory.forProfile(properties.getProfile()))
                .build();
    }

    @Bean
    public ClientOverrideConfiguration auditClientOverrideConfiguration(AuditProperties properties) {
        return ClientOverrideConfiguration.builder()
                .retryPolicy(RetryPolicy.builder()
                        .numRetries(properties.getAws().getMaxRetries())
                        .build())
                .build();
    }

    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }
}
