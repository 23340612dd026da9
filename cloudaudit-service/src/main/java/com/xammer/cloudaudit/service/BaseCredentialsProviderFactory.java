package com.xammer.cloudaudit.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;

@Component
public class BaseCredentialsProviderFactory {

    private static final Logger logger = LoggerFactory.getLogger(BaseCredentialsProviderFactory.class);

    /**
     * Credentials of the local identity: the named profile when one is given, otherwise the
     * default chain (environment, system properties, shared config, container/instance role).
     */
    public AwsCredentialsProvider forProfile(String profile) {
        if (StringUtils.hasText(profile)) {
            logger.debug("Using credentials from local profile {}", profile);
            return ProfileCredentialsProvider.create(profile);
        }
        logger.debug("Using the default credentials provider chain");
        return DefaultCredentialsProvider.create();
    }
}
