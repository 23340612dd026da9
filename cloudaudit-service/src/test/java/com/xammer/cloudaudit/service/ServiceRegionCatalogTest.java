package com.xammer.cloudaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.cloudaudit.config.AuditProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceRegionCatalogTest {

    private ServiceRegionCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/test_regions_by_service.json")) {
            catalog = ServiceRegionCatalog.fromStream(new ObjectMapper(), in);
        }
    }

    @Test
    void returnsRegionsInCatalogOrder() {
        assertThat(catalog.regionsFor("backup", "aws")).containsExactly("eu-west-1", "us-east-1", "us-west-2");
    }

    @Test
    void unknownServiceOrPartitionHasNoRegions() {
        assertThat(catalog.regionsFor("shield", "aws")).isEmpty();
        assertThat(catalog.regionsFor("iam", "aws-us-gov")).isEmpty();
        assertThat(catalog.regionsFor("backup", "aws-us-gov")).isEmpty();
    }

    @Test
    void aggregatesAllKnownRegions() {
        assertThat(catalog.allRegions())
                .containsExactlyInAnyOrder("eu-west-1", "us-east-1", "us-west-2", "cn-north-1", "cn-northwest-1");
        assertThat(catalog.partitionRegions("aws-cn")).containsExactly("cn-north-1", "cn-northwest-1");
    }

    @Test
    void loadsPackagedCatalog() {
        ServiceRegionCatalog packaged = new ServiceRegionCatalog(new ObjectMapper(), new AuditProperties());

        assertThat(packaged.hasService("backup")).isTrue();
        assertThat(packaged.regionsFor("cognito-idp", "aws")).contains("us-east-1");
        assertThat(packaged.regionsFor("backup", "aws-cn")).containsExactly("cn-north-1", "cn-northwest-1");
        assertThat(packaged.regionsFor("iam", "aws")).contains("us-east-1");
        assertThat(packaged.partitionRegions("aws")).contains("us-east-1", "eu-west-1");
    }

    @Test
    void serviceEntryWithoutRegionsObjectIsRejected() {
        String json = "{\"services\": {\"iam\": {\"aws\": [\"us-east-1\"]}}}";

        assertThatThrownBy(() -> ServiceRegionCatalog.fromStream(new ObjectMapper(),
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("iam");
    }

    @Test
    void failsWhenCatalogIsMissing() {
        AuditProperties properties = new AuditProperties();
        properties.setCatalogFile("missing.json");

        assertThatThrownBy(() -> new ServiceRegionCatalog(new ObjectMapper(), properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing.json");
    }
}
