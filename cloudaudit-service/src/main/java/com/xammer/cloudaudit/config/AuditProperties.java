package com.xammer.cloudaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    /** Local named profile; empty means the default credential chain. */
    private String profile;

    private String profileRegion = "us-east-1";

    private String partition = "aws";

    /** Resolved through STS when left empty. */
    private String accountId;

    private List<String> regions = new ArrayList<>();

    private List<String> resourceArns = new ArrayList<>();

    /** Services to collect; empty means every supported collector. */
    private List<String> services = new ArrayList<>();

    /** Run one audit when the application starts. */
    private boolean runOnStartup = true;

    private String catalogFile = "aws_regions_by_service.json";

    private String checksFile = "checks_by_service.json";

    private Role role = new Role();

    private Aws aws = new Aws();

    @Data
    public static class Role {
        private String arn;
        private String externalId;
        private int sessionDuration = 3600;
        private String sessionName;

        public boolean isConfigured() {
            return arn != null && !arn.isEmpty();
        }
    }

    @Data
    public static class Aws {
        private int maxRetries = 3;
        private Duration refreshWindow = Duration.ofMinutes(5);
    }
}
