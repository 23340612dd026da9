package com.xammer.cloudaudit.service;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.AuditSession;
import com.xammer.cloudaudit.domain.RegionalClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Builds one client per region a service should be audited in.
 */
@Service
public class RegionalClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(RegionalClientFactory.class);

    private final ServiceRegionCatalog catalog;

    public RegionalClientFactory(ServiceRegionCatalog catalog) {
        this.catalog = catalog;
    }

    @FunctionalInterface
    public interface ClientInstantiator<C extends SdkClient> {
        C create(String region);
    }

    /**
     * Catalog regions of the service in the audited partition, narrowed to the allow-list when
     * one is set. Global services collapse to the profile region if it is eligible, otherwise
     * the first eligible region in catalog order.
     */
    public List<String> resolveRegions(String service, AuditIdentity identity, boolean global) {
        List<String> catalogRegions = catalog.regionsFor(service, identity.getPartition());
        List<String> regions = catalogRegions;
        if (!identity.getAuditedRegions().isEmpty()) {
            regions = catalogRegions.stream()
                    .filter(identity.getAuditedRegions()::contains)
                    .collect(Collectors.toList());
        }
        if (global && !regions.isEmpty()) {
            String profileRegion = identity.getProfileRegion();
            if (profileRegion != null && regions.contains(profileRegion)) {
                return List.of(profileRegion);
            }
            return List.of(regions.get(0));
        }
        return regions;
    }

    public <B extends AwsClientBuilder<B, C>, C extends SdkClient> Map<String, RegionalClient<C>> buildClients(
            String service, AuditSession session, AuditIdentity identity, boolean global, Supplier<B> builderSupplier) {
        return buildRegionalClients(service, identity, global, region -> buildClient(builderSupplier, session, region));
    }

    /**
     * A region whose client cannot be created is logged and skipped; the others are still built.
     */
    public <C extends SdkClient> Map<String, RegionalClient<C>> buildRegionalClients(
            String service, AuditIdentity identity, boolean global, ClientInstantiator<C> instantiator) {
        Map<String, RegionalClient<C>> clients = new LinkedHashMap<>();
        for (String region : resolveRegions(service, identity, global)) {
            try {
                clients.put(region, new RegionalClient<>(service, region, instantiator.create(region)));
                logger.debug("Created {} client in region {}", service, region);
            } catch (RuntimeException e) {
                logger.warn("Skipping region {} for service {} -- {}: {}",
                        region, service, e.getClass().getSimpleName(), e.getMessage());
            }
        }
        if (clients.isEmpty()) {
            logger.info("No {} clients built for partition {}", service, identity.getPartition());
        }
        return Collections.unmodifiableMap(clients);
    }

    public <B extends AwsClientBuilder<B, C>, C extends SdkClient> C buildClient(
            Supplier<B> builderSupplier, AuditSession session, String region) {
        B builder = builderSupplier.get()
                .credentialsProvider(session.getCredentialsProvider())
                .region(Region.of(region));
        if (session.getOverrideConfiguration() != null) {
            builder.overrideConfiguration(session.getOverrideConfiguration());
        }
        return builder.build();
    }
}
