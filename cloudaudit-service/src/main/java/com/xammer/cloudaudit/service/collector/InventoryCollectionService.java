package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.AuditSession;
import com.xammer.cloudaudit.domain.RegionalClient;
import com.xammer.cloudaudit.service.RegionalClientFactory;
import com.xammer.cloudaudit.service.ResourceScopeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.services.backup.BackupClient;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.iam.IamClient;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the collectors of the requested services in parallel and gathers their inventories.
 */
@Service
public class InventoryCollectionService {

    private static final Logger logger = LoggerFactory.getLogger(InventoryCollectionService.class);

    public static final Set<String> SUPPORTED_SERVICES = Set.of(
            BackupCollector.SERVICE, CognitoIdpCollector.AUDIT_SERVICE, IamCollector.SERVICE);

    private final RegionalClientFactory clientFactory;
    private final ResourceScopeFilter scopeFilter;
    private final Executor serviceExecutor;
    private final Executor regionExecutor;

    public InventoryCollectionService(RegionalClientFactory clientFactory,
                                      ResourceScopeFilter scopeFilter,
                                      @Qualifier("serviceTaskExecutor") Executor serviceExecutor,
                                      @Qualifier("regionTaskExecutor") Executor regionExecutor) {
        this.clientFactory = clientFactory;
        this.scopeFilter = scopeFilter;
        this.serviceExecutor = serviceExecutor;
        this.regionExecutor = regionExecutor;
    }

    public AuditInventory collect(AuditSession session, AuditIdentity identity, Collection<String> services) {
        Map<String, AwsServiceCollector<?>> collectors = new ConcurrentHashMap<>();
        List<CompletableFuture<Void>> futures = services.stream()
                .filter(this::isSupported)
                .map(service -> CompletableFuture.runAsync(() -> {
                    try {
                        collectors.put(service, createCollector(service, session, identity));
                    } catch (RuntimeException e) {
                        logger.error("Collector for service {} failed -- {}: {}",
                                service, e.getClass().getSimpleName(), e.getMessage(), e);
                    }
                }, serviceExecutor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        logger.info("Collected inventory for services {}", collectors.keySet());
        return new AuditInventory(new LinkedHashMap<>(collectors));
    }

    private boolean isSupported(String service) {
        if (SUPPORTED_SERVICES.contains(service)) {
            return true;
        }
        logger.warn("No collector for service {}, skipping", service);
        return false;
    }

    AwsServiceCollector<?> createCollector(String service, AuditSession session, AuditIdentity identity) {
        switch (service) {
            case BackupCollector.SERVICE: {
                Map<String, RegionalClient<BackupClient>> clients = clientFactory.buildClients(
                        BackupCollector.SERVICE, session, identity, false, BackupClient::builder);
                return collectWith(clients, c -> new BackupCollector(c, identity, scopeFilter, regionExecutor));
            }
            case CognitoIdpCollector.AUDIT_SERVICE: {
                Map<String, RegionalClient<CognitoIdentityProviderClient>> clients = clientFactory.buildClients(
                        CognitoIdpCollector.SERVICE, session, identity, false, CognitoIdentityProviderClient::builder);
                return collectWith(clients, c -> new CognitoIdpCollector(c, identity, scopeFilter, regionExecutor));
            }
            case IamCollector.SERVICE: {
                Map<String, RegionalClient<IamClient>> clients = clientFactory.buildClients(
                        IamCollector.SERVICE, session, identity, true, IamClient::builder);
                return collectWith(clients, c -> new IamCollector(c, identity, scopeFilter, regionExecutor));
            }
            default:
                throw new IllegalArgumentException("Unsupported service: " + service);
        }
    }

    /**
     * Collectors list everything while being constructed, so the clients are closed as soon as
     * construction ends, whether it succeeded or not.
     */
    private <C extends SdkClient> AwsServiceCollector<C> collectWith(
            Map<String, RegionalClient<C>> clients,
            Function<Map<String, RegionalClient<C>>, AwsServiceCollector<C>> collectorFactory) {
        try {
            return collectorFactory.apply(clients);
        } finally {
            clients.values().forEach(RegionalClient::close);
        }
    }
}
