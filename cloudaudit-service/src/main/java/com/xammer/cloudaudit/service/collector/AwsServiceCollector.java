package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.AuditIdentity;
import com.xammer.cloudaudit.domain.CollectionError;
import com.xammer.cloudaudit.domain.RegionalClient;
import com.xammer.cloudaudit.service.ResourceScopeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Base for per-service inventory collectors. Subclasses list resources through
 * {@link #threadingCall(String, Consumer)}, which runs one worker per regional client and
 * returns only once all of them have finished.
 */
public abstract class AwsServiceCollector<C extends SdkClient> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AwsServiceCollector.class);

    private final String service;
    private final Map<String, RegionalClient<C>> regionalClients;
    private final AuditIdentity identity;
    private final ResourceScopeFilter scopeFilter;
    private final Executor executor;
    private final Queue<CollectionError> errors = new ConcurrentLinkedQueue<>();

    protected AwsServiceCollector(String service,
                                  Map<String, RegionalClient<C>> regionalClients,
                                  AuditIdentity identity,
                                  ResourceScopeFilter scopeFilter,
                                  Executor executor) {
        this.service = service;
        this.regionalClients = regionalClients;
        this.identity = identity;
        this.scopeFilter = scopeFilter;
        this.executor = executor;
    }

    /**
     * Runs {@code call} once per regional client in parallel and waits for all of them.
     * A failure in one region is recorded against that region and does not affect the others.
     */
    protected void threadingCall(String operation, Consumer<RegionalClient<C>> call) {
        List<CompletableFuture<Void>> futures = regionalClients.values().stream()
                .map(regionalClient -> CompletableFuture.runAsync(() -> {
                    try {
                        call.accept(regionalClient);
                    } catch (RuntimeException e) {
                        logger.error("{} -- {}: {}", regionalClient.getRegion(), e.getClass().getSimpleName(), e.getMessage());
                        errors.add(CollectionError.of(service, regionalClient.getRegion(), operation, e));
                    }
                }, executor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    /**
     * True when no scope filter is active or the resource matches it.
     */
    protected boolean isIncluded(String arn) {
        return !identity.hasAuditResources() || scopeFilter.isIncluded(arn, identity.getAuditResources());
    }

    /**
     * The profile region when one is set, otherwise the region of the first client.
     */
    public String getRegion() {
        if (identity.getProfileRegion() != null && !identity.getProfileRegion().isEmpty()) {
            return identity.getProfileRegion();
        }
        return regionalClients.keySet().stream().findFirst().orElse(null);
    }

    public String getService() {
        return service;
    }

    public String getAuditedAccount() {
        return identity.getAuditedAccount();
    }

    public String getAuditedPartition() {
        return identity.getPartition();
    }

    public Map<String, RegionalClient<C>> getRegionalClients() {
        return regionalClients;
    }

    public List<CollectionError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void close() {
        regionalClients.values().forEach(RegionalClient::close);
    }
}
