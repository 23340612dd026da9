package com.xammer.cloudaudit.service.collector;

import com.xammer.cloudaudit.domain.CollectionError;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collected data of one audit run, handed to the checks. Read-only once built.
 */
public class AuditInventory {

    private final Map<String, AwsServiceCollector<?>> collectors;

    public AuditInventory(Map<String, AwsServiceCollector<?>> collectors) {
        this.collectors = Map.copyOf(collectors);
    }

    public <T extends AwsServiceCollector<?>> Optional<T> get(Class<T> type) {
        return collectors.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }

    public Collection<String> getServices() {
        return collectors.keySet();
    }

    public List<CollectionError> getErrors() {
        return collectors.values().stream()
                .flatMap(collector -> collector.getErrors().stream())
                .collect(Collectors.toList());
    }
}
