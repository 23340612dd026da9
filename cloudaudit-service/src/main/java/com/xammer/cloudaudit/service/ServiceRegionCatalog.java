package com.xammer.cloudaudit.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.cloudaudit.config.AuditProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which regions each service supports, per partition. Loaded once from the packaged
 * catalog file and read-only afterwards.
 */
@Component
public class ServiceRegionCatalog {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRegionCatalog.class);

    private final Map<String, Map<String, List<String>>> regionsByService;

    public ServiceRegionCatalog(ObjectMapper objectMapper, AuditProperties properties) {
        this(load(objectMapper, properties.getCatalogFile()));
    }

    ServiceRegionCatalog(Map<String, Map<String, List<String>>> regionsByService) {
        this.regionsByService = regionsByService;
        logger.info("Loaded region catalog with {} services", regionsByService.size());
    }

    /**
     * Regions of {@code service} in {@code partition}, in catalog order. Empty when the
     * service is unknown or not offered in the partition.
     */
    public List<String> regionsFor(String service, String partition) {
        Map<String, List<String>> partitions = regionsByService.get(service);
        if (partitions == null) {
            logger.debug("Service {} is not in the region catalog", service);
            return List.of();
        }
        List<String> regions = partitions.get(partition);
        if (regions == null) {
            logger.debug("Service {} has no regions in partition {}", service, partition);
            return List.of();
        }
        return regions;
    }

    public boolean hasService(String service) {
        return regionsByService.containsKey(service);
    }

    /**
     * Every region known to the catalog, across all services and partitions.
     */
    public Set<String> allRegions() {
        Set<String> regions = new TreeSet<>();
        regionsByService.values().forEach(partitions -> partitions.values().forEach(regions::addAll));
        return Collections.unmodifiableSet(regions);
    }

    public Set<String> partitionRegions(String partition) {
        Set<String> regions = new TreeSet<>();
        regionsByService.values().forEach(partitions ->
                regions.addAll(partitions.getOrDefault(partition, List.of())));
        return Collections.unmodifiableSet(regions);
    }

    static ServiceRegionCatalog fromStream(ObjectMapper objectMapper, InputStream in) throws IOException {
        return new ServiceRegionCatalog(parse(objectMapper.readTree(in)));
    }

    private static Map<String, Map<String, List<String>>> load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            return parse(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read region catalog " + location, e);
        }
    }

    private static Map<String, Map<String, List<String>>> parse(JsonNode root) {
        JsonNode services = root.path("services");
        if (!services.isObject()) {
            throw new IllegalStateException("Region catalog has no 'services' object");
        }
        Map<String, Map<String, List<String>>> catalog = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> serviceIt = services.fields();
        while (serviceIt.hasNext()) {
            Map.Entry<String, JsonNode> service = serviceIt.next();
            JsonNode regionsNode = service.getValue().path("regions");
            if (!regionsNode.isObject()) {
                throw new IllegalStateException("Region catalog entry '" + service.getKey() + "' has no 'regions' object");
            }
            Map<String, List<String>> partitions = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> partitionIt = regionsNode.fields();
            while (partitionIt.hasNext()) {
                Map.Entry<String, JsonNode> partition = partitionIt.next();
                List<String> regions = new ArrayList<>();
                partition.getValue().forEach(region -> regions.add(region.asText()));
                partitions.put(partition.getKey(), List.copyOf(regions));
            }
            catalog.put(service.getKey(), Collections.unmodifiableMap(partitions));
        }
        return Collections.unmodifiableMap(catalog);
    }
}
