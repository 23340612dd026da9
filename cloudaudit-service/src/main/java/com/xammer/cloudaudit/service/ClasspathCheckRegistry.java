package com.xammer.cloudaudit.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.cloudaudit.config.AuditProperties;
import com.xammer.cloudaudit.exception.CheckNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Check catalog packaged with the application, keyed by internal service name.
 */
@Component
public class ClasspathCheckRegistry implements CheckRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathCheckRegistry.class);

    private final Map<String, List<String>> checksByService;

    public ClasspathCheckRegistry(ObjectMapper objectMapper, AuditProperties properties) {
        this(load(objectMapper, properties.getChecksFile()));
    }

    ClasspathCheckRegistry(Map<String, List<String>> checksByService) {
        Map<String, List<String>> copy = new TreeMap<>();
        checksByService.forEach((service, checks) -> copy.put(service, List.copyOf(checks)));
        this.checksByService = Collections.unmodifiableMap(copy);
        logger.info("Loaded {} checks across {} services",
                copy.values().stream().mapToInt(List::size).sum(), copy.size());
    }

    @Override
    public List<String> listChecksForService(String service) {
        List<String> checks = checksByService.get(service);
        if (checks == null || checks.isEmpty()) {
            throw new CheckNotFoundException(service);
        }
        return checks;
    }

    @Override
    public SortedSet<String> checksForServices(Collection<String> services) {
        SortedSet<String> checks = new TreeSet<>();
        for (String service : services) {
            checks.addAll(checksByService.getOrDefault(service, List.of()));
        }
        return checks;
    }

    private static Map<String, List<String>> load(ObjectMapper objectMapper, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<Map<String, List<String>>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read check catalog " + location, e);
        }
    }
}
