package com.ai.dialer.component;

import com.ai.dialer.config.DialerProperties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Area code centroids loaded once from a classpath CSV
 * ({@code areaCode,latitude,longitude,city,state}; {@code #} starts a comment line).
 */
@Component
public class AreaCodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(AreaCodeDirectory.class);

    public record Location(String areaCode, double latitude, double longitude, String city, String state) {
    }

    private final Map<String, Location> locations;

    @Autowired
    public AreaCodeDirectory(DialerProperties properties) {
        this(load(properties.getLocalPresence().getLocationsResource()));
    }

    public AreaCodeDirectory(Map<String, Location> locations) {
        this.locations = Collections.unmodifiableMap(new HashMap<>(locations));
    }

    public Optional<Location> find(String areaCode) {
        return Optional.ofNullable(locations.get(areaCode));
    }

    public int size() {
        return locations.size();
    }

    private static Map<String, Location> load(String resourcePath) {
        Map<String, Location> loaded = new HashMap<>();
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            log.warn("Area code locations {} not found; proximity matching disabled", resourcePath);
            return loaded;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (StringUtils.isBlank(line) || line.startsWith("#")) {
                    continue;
                }
                String[] cols = line.split(",", -1);
                if (cols.length < 3) {
                    log.warn("Skipping malformed area code row: {}", line);
                    continue;
                }
                try {
                    Location location = new Location(cols[0].trim(),
                            Double.parseDouble(cols[1].trim()),
                            Double.parseDouble(cols[2].trim()),
                            cols.length > 3 ? cols[3].trim() : null,
                            cols.length > 4 ? cols[4].trim() : null);
                    loaded.put(location.areaCode(), location);
                } catch (NumberFormatException e) {
                    log.warn("Skipping area code row with bad coordinates: {}", line);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read area code locations " + resourcePath, e);
        }
        log.info("Loaded {} area code locations", loaded.size());
        return loaded;
    }
}
