package com.ai.dialer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed settings under {@code dialer.*}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "dialer")
public class DialerProperties {

    public enum StoreType { MEMORY, JPA }

    /** Public base URL used to build provider webhook URLs. */
    private String baseUrl = "";

    /** Caller ID used when neither the request nor local presence yields one. */
    private String defaultNumber = "";

    @Valid
    private Store store = new Store();

    @Valid
    private Lock lock = new Lock();

    @Valid
    private Parallel parallel = new Parallel();

    @Valid
    private LocalPresence localPresence = new LocalPresence();

    @Getter
    @Setter
    public static class Store {

        @NotNull
        private StoreType type = StoreType.MEMORY;
    }

    @Getter
    @Setter
    public static class Lock {

        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        /** Background purge of expired locks; zero disables it. */
        @NotNull
        private Duration sweepInterval = Duration.ZERO;
    }

    @Getter
    @Setter
    public static class Parallel {

        @Min(1)
        private int batchSize = 3;

        @NotNull
        private Duration stagger = Duration.ofMillis(500);

        @NotNull
        private Duration groupTtl = Duration.ofMinutes(5);

        @Min(1)
        private int callbackThreads = 4;
    }

    @Getter
    @Setter
    public static class LocalPresence {

        @Min(0)
        private double maxDistanceMiles = 100;

        /** Classpath resource with {@code areaCode,latitude,longitude,city,state} rows. */
        private String locationsResource = "area-code-locations.csv";
    }
}
