package com.ai.dialer.component;

import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.service.HaversineDistanceResolver;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AreaCodeDirectoryTest {

    @Test
    void loadsBundledLocations() {
        AreaCodeDirectory directory = new AreaCodeDirectory(new DialerProperties());

        assertThat(directory.size()).isGreaterThan(30);
        assertThat(directory.find("212")).hasValueSatisfying(l -> assertThat(l.state()).isEqualTo("NY"));
        assertThat(directory.find("999")).isEmpty();
    }

    @Test
    void missingResourceLeavesDirectoryEmpty() {
        DialerProperties properties = new DialerProperties();
        properties.getLocalPresence().setLocationsResource("does-not-exist.csv");

        assertThat(new AreaCodeDirectory(properties).size()).isZero();
    }

    @Test
    void distanceBetweenNearbyAndFarAreaCodes() {
        HaversineDistanceResolver resolver = new HaversineDistanceResolver(new AreaCodeDirectory(new DialerProperties()));

        OptionalDouble nycToJersey = resolver.distanceMiles("212", "201");
        OptionalDouble nycToLa = resolver.distanceMiles("212", "213");

        assertThat(nycToJersey.getAsDouble()).isLessThan(15.0);
        assertThat(nycToLa.getAsDouble()).isCloseTo(2450.0, within(100.0));
        assertThat(resolver.distanceMiles("212", "999")).isEmpty();
    }
}
