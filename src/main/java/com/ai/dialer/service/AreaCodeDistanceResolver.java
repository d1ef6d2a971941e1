package com.ai.dialer.service;

import java.util.OptionalDouble;

/**
 * Geographic distance between two area codes.
 */
@FunctionalInterface
public interface AreaCodeDistanceResolver {

    /** @return miles between the two area codes, or empty when either is unknown */
    OptionalDouble distanceMiles(String areaCodeA, String areaCodeB);
}
