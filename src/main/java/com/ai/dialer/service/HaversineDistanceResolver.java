package com.ai.dialer.service;

import com.ai.dialer.component.AreaCodeDirectory;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * Great-circle distance between area code centroids.
 */
@Service
public class HaversineDistanceResolver implements AreaCodeDistanceResolver {

    private static final double EARTH_RADIUS_MILES = 3958.8;

    private final AreaCodeDirectory directory;

    public HaversineDistanceResolver(AreaCodeDirectory directory) {
        this.directory = directory;
    }

    @Override
    public OptionalDouble distanceMiles(String areaCodeA, String areaCodeB) {
        var a = directory.find(areaCodeA);
        var b = directory.find(areaCodeB);
        if (a.isEmpty() || b.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(haversine(a.get().latitude(), a.get().longitude(),
                b.get().latitude(), b.get().longitude()));
    }

    static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_MILES * Math.asin(Math.sqrt(h));
    }
}
