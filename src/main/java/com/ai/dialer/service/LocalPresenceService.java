package com.ai.dialer.service;

import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.model.NumberPool;
import com.ai.dialer.model.NumberSelection;
import com.ai.dialer.model.PhoneNumberCandidate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Picks the outbound number that looks most local to the destination.
 *
 * <p>Priority: exact area code match, then the closest number within the configured radius
 * (only with a distance resolver), then the pool's primary number. No I/O beyond the
 * resolver and no state: the same pool and destination always give the same answer.
 */
@Service
public class LocalPresenceService {

    private final double maxDistanceMiles;
    private final AreaCodeDistanceResolver distanceResolver;

    @Autowired
    public LocalPresenceService(DialerProperties properties, ObjectProvider<AreaCodeDistanceResolver> distanceResolver) {
        this(properties.getLocalPresence().getMaxDistanceMiles(), distanceResolver.getIfAvailable());
    }

    /**
     * @param distanceResolver may be null, which disables proximity matching
     */
    public LocalPresenceService(double maxDistanceMiles, AreaCodeDistanceResolver distanceResolver) {
        this.maxDistanceMiles = maxDistanceMiles;
        this.distanceResolver = distanceResolver;
    }

    public Optional<NumberSelection> selectNumber(NumberPool pool, String destinationNumber) {
        String customerAreaCode = AreaCodes.extract(destinationNumber).orElse(null);
        if (customerAreaCode == null || pool.numbers().isEmpty()) {
            return primaryFallback(pool, customerAreaCode);
        }

        for (PhoneNumberCandidate candidate : pool.numbers()) {
            if (candidate.active() && customerAreaCode.equals(candidate.areaCode())) {
                return Optional.of(new NumberSelection(candidate.phoneNumber(), candidate.areaCode(),
                        true, false, null, candidate.primary(), customerAreaCode));
            }
        }

        if (distanceResolver != null) {
            PhoneNumberCandidate best = null;
            double bestDistance = Double.MAX_VALUE;
            for (PhoneNumberCandidate candidate : pool.numbers()) {
                if (!candidate.active()) {
                    continue;
                }
                OptionalDouble distance = distanceResolver.distanceMiles(customerAreaCode, candidate.areaCode());
                // strict comparison keeps the earlier pool entry on ties
                if (distance.isPresent() && distance.getAsDouble() <= maxDistanceMiles
                        && distance.getAsDouble() < bestDistance) {
                    best = candidate;
                    bestDistance = distance.getAsDouble();
                }
            }
            if (best != null) {
                return Optional.of(new NumberSelection(best.phoneNumber(), best.areaCode(),
                        false, true, bestDistance, best.primary(), customerAreaCode));
            }
        }

        return primaryFallback(pool, customerAreaCode);
    }

    private Optional<NumberSelection> primaryFallback(NumberPool pool, String customerAreaCode) {
        PhoneNumberCandidate primary = pool.primaryNumber();
        if (primary == null) {
            primary = pool.numbers().stream()
                    .filter(n -> n.primary() && n.active())
                    .findFirst()
                    .orElse(null);
        }
        if (primary == null) {
            return Optional.empty();
        }
        return Optional.of(new NumberSelection(primary.phoneNumber(), primary.areaCode(),
                false, false, null, true, customerAreaCode));
    }
}
