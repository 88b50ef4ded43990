package com.civics.ingest.lifecycle;

import com.civics.ingest.core.model.OfficeSlot;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables of the lifecycle state machine.
 *
 * @param inactiveRetention how long an entity stays inactive before it is promoted to historical
 * @param seatCapacities    number of seats sharing one slot, keyed by normalized office title;
 *                          offices not listed have one seat
 */
public record LifecyclePolicy(Duration inactiveRetention, Map<String, Integer> seatCapacities) {

    public static final Duration DEFAULT_INACTIVE_RETENTION = Duration.ofDays(90);

    /** Both senators of a state share the district-less slot. */
    public static final Map<String, Integer> DEFAULT_SEAT_CAPACITIES = Map.of("u.s. senator", 2);

    public LifecyclePolicy {
        Objects.requireNonNull(inactiveRetention, "inactiveRetention is required");
        if (inactiveRetention.isNegative()) {
            throw new IllegalArgumentException("inactiveRetention must not be negative");
        }
        seatCapacities = Map.copyOf(seatCapacities);
        seatCapacities.values().forEach(c -> {
            if (c < 1) {
                throw new IllegalArgumentException("seat capacity must be >= 1");
            }
        });
    }

    public LifecyclePolicy(Duration inactiveRetention) {
        this(inactiveRetention, DEFAULT_SEAT_CAPACITIES);
    }

    public static LifecyclePolicy defaults() {
        return new LifecyclePolicy(DEFAULT_INACTIVE_RETENTION);
    }

    public int seatCapacity(OfficeSlot slot) {
        return seatCapacities.getOrDefault(slot.office().toLowerCase(Locale.ROOT), 1);
    }
}
