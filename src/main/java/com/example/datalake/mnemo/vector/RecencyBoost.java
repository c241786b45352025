package com.example.datalake.mnemo.vector;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Re-ranks similarity candidates toward knowledge that was surfaced recently.
 * Distances shrink for items referenced in the last 30 days and grow for items
 * not referenced for 90 days or never.
 */
@Component
public class RecencyBoost {

    static final double RECENT_FACTOR = 0.8;
    static final double NEUTRAL_FACTOR = 1.0;
    static final double STALE_FACTOR = 1.2;
    static final Duration RECENT_WINDOW = Duration.ofDays(30);
    static final Duration NEUTRAL_WINDOW = Duration.ofDays(90);

    private final Clock clock;

    @Autowired
    public RecencyBoost() {
        this(Clock.systemUTC());
    }

    public RecencyBoost(Clock clock) {
        this.clock = clock;
    }

    public double factor(OffsetDateTime lastReferencedAt) {
        if (lastReferencedAt == null) {
            return STALE_FACTOR;
        }
        Duration age = Duration.between(lastReferencedAt.toInstant(), clock.instant());
        if (age.compareTo(RECENT_WINDOW) <= 0) {
            return RECENT_FACTOR;
        }
        if (age.compareTo(NEUTRAL_WINDOW) <= 0) {
            return NEUTRAL_FACTOR;
        }
        return STALE_FACTOR;
    }

    public List<VectorMatch> apply(List<VectorMatch> candidates, int limit) {
        return candidates.stream()
                .map(m -> m.withDistance(m.distance() * factor(m.lastReferencedAt())))
                .sorted(Comparator.comparingDouble(VectorMatch::distance))
                .limit(limit)
                .toList();
    }
}
