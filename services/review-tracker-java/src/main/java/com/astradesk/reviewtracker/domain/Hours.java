package com.astradesk.reviewtracker.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Hour figures reported by the service: two decimals, rounded half-even.
 */
public final class Hours {

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);
    private static final int SCALE = 2;

    private Hours() {
    }

    public static double of(Duration duration) {
        BigDecimal seconds = BigDecimal.valueOf(duration.getSeconds())
            .add(BigDecimal.valueOf(duration.getNano(), 9));
        return seconds.divide(SECONDS_PER_HOUR, SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double ofSeconds(long seconds) {
        return of(Duration.ofSeconds(seconds));
    }

    public static double round(BigDecimal hours) {
        return hours.setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Exact sum of already rounded hour figures, rounded again to absorb binary
     * representation noise.
     */
    public static double sum(Iterable<Double> hours) {
        BigDecimal total = BigDecimal.ZERO;
        for (Double value : hours) {
            total = total.add(BigDecimal.valueOf(value));
        }
        return round(total);
    }

    /**
     * Mean of {@code total} over {@code count} items; zero when there are none.
     */
    public static double average(double total, long count) {
        if (count == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(total)
            .divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_EVEN)
            .doubleValue();
    }
}
