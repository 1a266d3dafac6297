package com.driveplot.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

// All durations are reported with one decimal, rounded half-up.
public final class Minutes {
    private Minutes() {
    }

    public static double fromSeconds(long seconds) {
        return BigDecimal.valueOf(seconds)
                .divide(BigDecimal.valueOf(60), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static double round(double minutes) {
        return BigDecimal.valueOf(minutes).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    public static double average(double first, double second) {
        return BigDecimal.valueOf(first)
                .add(BigDecimal.valueOf(second))
                .divide(BigDecimal.valueOf(2), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static double difference(double larger, double smaller) {
        return BigDecimal.valueOf(larger)
                .subtract(BigDecimal.valueOf(smaller))
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
