package com.wagesearch.salary.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

public enum PayUnit {
    HOURLY(new BigDecimal("2080")),
    WEEKLY(new BigDecimal("52")),
    BI_WEEKLY(new BigDecimal("26")),
    MONTHLY(new BigDecimal("12")),
    YEARLY(BigDecimal.ONE);

    private static final Map<String, PayUnit> ALIASES = Map.ofEntries(
        Map.entry("hour", HOURLY),
        Map.entry("hourly", HOURLY),
        Map.entry("week", WEEKLY),
        Map.entry("weekly", WEEKLY),
        Map.entry("bi-weekly", BI_WEEKLY),
        Map.entry("biweekly", BI_WEEKLY),
        Map.entry("bi weekly", BI_WEEKLY),
        Map.entry("bi_weekly", BI_WEEKLY),
        Map.entry("month", MONTHLY),
        Map.entry("monthly", MONTHLY),
        Map.entry("year", YEARLY),
        Map.entry("yearly", YEARLY),
        Map.entry("annual", YEARLY),
        Map.entry("annually", YEARLY)
    );

    private final BigDecimal defaultAnnualFactor;

    PayUnit(BigDecimal defaultAnnualFactor) {
        this.defaultAnnualFactor = defaultAnnualFactor;
    }

    public BigDecimal defaultAnnualFactor() {
        return defaultAnnualFactor;
    }

    /**
     * Parses a unit label as written in the disclosure data ({@code Hour}, {@code Bi-Weekly},
     * {@code Year}, ...). Returns null for anything unrecognized.
     */
    public static PayUnit fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return ALIASES.get(normalized);
    }
}
