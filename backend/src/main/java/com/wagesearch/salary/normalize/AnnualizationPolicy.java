package com.wagesearch.salary.normalize;

import com.wagesearch.config.WageSearchProperties;
import com.wagesearch.salary.model.PayUnit;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conversion of a salary at some pay unit into its yearly equivalent, and the ceiling above
 * which a non-yearly figure is taken to be an already-annual amount with a mis-keyed unit.
 */
public final class AnnualizationPolicy {
    private final Map<PayUnit, BigDecimal> factors;
    private final BigDecimal highAnnualThreshold;

    public AnnualizationPolicy(Map<PayUnit, BigDecimal> overrides, BigDecimal highAnnualThreshold) {
        Objects.requireNonNull(highAnnualThreshold, "highAnnualThreshold");
        if (highAnnualThreshold.signum() <= 0) {
            throw new IllegalArgumentException("highAnnualThreshold must be positive");
        }
        EnumMap<PayUnit, BigDecimal> resolved = new EnumMap<>(PayUnit.class);
        for (PayUnit unit : PayUnit.values()) {
            BigDecimal factor = overrides == null ? null : overrides.get(unit);
            if (factor == null || factor.signum() <= 0) {
                factor = unit.defaultAnnualFactor();
            }
            resolved.put(unit, factor);
        }
        resolved.put(PayUnit.YEARLY, BigDecimal.ONE);
        this.factors = Collections.unmodifiableMap(resolved);
        this.highAnnualThreshold = highAnnualThreshold;
    }

    public static AnnualizationPolicy defaults() {
        return fromProperties(new WageSearchProperties.Normalization());
    }

    public static AnnualizationPolicy fromProperties(WageSearchProperties.Normalization normalization) {
        return new AnnualizationPolicy(
            normalization.getAnnualizationFactors(),
            normalization.getHighAnnualThreshold()
        );
    }

    public BigDecimal factor(PayUnit unit) {
        return factors.get(Objects.requireNonNull(unit, "unit"));
    }

    public BigDecimal annualize(BigDecimal amount, PayUnit unit) {
        return amount.multiply(factor(unit));
    }

    public BigDecimal highAnnualThreshold() {
        return highAnnualThreshold;
    }

    /**
     * The unit a reported amount should be stored under: {@link PayUnit#YEARLY} when the
     * annualized figure would exceed the threshold, otherwise the reported unit.
     */
    public PayUnit correctUnit(BigDecimal amount, PayUnit unit) {
        if (unit == PayUnit.YEARLY) {
            return unit;
        }
        if (annualize(amount, unit).compareTo(highAnnualThreshold) > 0) {
            return PayUnit.YEARLY;
        }
        return unit;
    }
}
