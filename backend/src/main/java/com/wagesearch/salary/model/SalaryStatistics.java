package com.wagesearch.salary.model;

import java.math.BigDecimal;

/**
 * Annualized salary statistics over a set of matching records. Every amount is null when
 * nothing matched.
 */
public record SalaryStatistics(
    long dataPoints,
    BigDecimal minSalary,
    BigDecimal maxSalary,
    BigDecimal meanSalary,
    BigDecimal medianSalary,
    BigDecimal percentile25,
    BigDecimal percentile75
) {

    public static SalaryStatistics empty() {
        return new SalaryStatistics(0, null, null, null, null, null, null);
    }
}
