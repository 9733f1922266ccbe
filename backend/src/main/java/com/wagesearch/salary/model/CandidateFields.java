package com.wagesearch.salary.model;

import java.math.BigDecimal;

/**
 * Fields pulled from a raw row before admissibility is decided. A null component means the
 * source value was missing or malformed.
 */
public record CandidateFields(
    String title,
    BigDecimal salaryAmount,
    PayUnit payUnit,
    String city,
    String state
) {

    public boolean hasTitle() {
        return title != null;
    }

    public boolean hasSalary() {
        return salaryAmount != null && payUnit != null;
    }

    public boolean hasLocation() {
        return city != null || state != null;
    }
}
