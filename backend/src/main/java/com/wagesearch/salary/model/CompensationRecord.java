package com.wagesearch.salary.model;

import java.math.BigDecimal;
import java.util.Objects;

public record CompensationRecord(
    String title,
    BigDecimal salaryAmount,
    PayUnit payUnit,
    String city,
    String state
) {

    public CompensationRecord {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        Objects.requireNonNull(salaryAmount, "salaryAmount");
        if (salaryAmount.signum() <= 0) {
            throw new IllegalArgumentException("salaryAmount must be positive: " + salaryAmount);
        }
        Objects.requireNonNull(payUnit, "payUnit");
        city = blankToNull(city);
        state = blankToNull(state);
        if (city == null && state == null) {
            throw new IllegalArgumentException("city or state is required");
        }
    }

    public String locationText() {
        if (city == null) {
            return state;
        }
        if (state == null) {
            return city;
        }
        return city + ", " + state;
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
