package com.wagesearch.salary.model;

import java.util.List;

public record SalarySearchResponse(
    String title,
    String location,
    MatchPolicy matchPolicy,
    SalaryStatistics statistics,
    boolean truncated,
    List<CompensationRecord> records
) {
}
