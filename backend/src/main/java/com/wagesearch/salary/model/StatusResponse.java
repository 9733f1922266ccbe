package com.wagesearch.salary.model;

public record StatusResponse(
    boolean dbConnected,
    long recordCount,
    IngestionSummary lastIngestion
) {
}
