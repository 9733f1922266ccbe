package com.wagesearch.salary.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record IngestionSummary(
    String source,
    long rowsRead,
    long recordsLoaded,
    long rejectedCount,
    Map<RejectionReason, Long> rejections,
    List<String> sampleRejections,
    long unitCorrections,
    Instant startedAt,
    Instant finishedAt
) {
}
