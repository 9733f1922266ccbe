package com.wagesearch.salary.pipeline;

import com.wagesearch.salary.model.RejectionReason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-run counters filled in by {@link NormalizationPipeline}. Owned by whoever starts the run;
 * safe to share between threads.
 */
public class NormalizationTally {
    private static final int MAX_SAMPLES = 10;

    private final LongAdder rowsRead = new LongAdder();
    private final LongAdder unitCorrections = new LongAdder();
    private final Map<RejectionReason, LongAdder> rejections = new EnumMap<>(RejectionReason.class);
    private final List<String> sampleRejections = new ArrayList<>();

    public NormalizationTally() {
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason, new LongAdder());
        }
    }

    void rowRead() {
        rowsRead.increment();
    }

    void unitCorrected() {
        unitCorrections.increment();
    }

    void rejected(long rowNumber, RejectionReason reason) {
        rejections.get(reason).increment();
        synchronized (sampleRejections) {
            if (sampleRejections.size() < MAX_SAMPLES) {
                sampleRejections.add("row " + rowNumber + ": " + reason.name());
            }
        }
    }

    public long rowsRead() {
        return rowsRead.sum();
    }

    public long unitCorrections() {
        return unitCorrections.sum();
    }

    public long rejectedCount(RejectionReason reason) {
        return rejections.get(reason).sum();
    }

    public long totalRejected() {
        long total = 0;
        for (LongAdder count : rejections.values()) {
            total += count.sum();
        }
        return total;
    }

    public Map<RejectionReason, Long> rejectionCounts() {
        Map<RejectionReason, Long> counts = new EnumMap<>(RejectionReason.class);
        rejections.forEach((reason, count) -> counts.put(reason, count.sum()));
        return Collections.unmodifiableMap(counts);
    }

    public List<String> sampleRejections() {
        synchronized (sampleRejections) {
            return List.copyOf(sampleRejections);
        }
    }
}
