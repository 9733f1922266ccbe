package com.wagesearch.salary.service;

import com.wagesearch.config.WageSearchProperties;
import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.IngestionSummary;
import com.wagesearch.salary.persistence.CompensationIndex;
import com.wagesearch.salary.pipeline.NormalizationPipeline;
import com.wagesearch.salary.pipeline.NormalizationTally;
import com.wagesearch.salary.pipeline.RawRecordSource;
import com.wagesearch.salary.pipeline.RawRecordSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

@Service
public class CompensationIngestionService {
    private static final Logger log = LoggerFactory.getLogger(CompensationIngestionService.class);

    private final WageSearchProperties properties;
    private final RawRecordSources rawRecordSources;
    private final NormalizationPipeline pipeline;
    private final CompensationIndex index;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile IngestionSummary lastSummary;

    public CompensationIngestionService(
        WageSearchProperties properties,
        RawRecordSources rawRecordSources,
        NormalizationPipeline pipeline,
        CompensationIndex index
    ) {
        this.properties = properties;
        this.rawRecordSources = rawRecordSources;
        this.pipeline = pipeline;
        this.index = index;
    }

    public IngestionSummary ingest(boolean replaceExisting) {
        return ingest(rawRecordSources.configured(), replaceExisting);
    }

    public IngestionSummary ingest(RawRecordSource source, boolean replaceExisting) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveIngestionException("An ingestion run is already in progress");
        }
        try {
            IngestionSummary summary = runIngestion(source, replaceExisting);
            lastSummary = summary;
            return summary;
        } finally {
            running.set(false);
        }
    }

    /** Ingests the configured file only when the index holds no records yet. */
    public Optional<IngestionSummary> loadIfEmpty() {
        long existing = index.countAll();
        if (existing > 0) {
            log.info("Compensation index already holds {} records, skipping load", existing);
            return Optional.empty();
        }
        return Optional.of(ingest(false));
    }

    public boolean isRunning() {
        return running.get();
    }

    public IngestionSummary getLastSummary() {
        return lastSummary;
    }

    private IngestionSummary runIngestion(RawRecordSource source, boolean replaceExisting) {
        Instant startedAt = Instant.now();
        NormalizationTally tally = new NormalizationTally();
        int batchSize = properties.getIngest().getBatchSize();
        long loaded = 0;
        log.info("Ingestion started. source={}, replaceExisting={}, batchSize={}", source.describe(), replaceExisting, batchSize);

        try {
            if (replaceExisting) {
                index.clear();
            }
            List<CompensationRecord> batch = new ArrayList<>(batchSize);
            try (Stream<CompensationRecord> records = pipeline.normalize(source, tally)) {
                Iterator<CompensationRecord> iterator = records.iterator();
                while (iterator.hasNext()) {
                    batch.add(iterator.next());
                    if (batch.size() >= batchSize) {
                        index.load(batch);
                        loaded += batch.size();
                        batch = new ArrayList<>(batchSize);
                    }
                }
            }
            if (!batch.isEmpty()) {
                index.load(batch);
                loaded += batch.size();
            }
        } catch (IOException | UncheckedIOException e) {
            log.error("Ingestion aborted reading {} after {} records", source.describe(), loaded, e);
            throw new IngestionFailedException("failed to read " + source.describe() + ": " + rootMessage(e), e);
        } catch (DataAccessException e) {
            log.error("Ingestion aborted loading into the index after {} records", loaded, e);
            throw new IngestionFailedException("failed to load compensation records: " + rootMessage(e), e);
        }

        Instant finishedAt = Instant.now();
        log.info(
            "Ingestion complete. source={}, rowsRead={}, recordsLoaded={}, rejected={}, rejections={}, unitCorrections={}",
            source.describe(),
            tally.rowsRead(),
            loaded,
            tally.totalRejected(),
            tally.rejectionCounts(),
            tally.unitCorrections()
        );
        return new IngestionSummary(
            source.describe(),
            tally.rowsRead(),
            loaded,
            tally.totalRejected(),
            tally.rejectionCounts(),
            tally.sampleRejections(),
            tally.unitCorrections(),
            startedAt,
            finishedAt
        );
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }
}
