package com.wagesearch.salary.service;

import com.wagesearch.config.WageSearchProperties;
import com.wagesearch.salary.model.IngestionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Fills an empty compensation index from the configured data file at startup.
 */
@Component
public class WageDataLoadRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(WageDataLoadRunner.class);

    private final WageSearchProperties properties;
    private final CompensationIngestionService ingestionService;

    public WageDataLoadRunner(WageSearchProperties properties, CompensationIngestionService ingestionService) {
        this.properties = properties;
        this.ingestionService = ingestionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getIngest().isLoadOnStartup()) {
            return;
        }
        Optional<IngestionSummary> summary;
        try {
            summary = ingestionService.loadIfEmpty();
        } catch (IngestionFailedException e) {
            log.error("Startup load failed: {}", e.getMessage());
            throw e;
        }
        summary.ifPresent(result -> log.info(
            "Startup load finished: recordsLoaded={}, rejected={}, source={}",
            result.recordsLoaded(),
            result.rejectedCount(),
            result.source()
        ));
    }
}
