package com.wagesearch.salary.service;

import com.wagesearch.salary.aggregate.ResultAggregator;
import com.wagesearch.salary.model.CompensationQuery;
import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.SalarySearchResponse;
import com.wagesearch.salary.model.SalaryStatistics;
import com.wagesearch.salary.model.StatusResponse;
import com.wagesearch.salary.persistence.CompensationIndex;
import com.wagesearch.salary.query.QueryTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SalaryQueryService {
    private static final Logger log = LoggerFactory.getLogger(SalaryQueryService.class);

    private final QueryTranslator queryTranslator;
    private final CompensationIndex index;
    private final ResultAggregator resultAggregator;
    private final CompensationIngestionService ingestionService;

    public SalaryQueryService(
        QueryTranslator queryTranslator,
        CompensationIndex index,
        ResultAggregator resultAggregator,
        CompensationIngestionService ingestionService
    ) {
        this.queryTranslator = queryTranslator;
        this.index = index;
        this.resultAggregator = resultAggregator;
        this.ingestionService = ingestionService;
    }

    public SalarySearchResponse search(String title, String location, Integer records) {
        String safeTitle = title == null ? "" : title.trim();
        String safeLocation = location == null ? "" : location.trim();
        CompensationQuery query = queryTranslator.translate(safeTitle, safeLocation);

        long total = index.count(query);
        ResultAggregator.Accumulator accumulator = resultAggregator.newAccumulator();
        if (total > 0) {
            index.forEachMatch(query, queryTranslator.aggregationCap(), accumulator);
        }
        SalaryStatistics statistics = accumulator.result();
        boolean truncated = total > accumulator.size();
        if (truncated) {
            statistics = new SalaryStatistics(
                total,
                statistics.minSalary(),
                statistics.maxSalary(),
                statistics.meanSalary(),
                statistics.medianSalary(),
                statistics.percentile25(),
                statistics.percentile75()
            );
        }
        List<CompensationRecord> sample = index.search(query, queryTranslator.recordLimit(records));
        log.debug(
            "Salary search title={} location={} matched={} aggregated={}",
            query.titleTerms(),
            query.locationTerms(),
            total,
            accumulator.size()
        );
        return new SalarySearchResponse(safeTitle, safeLocation, query.matchPolicy(), statistics, truncated, sample);
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = index.isReachable();
        } catch (DataAccessException e) {
            log.warn("Compensation index unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, 0L, ingestionService.getLastSummary());
        }
        return new StatusResponse(true, index.countAll(), ingestionService.getLastSummary());
    }
}
