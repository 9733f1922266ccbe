package com.wagesearch.salary.service;

import com.wagesearch.salary.model.CompensationQuery;
import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.IngestionSummary;
import com.wagesearch.salary.model.MatchPolicy;
import com.wagesearch.salary.model.RejectionReason;
import com.wagesearch.salary.persistence.CompensationIndex;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Stream;

import static com.wagesearch.salary.service.CompensationIngestionServiceTest.row;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CompensationIngestionStoreTest {

    @Autowired
    private CompensationIngestionService ingestionService;

    @Autowired
    private CompensationIndex index;

    @Test
    void amountsTheStoreCannotHoldAreRejectedWithoutLosingTheBatch() {
        IngestionSummary summary = ingestionService.ingest(
            () -> Stream.of(
                row(1, "Software Engineer", 120000.0, "Year", "Austin", "TX"),
                row(2, "Software Engineer", "0.001", "Year", "Austin", "TX"),
                row(3, "Software Engineer", "1e25", "Year", "Austin", "TX"),
                row(4, "Software Engineer", 130000.0, "Year", "Austin", "TX")
            ),
            true
        );

        assertThat(summary.recordsLoaded()).isEqualTo(2);
        assertThat(summary.rejections()).containsEntry(RejectionReason.MISSING_OR_INVALID_SALARY, 2L);
        assertThat(index.countAll()).isEqualTo(2);
    }

    @Test
    void longTextFieldsAreStored() {
        String longTitle = "Principal " + "Distributed Systems ".repeat(60) + "Engineer";
        String longCity = "Llanfair" + "pwllgwyngyll".repeat(30);

        IngestionSummary summary = ingestionService.ingest(
            () -> Stream.of(
                row(1, "Software Engineer", 120000.0, "Year", "Austin", "TX"),
                row(2, longTitle, 150000.0, "Year", longCity, "TX"),
                row(3, "Software Engineer", 130000.0, "Year", "Austin", "TX")
            ),
            true
        );

        assertThat(longTitle).hasSizeGreaterThan(1000);
        assertThat(summary.recordsLoaded()).isEqualTo(3);
        List<CompensationRecord> found = index.search(
            CompensationQuery.ofWords(List.of("principal"), List.of(), MatchPolicy.ALL),
            10
        );
        assertThat(found).extracting(CompensationRecord::title).containsExactly(longTitle);
        assertThat(found.get(0).city()).isEqualTo(longCity);
    }
}
