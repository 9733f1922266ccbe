package com.wagesearch.salary.persistence;

import com.wagesearch.salary.model.CompensationQuery;
import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.MatchPolicy;
import com.wagesearch.salary.model.PayUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcCompensationIndexTest {

    @Autowired
    private JdbcCompensationIndex index;

    @BeforeEach
    void setUp() {
        index.clear();
        index.load(List.of(
            record("Senior Software Engineer", "140000", PayUnit.YEARLY, "Austin", "Texas"),
            record("Software Engineer", "65", PayUnit.HOURLY, "Seattle", "Washington"),
            record("Engineering Manager", "175000", PayUnit.YEARLY, "Austin", "Texas"),
            record("Data Analyst", "5500", PayUnit.MONTHLY, null, "Colorado"),
            record("Business Analyst", "88000", PayUnit.YEARLY, "Denver", null),
            record("Nurse", "72000", PayUnit.YEARLY, "La Crosse", "Wisconsin"),
            record("Nurse", "91000", PayUnit.YEARLY, "Shreveport", "Louisiana")
        ));
    }

    @Test
    void storesRecordsAsLoaded() {
        assertThat(index.countAll()).isEqualTo(7);
        assertThat(index.isReachable()).isTrue();

        List<CompensationRecord> found = index.search(query(List.of("data"), List.of(), MatchPolicy.ALL), 10);

        assertThat(found).hasSize(1);
        CompensationRecord record = found.get(0);
        assertThat(record.title()).isEqualTo("Data Analyst");
        assertThat(record.salaryAmount()).isEqualByComparingTo("5500");
        assertThat(record.payUnit()).isEqualTo(PayUnit.MONTHLY);
        assertThat(record.city()).isNull();
        assertThat(record.state()).isEqualTo("Colorado");
    }

    @Test
    void titleWordsMatchInAnyOrder() {
        CompensationQuery reversed = query(List.of("engineer", "software"), List.of(), MatchPolicy.ALL);

        assertThat(index.search(reversed, 10))
            .extracting(CompensationRecord::title)
            .containsExactly("Senior Software Engineer", "Software Engineer");
    }

    @Test
    void termsMatchWholeWordsOnly() {
        assertThat(index.count(query(List.of("engineer"), List.of(), MatchPolicy.ALL))).isEqualTo(2);
        assertThat(index.count(query(List.of("engine"), List.of(), MatchPolicy.ALL))).isZero();
    }

    @Test
    void locationMatchesCityAndStateTogether() {
        assertThat(index.count(query(List.of(), List.of("austin", "texas"), MatchPolicy.ALL))).isEqualTo(2);
        assertThat(index.count(query(List.of(), List.of("texas"), MatchPolicy.ALL))).isEqualTo(2);
        assertThat(index.count(query(List.of(), List.of("denver"), MatchPolicy.ALL))).isEqualTo(1);
        assertThat(index.count(query(List.of(), List.of("austin", "washington"), MatchPolicy.ALL))).isZero();
    }

    @Test
    void titleAndLocationMustBothMatch() {
        CompensationQuery query = query(List.of("software", "engineer"), List.of("austin"), MatchPolicy.ALL);

        assertThat(index.search(query, 10))
            .extracting(CompensationRecord::title)
            .containsExactly("Senior Software Engineer");
    }

    @Test
    void anyPolicyRanksRecordsMatchingMoreWordsFirst() {
        CompensationQuery query = query(List.of("business", "analyst"), List.of(), MatchPolicy.ANY);

        assertThat(index.count(query)).isEqualTo(2);
        assertThat(index.search(query, 10))
            .extracting(CompensationRecord::title)
            .containsExactly("Business Analyst", "Data Analyst");
    }

    @Test
    void unfilteredQueryMatchesEverything() {
        CompensationQuery everything = query(List.of(), List.of(), MatchPolicy.ALL);

        assertThat(index.count(everything)).isEqualTo(index.countAll());
        assertThat(index.search(everything, 3)).hasSize(3);
        assertThat(index.search(everything, 0)).isEmpty();
    }

    @Test
    void termAlternativesMatchEitherWord() {
        CompensationQuery laCrosse = new CompensationQuery(
            List.of("nurse"),
            List.of(List.of("la", "louisiana"), List.of("crosse"), List.of("wi", "wisconsin")),
            MatchPolicy.ALL
        );
        CompensationQuery louisiana = new CompensationQuery(
            List.of("nurse"),
            List.of(List.of("la", "louisiana")),
            MatchPolicy.ALL
        );

        assertThat(index.search(laCrosse, 10)).extracting(CompensationRecord::city).containsExactly("La Crosse");
        assertThat(index.search(louisiana, 10))
            .extracting(CompensationRecord::city)
            .containsExactly("La Crosse", "Shreveport");
    }

    @Test
    void multiWordAlternativeMatchesAsAPhrase() {
        CompensationQuery phrase = new CompensationQuery(List.of(), List.of(List.of("lc", "la crosse")), MatchPolicy.ALL);
        CompensationQuery reversed = new CompensationQuery(List.of(), List.of(List.of("crosse la")), MatchPolicy.ALL);

        assertThat(index.search(phrase, 10)).extracting(CompensationRecord::city).containsExactly("La Crosse");
        assertThat(index.count(reversed)).isZero();
    }

    @Test
    void forEachMatchStopsAtTheCap() {
        List<CompensationRecord> seen = new ArrayList<>();

        index.forEachMatch(query(List.of(), List.of(), MatchPolicy.ALL), 3, seen::add);

        assertThat(seen).hasSize(3);
    }

    @Test
    void clearEmptiesTheIndex() {
        index.clear();

        assertThat(index.countAll()).isZero();
    }

    private CompensationQuery query(List<String> titleTerms, List<String> locationTerms, MatchPolicy policy) {
        return CompensationQuery.ofWords(titleTerms, locationTerms, policy);
    }

    private CompensationRecord record(String title, String amount, PayUnit unit, String city, String state) {
        return new CompensationRecord(title, new BigDecimal(amount), unit, city, state);
    }
}
