package com.wagesearch.salary.normalize;

import com.wagesearch.config.WageSearchProperties;
import com.wagesearch.salary.model.CandidateFields;
import com.wagesearch.salary.model.PayUnit;
import com.wagesearch.salary.model.RawCell;
import com.wagesearch.salary.model.RawRow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizerTest {
    private final FieldNormalizer normalizer = new FieldNormalizer(new WageSearchProperties());

    @Test
    void extractsAllFieldsFromDisclosureColumns() {
        CandidateFields fields = normalizer.extract(row("Software Engineer", 125000.0, "Year", "Austin", "TX"));

        assertThat(fields.title()).isEqualTo("Software Engineer");
        assertThat(fields.salaryAmount()).isEqualByComparingTo("125000");
        assertThat(fields.payUnit()).isEqualTo(PayUnit.YEARLY);
        assertThat(fields.city()).isEqualTo("Austin");
        assertThat(fields.state()).isEqualTo("Texas");
    }

    @Test
    void blankOrDigitOnlyTitleIsAbsent() {
        assertThat(normalizer.extract(row("   ", 50.0, "Hour", "Austin", "TX")).title()).isNull();
        assertThat(normalizer.extract(row(null, 50.0, "Hour", "Austin", "TX")).title()).isNull();
        assertThat(normalizer.extract(row("1234", 50.0, "Hour", "Austin", "TX")).title()).isNull();
        assertThat(normalizer.extract(row(1234.0, 50.0, "Hour", "Austin", "TX")).title()).isNull();
    }

    @Test
    void titleIsKeptVerbatimApartFromTrimming() {
        assertThat(normalizer.extract(row("  Sr. Data-Scientist (ML) ", 50.0, "Hour", "Austin", "TX")).title())
            .isEqualTo("Sr. Data-Scientist (ML)");
    }

    @Test
    void salaryTextIsParsedAndMalformedValuesAreAbsent() {
        assertThat(normalizer.extract(row("Analyst", "$85,000.50", "Year", "Austin", "TX")).salaryAmount())
            .isEqualByComparingTo("85000.50");
        assertThat(normalizer.extract(row("Analyst", "eighty", "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", "-10", "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", 0.0, "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", Double.NaN, "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", null, "Year", "Austin", "TX")).salaryAmount()).isNull();
    }

    @Test
    void salaryIsRoundedToCentsAndMustFitTheStore() {
        assertThat(normalizer.extract(row("Analyst", "0.001", "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", 0.004, "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", "0.005", "Hour", "Austin", "TX")).salaryAmount())
            .isEqualByComparingTo("0.01");
        assertThat(normalizer.extract(row("Analyst", "21.456", "Hour", "Austin", "TX")).salaryAmount())
            .isEqualByComparingTo("21.46");
        assertThat(normalizer.extract(row("Analyst", "1e25", "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", 1.0e19, "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", "1e999999999", "Year", "Austin", "TX")).salaryAmount()).isNull();
        assertThat(normalizer.extract(row("Analyst", "999999999999999999.99", "Year", "Austin", "TX")).salaryAmount())
            .isEqualByComparingTo("999999999999999999.99");
    }

    @Test
    void unitLabelsAreRecognizedCaseInsensitively() {
        assertThat(normalizer.extract(row("Analyst", 40.0, "hour", "Austin", "TX")).payUnit()).isEqualTo(PayUnit.HOURLY);
        assertThat(normalizer.extract(row("Analyst", 40.0, "Bi-Weekly", "Austin", "TX")).payUnit())
            .isEqualTo(PayUnit.BI_WEEKLY);
        assertThat(normalizer.extract(row("Analyst", 40.0, " MONTH ", "Austin", "TX")).payUnit())
            .isEqualTo(PayUnit.MONTHLY);
        assertThat(normalizer.extract(row("Analyst", 40.0, "fortnight", "Austin", "TX")).payUnit()).isNull();
        assertThat(normalizer.extract(row("Analyst", 40.0, 7.0, "Austin", "TX")).payUnit()).isNull();
    }

    @Test
    void stateAbbreviationsExpandAndUnknownValuesPassThrough() {
        assertThat(normalizer.extract(row("Analyst", 40.0, "Hour", "Fresno", "CA")).state()).isEqualTo("California");
        assertThat(normalizer.extract(row("Analyst", 40.0, "Hour", "Fresno", "California")).state())
            .isEqualTo("California");
        assertThat(normalizer.extract(row("Analyst", 40.0, "Hour", "Toronto", "ON")).state()).isEqualTo("ON");
        assertThat(normalizer.extract(row("Analyst", 40.0, "Hour", "Fresno", " ")).state()).isNull();
    }

    @Test
    void blankCityIsAbsent() {
        CandidateFields fields = normalizer.extract(row("Analyst", 40.0, "Hour", "  ", "WA"));
        assertThat(fields.city()).isNull();
        assertThat(fields.state()).isEqualTo("Washington");
        assertThat(fields.hasLocation()).isTrue();
    }

    @Test
    void columnLookupIgnoresHeaderCaseAndMissingColumnsAreAbsent() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("job_title", "Nurse");
        values.put(" Worksite_City_1 ", "Boston");
        RawRow raw = RawRow.of(3, values);

        CandidateFields fields = normalizer.extract(raw);
        assertThat(fields.title()).isEqualTo("Nurse");
        assertThat(fields.city()).isEqualTo("Boston");
        assertThat(fields.salaryAmount()).isNull();
        assertThat(fields.payUnit()).isNull();
        assertThat(raw.get("WAGE_UNIT_OF_PAY_1")).isEqualTo(RawCell.ABSENT);
    }

    @Test
    void alternateWageColumnsAreIgnored() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("JOB_TITLE", "Nurse");
        values.put("WORKSITE_CITY_1", "Boston");
        values.put("WAGE_RATE_OF_PAY_FROM_2", 90000.0);
        values.put("WAGE_UNIT_OF_PAY_2", "Year");

        CandidateFields fields = normalizer.extract(RawRow.of(4, values));
        assertThat(fields.hasSalary()).isFalse();
    }

    @Test
    void customColumnNamesAreHonored() {
        WageSearchProperties properties = new WageSearchProperties();
        properties.getColumns().setTitle("TITLE");
        properties.getColumns().setWageAmount("PAY");
        FieldNormalizer custom = new FieldNormalizer(properties);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("TITLE", "Chef");
        values.put("PAY", new BigDecimal("31.5"));
        values.put("WAGE_UNIT_OF_PAY_1", "Hour");
        values.put("WORKSITE_STATE_1", "nv");

        CandidateFields fields = custom.extract(RawRow.of(1, values));
        assertThat(fields.title()).isEqualTo("Chef");
        assertThat(fields.salaryAmount()).isEqualByComparingTo("31.5");
        assertThat(fields.state()).isEqualTo("Nevada");
    }

    static RawRow row(Object title, Object wage, Object unit, Object city, Object state) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("JOB_TITLE", title);
        values.put("WAGE_RATE_OF_PAY_FROM_1", wage);
        values.put("WAGE_UNIT_OF_PAY_1", unit);
        values.put("WORKSITE_CITY_1", city);
        values.put("WORKSITE_STATE_1", state);
        return RawRow.of(1, values);
    }
}
