package com.wagesearch.config;

import com.wagesearch.salary.model.MatchPolicy;
import com.wagesearch.salary.model.PayUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "wage-search")
public class WageSearchProperties {
    private Data data = new Data();
    private Columns columns = new Columns();
    private Normalization normalization = new Normalization();
    private Ingest ingest = new Ingest();
    private Query query = new Query();

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Columns getColumns() {
        return columns;
    }

    public void setColumns(Columns columns) {
        this.columns = columns;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public void setNormalization(Normalization normalization) {
        this.normalization = normalization;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    private static String columnOrDefault(String candidate, String fallback) {
        if (candidate == null || candidate.isBlank()) {
            return fallback;
        }
        return candidate.trim();
    }

    public static class Data {
        private String file = "../data/lca_disclosure.xlsx";
        private String format = "auto";
        private String sheet;

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getFormat() {
            return format == null || format.isBlank() ? "auto" : format.trim().toLowerCase(Locale.ROOT);
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public String getSheet() {
            return sheet;
        }

        public void setSheet(String sheet) {
            this.sheet = sheet;
        }
    }

    /**
     * Source column names. Only the first wage columns of the LCA layout are read; the
     * numbered alternates ({@code _2}, {@code _3}, ...) are sparsely populated.
     */
    public static class Columns {
        private String title = "JOB_TITLE";
        private String city = "WORKSITE_CITY_1";
        private String state = "WORKSITE_STATE_1";
        private String wageAmount = "WAGE_RATE_OF_PAY_FROM_1";
        private String wageUnit = "WAGE_UNIT_OF_PAY_1";

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = columnOrDefault(title, "JOB_TITLE");
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = columnOrDefault(city, "WORKSITE_CITY_1");
        }

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = columnOrDefault(state, "WORKSITE_STATE_1");
        }

        public String getWageAmount() {
            return wageAmount;
        }

        public void setWageAmount(String wageAmount) {
            this.wageAmount = columnOrDefault(wageAmount, "WAGE_RATE_OF_PAY_FROM_1");
        }

        public String getWageUnit() {
            return wageUnit;
        }

        public void setWageUnit(String wageUnit) {
            this.wageUnit = columnOrDefault(wageUnit, "WAGE_UNIT_OF_PAY_1");
        }
    }

    public static class Normalization {
        private static final BigDecimal DEFAULT_HIGH_ANNUAL_THRESHOLD = new BigDecimal("10000000");

        private BigDecimal highAnnualThreshold = DEFAULT_HIGH_ANNUAL_THRESHOLD;
        private Map<PayUnit, BigDecimal> annualizationFactors = new EnumMap<>(PayUnit.class);

        public BigDecimal getHighAnnualThreshold() {
            return highAnnualThreshold;
        }

        public void setHighAnnualThreshold(BigDecimal highAnnualThreshold) {
            if (highAnnualThreshold == null || highAnnualThreshold.signum() <= 0) {
                this.highAnnualThreshold = DEFAULT_HIGH_ANNUAL_THRESHOLD;
                return;
            }
            this.highAnnualThreshold = highAnnualThreshold;
        }

        public Map<PayUnit, BigDecimal> getAnnualizationFactors() {
            return annualizationFactors;
        }

        public void setAnnualizationFactors(Map<PayUnit, BigDecimal> annualizationFactors) {
            this.annualizationFactors = annualizationFactors == null
                ? new EnumMap<>(PayUnit.class)
                : annualizationFactors;
        }
    }

    public static class Ingest {
        private int batchSize = 1000;
        private boolean loadOnStartup = false;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }
    }

    public static class Query {
        private MatchPolicy matchPolicy = MatchPolicy.ALL;
        private boolean expandStateAbbreviations = true;
        private int aggregationCap = 1_000_000;
        private int maxRecords = 500;

        public MatchPolicy getMatchPolicy() {
            return matchPolicy == null ? MatchPolicy.ALL : matchPolicy;
        }

        public void setMatchPolicy(MatchPolicy matchPolicy) {
            this.matchPolicy = matchPolicy;
        }

        public boolean isExpandStateAbbreviations() {
            return expandStateAbbreviations;
        }

        public void setExpandStateAbbreviations(boolean expandStateAbbreviations) {
            this.expandStateAbbreviations = expandStateAbbreviations;
        }

        public int getAggregationCap() {
            return Math.max(1, aggregationCap);
        }

        public void setAggregationCap(int aggregationCap) {
            this.aggregationCap = Math.max(1, aggregationCap);
        }

        public int getMaxRecords() {
            return Math.max(0, maxRecords);
        }

        public void setMaxRecords(int maxRecords) {
            this.maxRecords = Math.max(0, maxRecords);
        }
    }
}
