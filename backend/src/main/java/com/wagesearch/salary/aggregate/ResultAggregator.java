package com.wagesearch.salary.aggregate;

import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.SalaryStatistics;
import com.wagesearch.salary.normalize.AnnualizationPolicy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Salary statistics over matching records. Every amount is annualized first, so hourly and
 * yearly records can be compared; the records themselves are left untouched.
 */
@Component
public class ResultAggregator {
    private static final int SCALE = 2;
    private static final BigDecimal P25 = new BigDecimal("0.25");
    private static final BigDecimal P50 = new BigDecimal("0.50");
    private static final BigDecimal P75 = new BigDecimal("0.75");

    private final AnnualizationPolicy annualizationPolicy;

    public ResultAggregator(AnnualizationPolicy annualizationPolicy) {
        this.annualizationPolicy = annualizationPolicy;
    }

    public SalaryStatistics aggregate(Iterable<CompensationRecord> records) {
        Accumulator accumulator = newAccumulator();
        records.forEach(accumulator);
        return accumulator.result();
    }

    public Accumulator newAccumulator() {
        return new Accumulator();
    }

    public class Accumulator implements Consumer<CompensationRecord> {
        private final List<BigDecimal> annualSalaries = new ArrayList<>();
        private BigDecimal sum = BigDecimal.ZERO;

        private Accumulator() {
        }

        @Override
        public void accept(CompensationRecord record) {
            BigDecimal annual = annualizationPolicy.annualize(record.salaryAmount(), record.payUnit());
            annualSalaries.add(annual);
            sum = sum.add(annual);
        }

        public int size() {
            return annualSalaries.size();
        }

        public SalaryStatistics result() {
            if (annualSalaries.isEmpty()) {
                return SalaryStatistics.empty();
            }
            List<BigDecimal> sorted = new ArrayList<>(annualSalaries);
            Collections.sort(sorted);
            BigDecimal count = BigDecimal.valueOf(sorted.size());
            return new SalaryStatistics(
                sorted.size(),
                scaled(sorted.get(0)),
                scaled(sorted.get(sorted.size() - 1)),
                sum.divide(count, SCALE, RoundingMode.HALF_UP),
                scaled(percentile(sorted, P50)),
                scaled(percentile(sorted, P25)),
                scaled(percentile(sorted, P75))
            );
        }
    }

    /** Linear interpolation between the closest ranks of an ascending list. */
    static BigDecimal percentile(List<BigDecimal> sorted, BigDecimal fraction) {
        BigDecimal position = fraction.multiply(BigDecimal.valueOf(sorted.size() - 1L));
        int lower = position.setScale(0, RoundingMode.FLOOR).intValueExact();
        int upper = Math.min(lower + 1, sorted.size() - 1);
        BigDecimal weight = position.subtract(BigDecimal.valueOf(lower));
        BigDecimal low = sorted.get(lower);
        BigDecimal high = sorted.get(upper);
        return low.add(high.subtract(low).multiply(weight));
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
