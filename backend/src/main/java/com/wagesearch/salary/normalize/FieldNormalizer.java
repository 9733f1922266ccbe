package com.wagesearch.salary.normalize;

import com.wagesearch.config.WageSearchProperties;
import com.wagesearch.salary.model.CandidateFields;
import com.wagesearch.salary.model.PayUnit;
import com.wagesearch.salary.model.RawCell;
import com.wagesearch.salary.model.RawRow;
import com.wagesearch.salary.util.SearchText;
import com.wagesearch.salary.util.UsStates;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Pulls title, wage and worksite fields out of a disclosure row. Malformed values come back
 * as null; nothing here throws on bad input.
 */
@Component
public class FieldNormalizer {
    private static final Pattern AMOUNT_NOISE = Pattern.compile("[$,\\s]");
    // salary_amount is NUMERIC(20, 2)
    private static final int SALARY_SCALE = 2;
    private static final int SALARY_INTEGER_DIGITS = 18;
    private static final BigDecimal HALF_CENT = new BigDecimal("0.005");

    private final WageSearchProperties.Columns columns;

    public FieldNormalizer(WageSearchProperties properties) {
        this.columns = properties.getColumns();
    }

    public CandidateFields extract(RawRow row) {
        return new CandidateFields(
            extractTitle(row.get(columns.getTitle())),
            extractSalary(row.get(columns.getWageAmount())),
            extractUnit(row.get(columns.getWageUnit())),
            extractCity(row.get(columns.getCity())),
            extractState(row.get(columns.getState()))
        );
    }

    String extractTitle(RawCell cell) {
        if (!(cell instanceof RawCell.Text text)) {
            return null;
        }
        String title = text.value().trim();
        return SearchText.isSearchable(title) ? title : null;
    }

    BigDecimal extractSalary(RawCell cell) {
        if (cell instanceof RawCell.Numeric numeric) {
            if (Double.isNaN(numeric.value()) || Double.isInfinite(numeric.value())) {
                return null;
            }
            return storableOrNull(BigDecimal.valueOf(numeric.value()));
        }
        if (cell instanceof RawCell.Text text) {
            String cleaned = AMOUNT_NOISE.matcher(text.value()).replaceAll("");
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                return storableOrNull(new BigDecimal(cleaned));
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    PayUnit extractUnit(RawCell cell) {
        if (cell instanceof RawCell.Text text) {
            return PayUnit.fromLabel(text.value());
        }
        return null;
    }

    String extractCity(RawCell cell) {
        if (cell instanceof RawCell.Text text) {
            String city = text.value().trim();
            return city.isEmpty() ? null : city;
        }
        return null;
    }

    String extractState(RawCell cell) {
        if (cell instanceof RawCell.Text text) {
            return UsStates.canonicalize(text.value());
        }
        return null;
    }

    /** Rounds to cents; null when nothing positive is left or the integer part does not fit. */
    private BigDecimal storableOrNull(BigDecimal value) {
        if (value.compareTo(HALF_CENT) < 0 || value.precision() - value.scale() > SALARY_INTEGER_DIGITS) {
            return null;
        }
        BigDecimal cents = value.setScale(SALARY_SCALE, RoundingMode.HALF_UP);
        if (cents.precision() - cents.scale() > SALARY_INTEGER_DIGITS) {
            return null;
        }
        BigDecimal stripped = cents.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
