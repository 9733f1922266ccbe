package com.wagesearch.salary.normalize;

import com.wagesearch.salary.model.CandidateFields;
import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.PayUnit;
import com.wagesearch.salary.model.RejectionReason;
import com.wagesearch.salary.model.ValidationOutcome;
import org.springframework.stereotype.Component;

@Component
public class RecordValidator {
    private final AnnualizationPolicy annualizationPolicy;

    public RecordValidator(AnnualizationPolicy annualizationPolicy) {
        this.annualizationPolicy = annualizationPolicy;
    }

    public ValidationOutcome validate(CandidateFields candidate) {
        if (!candidate.hasTitle()) {
            return ValidationOutcome.rejected(RejectionReason.MISSING_TITLE);
        }
        if (!candidate.hasSalary()) {
            return ValidationOutcome.rejected(RejectionReason.MISSING_OR_INVALID_SALARY);
        }
        if (!candidate.hasLocation()) {
            return ValidationOutcome.rejected(RejectionReason.MISSING_LOCATION);
        }

        // The amount is trusted; only a unit implying an absurd annual figure is replaced.
        PayUnit unit = annualizationPolicy.correctUnit(candidate.salaryAmount(), candidate.payUnit());
        CompensationRecord record = new CompensationRecord(
            candidate.title(),
            candidate.salaryAmount(),
            unit,
            candidate.city(),
            candidate.state()
        );
        return ValidationOutcome.accepted(record, unit != candidate.payUnit());
    }
}
