package com.wagesearch.salary.model;

import java.util.Objects;

public record ValidationOutcome(CompensationRecord record, RejectionReason rejection, boolean unitCorrected) {

    public ValidationOutcome {
        if ((record == null) == (rejection == null)) {
            throw new IllegalArgumentException("exactly one of record or rejection must be set");
        }
    }

    public static ValidationOutcome accepted(CompensationRecord record, boolean unitCorrected) {
        return new ValidationOutcome(Objects.requireNonNull(record, "record"), null, unitCorrected);
    }

    public static ValidationOutcome rejected(RejectionReason reason) {
        return new ValidationOutcome(null, Objects.requireNonNull(reason, "reason"), false);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
