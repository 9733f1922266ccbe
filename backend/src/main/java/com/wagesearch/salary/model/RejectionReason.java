package com.wagesearch.salary.model;

public enum RejectionReason {
    MISSING_TITLE,
    MISSING_OR_INVALID_SALARY,
    MISSING_LOCATION
}
