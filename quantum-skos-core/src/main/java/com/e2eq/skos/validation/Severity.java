package com.e2eq.skos.validation;

public enum Severity {
    /** Breaks a SKOS integrity condition. */
    VIOLATION,
    /** Quality concern. */
    WARNING,
    /** Inferable gap; not a defect. */
    INFO
}
