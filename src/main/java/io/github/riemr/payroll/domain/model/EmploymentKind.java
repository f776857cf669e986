package io.github.riemr.payroll.domain.model;

import io.github.riemr.payroll.domain.exception.UnknownEmployeeKindException;

public enum EmploymentKind {
    FULL_TIME("full-time"),
    PART_TIME("part-time");

    private final String code;

    EmploymentKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Exact match on the stored code; anything else is a data-integrity error. */
    public static EmploymentKind fromCode(String code) {
        for (EmploymentKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new UnknownEmployeeKindException(code);
    }

    public static boolean isKnown(String code) {
        for (EmploymentKind kind : values()) {
            if (kind.code.equals(code)) return true;
        }
        return false;
    }
}
