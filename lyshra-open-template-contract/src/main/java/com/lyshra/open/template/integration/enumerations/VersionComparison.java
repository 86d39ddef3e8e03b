package com.lyshra.open.template.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum VersionComparison {

    LESS_THAN(-1),
    EQUAL(0),
    GREATER_THAN(1)

    ;

    private final int sign;

    public static VersionComparison of(int compareResult) {
        if (compareResult < 0) {
            return LESS_THAN;
        }
        return compareResult > 0 ? GREATER_THAN : EQUAL;
    }
}
