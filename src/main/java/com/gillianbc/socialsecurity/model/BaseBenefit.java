package com.gillianbc.socialsecurity.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable result of the bend-point formula: the monthly benefit at full retirement age,
 * in the dollars of the worker's age-62 year, together with the bend points it was computed with.
 */
@Getter
@ToString
@EqualsAndHashCode
public class BaseBenefit {

    @NonNull private final BigDecimal benefit;
    @NonNull private final BigDecimal bendPoint1;
    @NonNull private final BigDecimal bendPoint2;

    /**
     * Explicit validating constructor with clear parameter order:
     * (benefit, bendPoint1, bendPoint2)
     */
    public BaseBenefit(BigDecimal benefit, BigDecimal bendPoint1, BigDecimal bendPoint2) {
        this.benefit = Objects.requireNonNull(benefit, "benefit must not be null");
        this.bendPoint1 = Objects.requireNonNull(bendPoint1, "bendPoint1 must not be null");
        this.bendPoint2 = Objects.requireNonNull(bendPoint2, "bendPoint2 must not be null");
        if (benefit.signum() < 0) {
            throw new IllegalArgumentException("benefit must be >= 0");
        }
        if (bendPoint2.compareTo(bendPoint1) < 0) {
            throw new IllegalArgumentException("bendPoint2 must be >= bendPoint1");
        }
    }
}
