package com.gillianbc.socialsecurity.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Snapshot of a worker's benefit inputs: AIME plus the base benefit and its bend points.
 */
@Getter
@ToString
@EqualsAndHashCode
public class BenefitInfo {

    @NonNull private final BigDecimal aime;
    @NonNull private final BaseBenefit baseBenefit;

    public BenefitInfo(BigDecimal aime, BaseBenefit baseBenefit) {
        this.aime = Objects.requireNonNull(aime, "aime must not be null");
        this.baseBenefit = Objects.requireNonNull(baseBenefit, "baseBenefit must not be null");
    }

    public BigDecimal getBendPoint1() {
        return baseBenefit.getBendPoint1();
    }

    public BigDecimal getBendPoint2() {
        return baseBenefit.getBendPoint2();
    }
}
