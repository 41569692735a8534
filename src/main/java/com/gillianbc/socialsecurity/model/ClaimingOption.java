package com.gillianbc.socialsecurity.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Monthly benefit a worker would receive in a given month when claiming at a given age.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ClaimingOption {

    @NonNull private final YearsMonths claimingAge;
    @NonNull private final BigDecimal multiplier;
    @NonNull private final BigDecimal monthlyBenefit;

    public ClaimingOption(YearsMonths claimingAge, BigDecimal multiplier, BigDecimal monthlyBenefit) {
        this.claimingAge = Objects.requireNonNull(claimingAge, "claimingAge must not be null");
        this.multiplier = Objects.requireNonNull(multiplier, "multiplier must not be null");
        this.monthlyBenefit = Objects.requireNonNull(monthlyBenefit, "monthlyBenefit must not be null");
    }
}
