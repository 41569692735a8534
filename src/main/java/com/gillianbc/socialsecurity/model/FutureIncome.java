package com.gillianbc.socialsecurity.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Estimate of a worker's future total earnings. Either an explicit profile
 * ({@link Kind#PROFILE}) or a rule that starts from one year's amount and grows it by a
 * personal wage growth rate until a final income year ({@link Kind#NEXT}).
 * <p>
 * For the rule, a null next income year means the current year, a null growth means the
 * default personal wage growth, and a null final income year means the end of the
 * worker's statutory lifespan.
 */
@Getter
@ToString
public final class FutureIncome {

    public enum Kind { PROFILE, NEXT }

    private final Kind kind;
    private final IncomeHistory profile;
    private final Integer nextIncomeYear;
    private final NextIncomeAmount nextAmount;
    private final Projection growth;
    private final Integer finalIncomeYear;

    private FutureIncome(Kind kind, IncomeHistory profile, Integer nextIncomeYear, NextIncomeAmount nextAmount,
                         Projection growth, Integer finalIncomeYear) {
        this.kind = kind;
        this.profile = profile;
        this.nextIncomeYear = nextIncomeYear;
        this.nextAmount = nextAmount;
        this.growth = growth;
        this.finalIncomeYear = finalIncomeYear;
    }

    public static FutureIncome profile(IncomeHistory profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        return new FutureIncome(Kind.PROFILE, profile, null, null, null, null);
    }

    public static FutureIncome next(Integer nextIncomeYear, NextIncomeAmount nextAmount, Projection growth,
                                    Integer finalIncomeYear) {
        Objects.requireNonNull(nextAmount, "nextAmount must not be null");
        if (nextIncomeYear != null && finalIncomeYear != null && finalIncomeYear < nextIncomeYear) {
            throw new IllegalArgumentException("finalIncomeYear " + finalIncomeYear + " is before nextIncomeYear " + nextIncomeYear);
        }
        return new FutureIncome(Kind.NEXT, null, nextIncomeYear, nextAmount, growth, finalIncomeYear);
    }

    /**
     * Starting this year, extrapolate last year's earnings with the default personal wage growth.
     */
    public static FutureIncome extrapolateFromHistory() {
        return next(null, NextIncomeAmount.extrapolate(), null, null);
    }
}
