package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.YearsMonths;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Statutory benefit rules that depend only on their arguments: full retirement age,
 * the claiming-age multiplier, the bend-point formula and the rounding applied between stages.
 */
public final class BenefitFormula {

    /** Maximum lifespan, in years, over which every worker series is laid out. */
    public static final int LIFESPAN = 130;
    /** Age at which benefits first become available. */
    public static final int ELIGIBILITY_AGE = 62;
    public static final YearsMonths EARLIEST_CLAIMING_AGE = YearsMonths.of(ELIGIBILITY_AGE, 0);
    /** Claiming later than this earns no further credit. */
    public static final YearsMonths LATEST_CREDITED_CLAIMING_AGE = YearsMonths.of(70, 0);

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);

    private static final int MAX_INCOME_YEARS = 35;
    private static final int INCOME_YEARS_BASE_BIRTH_YEAR = 1894;

    private static final BigDecimal FIRST_BAND_RATE = new BigDecimal("0.9");
    private static final BigDecimal SECOND_BAND_RATE = new BigDecimal("0.32");
    private static final BigDecimal THIRD_BAND_RATE = new BigDecimal("0.15");

    private static final YearsMonths REDUCED_BAND_WIDTH = YearsMonths.of(3, 0);
    private static final BigDecimal REDUCED_BAND_FLOOR = new BigDecimal("0.8");
    private static final BigDecimal REDUCED_BAND_SPAN = new BigDecimal("0.2");
    private static final BigDecimal EARLY_REDUCTION_PER_YEAR = new BigDecimal("0.05");
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal THREE = BigDecimal.valueOf(3);
    private static final BigDecimal THIRTY_SIX = BigDecimal.valueOf(36);

    // Yearly delayed retirement credit by (benefit) birth year; clamped to the table edges
    private static final NavigableMap<Integer, BigDecimal> DELAYED_CREDIT = new TreeMap<>(Map.ofEntries(
            Map.entry(1924, new BigDecimal("0.030")), Map.entry(1925, new BigDecimal("0.035")),
            Map.entry(1926, new BigDecimal("0.035")), Map.entry(1927, new BigDecimal("0.040")),
            Map.entry(1928, new BigDecimal("0.040")), Map.entry(1929, new BigDecimal("0.045")),
            Map.entry(1930, new BigDecimal("0.045")), Map.entry(1931, new BigDecimal("0.050")),
            Map.entry(1932, new BigDecimal("0.050")), Map.entry(1933, new BigDecimal("0.055")),
            Map.entry(1934, new BigDecimal("0.055")), Map.entry(1935, new BigDecimal("0.060")),
            Map.entry(1936, new BigDecimal("0.060")), Map.entry(1937, new BigDecimal("0.065")),
            Map.entry(1938, new BigDecimal("0.065")), Map.entry(1939, new BigDecimal("0.070")),
            Map.entry(1940, new BigDecimal("0.070")), Map.entry(1941, new BigDecimal("0.075")),
            Map.entry(1942, new BigDecimal("0.075")), Map.entry(1943, new BigDecimal("0.080"))
    ));

    private BenefitFormula() {
    }

    /**
     * Full retirement age by birth year (use the benefit birthday's year, so a January 1
     * birthday counts as the previous year).
     */
    public static YearsMonths fullRetirementAge(int birthYear) {
        if (birthYear <= 1937) {
            return YearsMonths.of(65, 0);
        }
        if (birthYear < 1943) {
            return YearsMonths.of(65, 2 * (birthYear - 1937));
        }
        if (birthYear <= 1954) {
            return YearsMonths.of(66, 0);
        }
        if (birthYear < 1960) {
            return YearsMonths.of(66, 2 * (birthYear - 1954));
        }
        return YearsMonths.of(67, 0);
    }

    /**
     * Number of highest indexed earnings years averaged into AIME: 35 for anyone born after 1928.
     */
    public static int maxIncomeYears(int birthYear) {
        int years = Math.min(MAX_INCOME_YEARS, birthYear - INCOME_YEARS_BASE_BIRTH_YEAR);
        if (years <= 0) {
            throw new IllegalArgumentException("no computation years for birth year " + birthYear);
        }
        return years;
    }

    public static BigDecimal delayedRetirementCredit(int birthYear) {
        if (birthYear < DELAYED_CREDIT.firstKey()) {
            return DELAYED_CREDIT.firstEntry().getValue();
        }
        if (birthYear > DELAYED_CREDIT.lastKey()) {
            return DELAYED_CREDIT.lastEntry().getValue();
        }
        return DELAYED_CREDIT.get(birthYear);
    }

    /**
     * Benefits can start at exactly (62, 0) only when the benefit birthday falls on the 1st of the
     * month (an actual birthday on the 2nd). Everyone else has to wait until (62, 1).
     */
    public static boolean canClaimAt(LocalDate calcBenefitBirthday, YearsMonths claimingAge) {
        Objects.requireNonNull(calcBenefitBirthday, "calcBenefitBirthday must not be null");
        Objects.requireNonNull(claimingAge, "claimingAge must not be null");
        if (claimingAge.compareTo(EARLIEST_CLAIMING_AGE) < 0) {
            return false;
        }
        return !claimingAge.equals(EARLIEST_CLAIMING_AGE) || calcBenefitBirthday.getDayOfMonth() == 1;
    }

    /**
     * Multiplier applied to the COLA-adjusted base benefit for the age at which benefits are claimed.
     * <p>
     * For those born 1960 or later: (62, 1) gives 0.704167, (64, 0) 0.80, (67, 0) 1.00 and (70, 0) 1.24.
     * Ages after (70, 0) earn nothing more. An age at which benefits cannot be claimed gives 0.
     *
     * @param calcBenefitBirthday the worker's birthday for benefit purposes (actual birthday - 1 day)
     * @param claimingAge         age at which benefits start
     * @return the multiplier
     */
    public static BigDecimal benefitMultiplier(LocalDate calcBenefitBirthday, YearsMonths claimingAge) {
        Objects.requireNonNull(claimingAge, "claimingAge must not be null");
        YearsMonths startAge = claimingAge.compareTo(LATEST_CREDITED_CLAIMING_AGE) >= 0
                ? LATEST_CREDITED_CLAIMING_AGE
                : claimingAge;
        if (!canClaimAt(calcBenefitBirthday, startAge)) {
            return BigDecimal.ZERO;
        }

        int birthYear = calcBenefitBirthday.getYear();
        YearsMonths fra = fullRetirementAge(birthYear);

        YearsMonths aboveFra = startAge.minus(fra);
        if (aboveFra.getYears() >= 0) {
            BigDecimal credit = delayedRetirementCredit(birthYear);
            return BigDecimal.ONE
                    .add(credit.multiply(BigDecimal.valueOf(aboveFra.getYears())))
                    .add(credit.multiply(BigDecimal.valueOf(aboveFra.getMonths())).divide(TWELVE, MATH_CONTEXT));
        }

        // Within three years of FRA each month costs 5/9 of a percent, earlier months 5/12 of a percent
        YearsMonths reducedBandStart = fra.minus(REDUCED_BAND_WIDTH);
        YearsMonths aboveBand = startAge.minus(reducedBandStart);
        if (aboveBand.getYears() >= 0) {
            return REDUCED_BAND_FLOOR
                    .add(REDUCED_BAND_SPAN.multiply(BigDecimal.valueOf(aboveBand.getYears())).divide(THREE, MATH_CONTEXT))
                    .add(REDUCED_BAND_SPAN.multiply(BigDecimal.valueOf(aboveBand.getMonths())).divide(THIRTY_SIX, MATH_CONTEXT));
        }

        YearsMonths belowBand = reducedBandStart.minus(startAge);
        return REDUCED_BAND_FLOOR
                .subtract(EARLY_REDUCTION_PER_YEAR.multiply(BigDecimal.valueOf(belowBand.getYears())))
                .subtract(EARLY_REDUCTION_PER_YEAR.multiply(BigDecimal.valueOf(belowBand.getMonths())).divide(TWELVE, MATH_CONTEXT));
    }

    /**
     * Bend-point formula: 90% of AIME up to the first bend point, 32% up to the second, 15% above.
     * The result is rounded down to the dime.
     */
    public static BigDecimal baseBenefit(BigDecimal aime, BigDecimal bendPoint1, BigDecimal bendPoint2) {
        Objects.requireNonNull(aime, "aime must not be null");
        Objects.requireNonNull(bendPoint1, "bendPoint1 must not be null");
        Objects.requireNonNull(bendPoint2, "bendPoint2 must not be null");
        if (aime.signum() < 0) {
            throw new IllegalArgumentException("aime must be >= 0");
        }

        BigDecimal benefit;
        if (aime.compareTo(bendPoint1) < 0) {
            benefit = aime.multiply(FIRST_BAND_RATE);
        } else if (aime.compareTo(bendPoint2) < 0) {
            benefit = bendPoint1.multiply(FIRST_BAND_RATE)
                    .add(aime.subtract(bendPoint1).multiply(SECOND_BAND_RATE));
        } else {
            benefit = bendPoint1.multiply(FIRST_BAND_RATE)
                    .add(bendPoint2.subtract(bendPoint1).multiply(SECOND_BAND_RATE))
                    .add(aime.subtract(bendPoint2).multiply(THIRD_BAND_RATE));
        }
        return floorToDime(benefit);
    }

    public static BigDecimal floorToDime(BigDecimal value) {
        return value.setScale(1, RoundingMode.FLOOR);
    }

    public static BigDecimal floorToDollar(BigDecimal value) {
        return value.setScale(0, RoundingMode.FLOOR);
    }
}
