package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.FutureIncome;
import com.gillianbc.socialsecurity.model.IncomeHistory;
import com.gillianbc.socialsecurity.model.NextIncomeAmount;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.YearSeries;
import com.gillianbc.socialsecurity.model.YearsMonths;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A worker's yearly earnings from birth to the end of the statutory lifespan, and the AIME
 * derived from them.
 * <p>
 * Two series are kept: total earnings and Social Security earnings (total capped at the
 * maximum taxable wage). Years before the current year come from the history, later years
 * from the future income estimate. Both stop at retirement; the retirement year keeps the
 * share of its earnings made before the retirement month. Everything is recomputed whenever
 * the retirement age or future income changes.
 */
@Slf4j
public class WorkerEarnings {

    /** Age from which a {@code USE_MAX} history starts earning the maximum wage. */
    public static final int START_MAX_INCOME_AGE = 22;
    public static final BigDecimal DEFAULT_PERSONAL_WAGE_GROWTH = new BigDecimal("0.02912");

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final SocialSecurityConfig config;
    private final int birthYear;
    private final LocalDate calcBenefitBirthday;
    private final int lastYear;

    private final YearSeries historyTotal = new YearSeries();
    private final YearSeries historyCapped = new YearSeries();

    private FutureIncome futureIncome;
    private YearsMonths retirementAge;

    private YearSeries totalEarnings = new YearSeries();
    private YearSeries ssEarnings = new YearSeries();
    private YearSeries indexedEarnings = new YearSeries();
    private BigDecimal aime = BigDecimal.ZERO;

    /**
     * @param config        configuration supplying maximum wages and index factors
     * @param birthday      actual birthday
     * @param history       earnings before the current year
     * @param futureIncome  estimate of earnings from the current year on
     * @param retirementAge age at which the worker stops earning
     */
    public WorkerEarnings(SocialSecurityConfig config, LocalDate birthday, IncomeHistory history,
                          FutureIncome futureIncome, YearsMonths retirementAge) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(birthday, "birthday must not be null");
        this.birthYear = birthday.getYear();
        this.calcBenefitBirthday = birthday.minusDays(1);
        this.lastYear = birthYear + BenefitFormula.LIFESPAN;
        this.futureIncome = Objects.requireNonNull(futureIncome, "futureIncome must not be null");
        this.retirementAge = Objects.requireNonNull(retirementAge, "retirementAge must not be null");
        loadHistory(Objects.requireNonNull(history, "history must not be null"));
        recalculate();
    }

    public void setFutureIncome(FutureIncome futureIncome) {
        this.futureIncome = Objects.requireNonNull(futureIncome, "futureIncome must not be null");
        recalculate();
    }

    public void setRetirementAge(YearsMonths retirementAge) {
        this.retirementAge = Objects.requireNonNull(retirementAge, "retirementAge must not be null");
        recalculate();
    }

    private void loadHistory(IncomeHistory history) {
        int currentYear = config.getCurrentYear();
        switch (history.getKind()) {
            case MAPPING -> history.getMapping().forEach((year, amount) -> {
                if (year >= birthYear && year < currentYear) {
                    historyTotal.put(year, amount);
                }
            });
            case SEQUENCE -> {
                List<BigDecimal> amounts = history.getSequence();
                for (int i = 0; i < amounts.size() && birthYear + i < currentYear; i++) {
                    historyTotal.put(birthYear + i, amounts.get(i));
                }
            }
            case USE_MAX -> {
                for (int year = birthYear + START_MAX_INCOME_AGE; year < currentYear; year++) {
                    historyTotal.put(year, config.getMaxWage(year));
                }
            }
            case NONE -> {
            }
            default -> throw new IllegalStateException("Unhandled income history kind " + history.getKind());
        }

        for (int year = birthYear; year < currentYear; year++) {
            BigDecimal amount = historyTotal.getOrDefault(year, BigDecimal.ZERO);
            historyCapped.put(year, amount.min(config.getMaxWage(year)));
        }
    }

    private void recalculate() {
        int currentYear = config.getCurrentYear();
        YearSeries futureTotal = buildFutureTotal(currentYear);

        YearSeries total = new YearSeries();
        YearSeries capped = new YearSeries();
        for (int year = birthYear; year <= lastYear; year++) {
            if (historyCapped.contains(year)) {
                total.put(year, historyCapped.get(year));
                capped.put(year, historyCapped.get(year));
            } else {
                BigDecimal amount = futureTotal.getOrDefault(year, BigDecimal.ZERO);
                total.put(year, amount);
                capped.put(year, amount.min(config.getMaxWage(year)));
            }
        }

        LocalDate retirementDate = getRetirementDate();
        int retirementYear = retirementDate.getYear();
        for (int year = Math.max(birthYear, retirementYear); year <= lastYear; year++) {
            if (year == retirementYear) {
                BigDecimal worked = BigDecimal.valueOf(retirementDate.getMonthValue() - 1L);
                BigDecimal prorated = total.get(year).multiply(worked).divide(MONTHS_PER_YEAR, 0, RoundingMode.FLOOR);
                total.put(year, prorated);
                capped.put(year, capped.get(year).min(prorated));
            } else {
                total.put(year, BigDecimal.ZERO);
                capped.put(year, BigDecimal.ZERO);
            }
        }

        totalEarnings = total;
        ssEarnings = capped;
        indexEarnings();
    }

    private YearSeries buildFutureTotal(int currentYear) {
        YearSeries future = new YearSeries();
        switch (futureIncome.getKind()) {
            case PROFILE -> loadFutureProfile(futureIncome.getProfile(), currentYear, future);
            case NEXT -> projectFromNextYear(currentYear, future);
            default -> throw new IllegalStateException("Unhandled future income kind " + futureIncome.getKind());
        }
        return future;
    }

    private void loadFutureProfile(IncomeHistory profile, int currentYear, YearSeries future) {
        switch (profile.getKind()) {
            case MAPPING -> profile.getMapping().forEach((year, amount) -> {
                if (year >= currentYear && year <= lastYear) {
                    future.put(year, amount);
                }
            });
            case SEQUENCE -> {
                List<BigDecimal> amounts = profile.getSequence();
                for (int i = 0; i < amounts.size() && currentYear + i <= lastYear; i++) {
                    future.put(currentYear + i, amounts.get(i));
                }
            }
            case USE_MAX -> {
                for (int year = currentYear; year <= lastYear; year++) {
                    future.put(year, config.getMaxWage(year));
                }
            }
            case NONE -> {
            }
            default -> throw new IllegalStateException("Unhandled income profile kind " + profile.getKind());
        }
    }

    private void projectFromNextYear(int currentYear, YearSeries future) {
        int nextYear = futureIncome.getNextIncomeYear() != null ? futureIncome.getNextIncomeYear() : currentYear;
        int finalYear = futureIncome.getFinalIncomeYear() != null ? futureIncome.getFinalIncomeYear() : lastYear;
        if (finalYear < nextYear) {
            throw new IllegalArgumentException("final income year " + finalYear + " is before next income year " + nextYear);
        }
        Projection growthProjection = futureIncome.getGrowth() != null
                ? futureIncome.getGrowth()
                : Projection.scalar(DEFAULT_PERSONAL_WAGE_GROWTH);
        YearSeries growth = ProjectionResolver.resolve(Math.min(nextYear, currentYear), finalYear, growthProjection, BigDecimal.ZERO);

        NextIncomeAmount nextAmount = futureIncome.getNextAmount();
        BigDecimal first = switch (nextAmount.getKind()) {
            case AMOUNT -> nextAmount.getAmount();
            case USE_MAX -> config.getMaxWage(nextYear);
            case EXTRAPOLATE -> grow(historyTotal.getOrDefault(nextYear - 1, BigDecimal.ZERO), growth.get(nextYear));
        };
        future.put(nextYear, first);

        for (int year = nextYear + 1; year <= finalYear; year++) {
            BigDecimal amount = nextAmount.getKind() == NextIncomeAmount.Kind.USE_MAX
                    ? config.getMaxWage(year)
                    : grow(future.get(year - 1), growth.get(year));
            future.put(year, amount);
        }
        log.debug("Projected earnings {}..{} starting from {}", nextYear, finalYear, first);
    }

    private static BigDecimal grow(BigDecimal amount, BigDecimal rate) {
        return amount.multiply(BigDecimal.ONE.add(rate), MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    private void indexEarnings() {
        int benefitBirthYear = calcBenefitBirthday.getYear();
        YearSeries factors = config.calcIncomeIndexFactor(benefitBirthYear);
        YearSeries indexed = new YearSeries();
        List<BigDecimal> values = new ArrayList<>();
        for (Map.Entry<Integer, BigDecimal> e : ssEarnings.asMap().entrySet()) {
            BigDecimal value = e.getValue().multiply(factors.getOrDefault(e.getKey(), BigDecimal.ZERO), MATH_CONTEXT);
            indexed.put(e.getKey(), value);
            values.add(value);
        }
        indexedEarnings = indexed;

        int incomeYears = BenefitFormula.maxIncomeYears(benefitBirthYear);
        BigDecimal topYears = values.stream()
                .sorted(Comparator.reverseOrder())
                .limit(incomeYears)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        aime = topYears.divide(BigDecimal.valueOf(incomeYears * 12L), 0, RoundingMode.FLOOR);
        log.debug("AIME {} from the top {} indexed years", aime, incomeYears);
    }

    /**
     * First day of the month in which the worker retires.
     */
    public LocalDate getRetirementDate() {
        return calcBenefitBirthday
                .plusYears(retirementAge.getYears())
                .plusMonths(retirementAge.getMonths())
                .withDayOfMonth(1);
    }

    public YearsMonths getRetirementAge() {
        return retirementAge;
    }

    public FutureIncome getFutureIncome() {
        return futureIncome;
    }

    public BigDecimal getAime() {
        return aime;
    }

    public BigDecimal getTotalEarningsInYear(int year) {
        return totalEarnings.getOrDefault(year, BigDecimal.ZERO);
    }

    public BigDecimal getSsEarningsInYear(int year) {
        return ssEarnings.getOrDefault(year, BigDecimal.ZERO);
    }

    public Map<Integer, BigDecimal> getTotalEarnings() {
        return totalEarnings.asMap();
    }

    public Map<Integer, BigDecimal> getSsEarnings() {
        return ssEarnings.asMap();
    }

    public Map<Integer, BigDecimal> getIndexedEarnings() {
        return indexedEarnings.asMap();
    }
}
