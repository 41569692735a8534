package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.BaseBenefit;
import com.gillianbc.socialsecurity.model.BenefitInfo;
import com.gillianbc.socialsecurity.model.FutureIncome;
import com.gillianbc.socialsecurity.model.IncomeHistory;
import com.gillianbc.socialsecurity.model.NextIncomeAmount;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.WorkerProfile;
import com.gillianbc.socialsecurity.model.YearSeries;
import com.gillianbc.socialsecurity.model.YearsMonths;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One worker's retirement benefit.
 * <p>
 * The base benefit is fixed in the dollars of the year the worker turns 62 and then grown by
 * COLA year by year; the monthly benefit for a year is that amount times the claiming-age
 * multiplier, rounded down to the dollar. Both are cached per year, and every mutator clears
 * the caches and recomputes the base benefit.
 * <p>
 * For benefit purposes a worker attains an age on the day before the birthday, see
 * {@link #getCalcBenefitBirthday()}.
 */
@Slf4j
public class Worker {

    private final SocialSecurityConfig config;
    @Getter private final String name;
    @Getter private final LocalDate birthday;
    @Getter private final LocalDate calcBenefitBirthday;
    @Getter private final YearsMonths fullRetirementAge;
    private final WorkerEarnings earnings;

    @Getter private YearsMonths collectionStartAge;
    @Getter private BigDecimal benefitMultiplier;
    @Getter private BaseBenefit baseBenefit;

    private final YearSeries colaAdjustedBenefit = new YearSeries();
    private final YearSeries monthlyBenefit = new YearSeries();

    public Worker(SocialSecurityConfig config, WorkerProfile profile) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        this.name = profile.getName();
        this.birthday = profile.getBirthday();
        this.calcBenefitBirthday = birthday.minusDays(1);
        this.fullRetirementAge = BenefitFormula.fullRetirementAge(calcBenefitBirthday.getYear());
        YearsMonths retirementAge = profile.getRetirementAge() != null ? profile.getRetirementAge() : fullRetirementAge;
        this.collectionStartAge = profile.getCollectionStartAge() != null ? profile.getCollectionStartAge() : fullRetirementAge;
        this.earnings = new WorkerEarnings(config, birthday, profile.getIncomeHistory(), profile.getFutureIncome(), retirementAge);
        refreshBenefit();
    }

    private void refreshBenefit() {
        colaAdjustedBenefit.clear();
        monthlyBenefit.clear();
        benefitMultiplier = BenefitFormula.benefitMultiplier(calcBenefitBirthday, collectionStartAge);
        baseBenefit = config.calcBaseBenefit(calcBenefitBirthday.getYear(), earnings.getAime());
        log.debug("{}: AIME {}, base benefit {}, multiplier {} at {}",
                name, earnings.getAime(), baseBenefit.getBenefit(), benefitMultiplier, collectionStartAge);
    }

    /**
     * First day of the first month benefits are paid.
     */
    public LocalDate getBenefitStartDate() {
        return calcBenefitBirthday
                .plusYears(collectionStartAge.getYears())
                .plusMonths(collectionStartAge.getMonths())
                .withDayOfMonth(1);
    }

    /**
     * @return the benefit for the first month benefits are paid
     */
    public BigDecimal getMonthlyBenefit() {
        LocalDate start = getBenefitStartDate();
        return getMonthlyBenefit(start.getYear(), start.getMonthValue());
    }

    /**
     * Monthly benefit paid in the given month, in whole dollars. Zero before benefits start
     * and when the collection age does not allow benefits at all.
     *
     * @param year  calendar year
     * @param month calendar month, 1-12
     * @return the monthly benefit
     */
    public BigDecimal getMonthlyBenefit(int year, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12, was " + month);
        }
        if (benefitMultiplier.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (LocalDate.of(year, month, 1).isBefore(getBenefitStartDate())) {
            return BigDecimal.ZERO;
        }
        BigDecimal cached = monthlyBenefit.get(year);
        if (cached != null) {
            return cached;
        }
        BigDecimal benefit = BenefitFormula.floorToDollar(colaAdjustedBenefit(year).multiply(benefitMultiplier));
        monthlyBenefit.put(year, benefit);
        return benefit;
    }

    /**
     * Base benefit grown by COLA from the age-62 year to {@code year}, extending the cached
     * chain one year at a time.
     */
    private BigDecimal colaAdjustedBenefit(int year) {
        if (colaAdjustedBenefit.isEmpty()) {
            colaAdjustedBenefit.put(calcBenefitBirthday.getYear() + BenefitFormula.ELIGIBILITY_AGE, baseBenefit.getBenefit());
        }
        for (int next = colaAdjustedBenefit.lastYear() + 1; next <= year; next++) {
            colaAdjustedBenefit.put(next, config.colaAdjust(colaAdjustedBenefit.get(next - 1), next - 1, next));
        }
        BigDecimal adjusted = colaAdjustedBenefit.get(year);
        if (adjusted == null) {
            throw new IllegalStateException("no COLA-adjusted benefit for " + year + ", before the age-62 year");
        }
        return adjusted;
    }

    public BigDecimal getAime() {
        return earnings.getAime();
    }

    public BenefitInfo getBenefitInfo() {
        return new BenefitInfo(earnings.getAime(), baseBenefit);
    }

    public YearsMonths getRetirementAge() {
        return earnings.getRetirementAge();
    }

    public int getMaxIncomeYears() {
        return BenefitFormula.maxIncomeYears(calcBenefitBirthday.getYear());
    }

    public BigDecimal getTotalEarningsInYear(int year) {
        return earnings.getTotalEarningsInYear(year);
    }

    public WorkerEarnings getEarnings() {
        return earnings;
    }

    public void resetRetirementAge(YearsMonths retirementAge) {
        earnings.setRetirementAge(retirementAge);
        refreshBenefit();
    }

    public void resetCollectionStartAge(YearsMonths collectionStartAge) {
        this.collectionStartAge = Objects.requireNonNull(collectionStartAge, "collectionStartAge must not be null");
        refreshBenefit();
    }

    public void resetIncomeFutureByProfile(IncomeHistory profile) {
        earnings.setFutureIncome(FutureIncome.profile(profile));
        refreshBenefit();
    }

    /**
     * Replaces future income with a rule grown from one year's amount.
     *
     * @param nextIncomeYear  first estimated year, or null for the current year
     * @param nextAmount      how that year's amount is set
     * @param growth          personal wage growth, or null for the default
     * @param finalIncomeYear last year with earnings, or null for the end of the lifespan
     */
    public void resetIncomeFutureByNext(Integer nextIncomeYear, NextIncomeAmount nextAmount, Projection growth,
                                        Integer finalIncomeYear) {
        earnings.setFutureIncome(FutureIncome.next(nextIncomeYear, nextAmount, growth, finalIncomeYear));
        refreshBenefit();
    }
}
