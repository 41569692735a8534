package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.IndexHistory;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.YearSeries;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;

/**
 * Average wage index and maximum taxable wage, historical then projected.
 * <p>
 * Projected AWI grows the previous year's AWI by the projected wage growth. The maximum wage
 * for a year is computed from the AWI two years earlier, and stays at the previous year's
 * value when the COLA of the previous year was zero or the formula would lower it.
 */
@Slf4j
public class WageIndexSeries {

    public static final BigDecimal DEFAULT_WAGE_GROWTH = new BigDecimal("0.036");
    /** Age whose AWI sets a worker's bend points and indexing base. */
    public static final int INDEXING_AGE = BenefitFormula.ELIGIBILITY_AGE - IndexHistory.AWI_OFFSET;
    /** Earlier earnings are not indexed. */
    public static final int FIRST_INDEXED_YEAR = 1951;

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);

    private static final BigDecimal MAX_WAGE_1994 = new BigDecimal("60600");
    private static final BigDecimal AWI_1992 = new BigDecimal("22935.42");
    private static final BigDecimal MAX_WAGE_STEP = new BigDecimal("300");

    private static final BigDecimal AWI_1977 = new BigDecimal("9779.44");
    private static final BigDecimal BEND_POINT_1_1979 = new BigDecimal("180");
    private static final BigDecimal BEND_POINT_2_1979 = new BigDecimal("1085");

    private final int currentYear;
    private final YearSeries awiHistory;
    private final YearSeries maxWageHistory;
    private final ColaLookup cola;
    private Projection projection;
    private YearSeries awi;
    private YearSeries maxWages;

    WageIndexSeries(int currentYear, YearSeries awiHistory, YearSeries maxWageHistory, ColaLookup cola) {
        this.currentYear = currentYear;
        this.awiHistory = Objects.requireNonNull(awiHistory, "awiHistory must not be null").copy();
        this.maxWageHistory = Objects.requireNonNull(maxWageHistory, "maxWageHistory must not be null").copy();
        this.cola = Objects.requireNonNull(cola, "cola must not be null");
        this.awi = this.awiHistory.copy();
        this.maxWages = this.maxWageHistory.copy();
    }

    void derive(Projection projection) {
        this.projection = projection;
        rederive();
    }

    /**
     * Rebuilds AWI and maximum wages from the history with the current growth projection
     * and the COLA as it is now.
     */
    void rederive() {
        YearSeries nextAwi = awiHistory.copy();
        YearSeries nextMaxWages = maxWageHistory.copy();
        int firstYear = currentYear + 1 - IndexHistory.AWI_OFFSET;
        YearSeries growth = ProjectionResolver.resolve(firstYear, currentYear + BenefitFormula.LIFESPAN, projection, DEFAULT_WAGE_GROWTH);
        for (Map.Entry<Integer, BigDecimal> e : growth.asMap().entrySet()) {
            int year = e.getKey();
            BigDecimal previous = nextAwi.get(year - 1);
            nextAwi.put(year, previous.multiply(BigDecimal.ONE.add(e.getValue()), MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP));
            int maxWageYear = year + IndexHistory.AWI_OFFSET;
            nextMaxWages.put(maxWageYear, calcMaxWage(maxWageYear, nextAwi, nextMaxWages));
        }
        awi = nextAwi;
        maxWages = nextMaxWages;
        log.debug("Derived AWI to {} and max wages to {}", awi.lastYear(), maxWages.lastYear());
    }

    private BigDecimal calcMaxWage(int maxWageYear, YearSeries awiSeries, YearSeries maxWageSeries) {
        BigDecimal awiValue = awiSeries.get(maxWageYear - IndexHistory.AWI_OFFSET);
        if (awiValue == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal maxWage = awiValue.multiply(MAX_WAGE_1994)
                .divide(AWI_1992, MATH_CONTEXT)
                .divide(MAX_WAGE_STEP, MATH_CONTEXT)
                .setScale(0, RoundingMode.HALF_UP)
                .multiply(MAX_WAGE_STEP);

        BigDecimal previousCola = cola.getCola(maxWageYear - IndexHistory.COLA_OFFSET);
        BigDecimal previousMaxWage = maxWageSeries.get(maxWageYear - 1);
        if (previousMaxWage != null && (maxWage.compareTo(previousMaxWage) < 0
                || previousCola != null && previousCola.signum() == 0)) {
            return previousMaxWage;
        }
        return maxWage;
    }

    /**
     * Maximum taxable wage for a year as the formula gives it now, using the derived series.
     */
    public BigDecimal calcMaxWage(int maxWageYear) {
        return calcMaxWage(maxWageYear, awi, maxWages);
    }

    public BigDecimal getMaxWage(int year) {
        return maxWages.getOrDefault(year, BigDecimal.ZERO);
    }

    public Map<Integer, BigDecimal> getMaxWageHistory() {
        return maxWages.asMap();
    }

    public BigDecimal getAwiValue(int year) {
        return awi.getOrDefault(year, BigDecimal.ZERO);
    }

    public Map<Integer, BigDecimal> getAwiHistory() {
        return awi.asMap();
    }

    public Projection getProjection() {
        return projection;
    }

    public BigDecimal bendPoint1(int birthYear) {
        return bendPoint(birthYear, BEND_POINT_1_1979);
    }

    public BigDecimal bendPoint2(int birthYear) {
        return bendPoint(birthYear, BEND_POINT_2_1979);
    }

    private BigDecimal bendPoint(int birthYear, BigDecimal bendPoint1979) {
        BigDecimal awiValue = requireIndexingAwi(birthYear);
        return awiValue.multiply(bendPoint1979).divide(AWI_1977, MATH_CONTEXT).setScale(0, RoundingMode.HALF_UP);
    }

    /**
     * Factors that bring each year's earnings up to the wage level of the year the worker turns 60.
     * Years before 1951 get 0, years from age 60 on get 1.
     *
     * @param birthYear the worker's benefit birth year
     * @return factors for {@code birthYear..birthYear+129}
     */
    public YearSeries calcIncomeIndexFactor(int birthYear) {
        BigDecimal indexingAwi = requireIndexingAwi(birthYear);
        YearSeries factors = new YearSeries();
        for (int year = birthYear; year < birthYear + BenefitFormula.LIFESPAN; year++) {
            if (year < FIRST_INDEXED_YEAR) {
                factors.put(year, BigDecimal.ZERO);
            } else if (year - birthYear < INDEXING_AGE) {
                BigDecimal yearAwi = awi.get(year);
                if (yearAwi == null) {
                    throw new IllegalStateException("no AWI for " + year + " to index earnings");
                }
                factors.put(year, indexingAwi.divide(yearAwi, MATH_CONTEXT));
            } else {
                factors.put(year, BigDecimal.ONE);
            }
        }
        return factors;
    }

    private BigDecimal requireIndexingAwi(int birthYear) {
        BigDecimal awiValue = awi.get(birthYear + INDEXING_AGE);
        if (awiValue == null) {
            throw new IllegalArgumentException("no AWI for " + (birthYear + INDEXING_AGE)
                    + ", the year birth year " + birthYear + " turns " + INDEXING_AGE);
        }
        return awiValue;
    }
}
