package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.YearSeries;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;

/**
 * Published cost-of-living adjustments: the historical COLA followed by the projected COLA,
 * with negative changes carried forward so that no published COLA is below zero.
 * <p>
 * A negative raw COLA publishes 0 and leaves a running deficit. Later raw COLAs are
 * compounded onto the deficit; nothing is published until the cumulative index
 * climbs back above 1.0, and then only the excess is published.
 */
@Slf4j
public class ColaSeries implements ColaLookup {

    /** COLA used for years with no projected or historical value. */
    public static final BigDecimal DEFAULT_COLA = new BigDecimal("0.024");

    private static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    private static final BigDecimal NO_INCREASE = BigDecimal.ZERO.setScale(3);

    private final int currentYear;
    private final YearSeries history;
    private Projection projection;
    private YearSeries published = new YearSeries();

    ColaSeries(int currentYear, YearSeries history) {
        this.currentYear = currentYear;
        this.history = Objects.requireNonNull(history, "history must not be null").copy();
    }

    /**
     * Rebuilds the published series from the history and the given projection.
     * Starting from the raw history every time keeps repeated derivations identical.
     */
    void derive(Projection projection) {
        this.projection = projection;
        YearSeries raw = history.copy();
        raw.putAll(ProjectionResolver.resolve(currentYear, currentYear + BenefitFormula.LIFESPAN - 1, projection, DEFAULT_COLA));
        published = carryForward(raw);
        log.debug("Derived COLA {}..{} from projection {}", published.firstYear(), published.lastYear(), projection);
    }

    void rederive() {
        derive(projection);
    }

    private static YearSeries carryForward(YearSeries raw) {
        YearSeries result = new YearSeries();
        int settledYear = raw.firstYear() - 1;
        BigDecimal index = BigDecimal.ONE;
        for (Map.Entry<Integer, BigDecimal> e : raw.asMap().entrySet()) {
            int year = e.getKey();
            BigDecimal rate = e.getValue();
            if (rate.signum() < 0) {
                index = index.multiply(BigDecimal.ONE.add(rate), MATH_CONTEXT);
                result.put(year, NO_INCREASE);
            } else if (settledYear < year - 1) {
                index = index.multiply(BigDecimal.ONE.add(rate), MATH_CONTEXT);
                if (index.compareTo(BigDecimal.ONE) > 0) {
                    result.put(year, index.subtract(BigDecimal.ONE).setScale(3, RoundingMode.HALF_UP));
                    settledYear = year;
                    index = BigDecimal.ONE;
                } else {
                    result.put(year, NO_INCREASE);
                }
            } else {
                result.put(year, rate.setScale(3, RoundingMode.HALF_UP));
                settledYear = year;
                index = BigDecimal.ONE;
            }
        }
        return result;
    }

    @Override
    public BigDecimal getCola(int year) {
        return published.get(year);
    }

    public Projection getProjection() {
        return projection;
    }

    /**
     * @return the full published COLA series, read-only
     */
    public Map<Integer, BigDecimal> getColaHistory() {
        return published.asMap();
    }

    /**
     * Grows a monthly amount from {@code baseYear} to {@code benefitYear} one COLA at a time,
     * rounding down to the dime before the first step and after every step.
     *
     * @param value       amount in {@code baseYear}
     * @param baseYear    year the amount is expressed in
     * @param benefitYear year to adjust to; must not be before {@code baseYear}
     * @return the adjusted amount
     */
    public BigDecimal colaAdjust(BigDecimal value, int baseYear, int benefitYear) {
        Objects.requireNonNull(value, "value must not be null");
        if (benefitYear < baseYear) {
            throw new IllegalArgumentException("benefitYear " + benefitYear + " is before baseYear " + baseYear);
        }
        BigDecimal adjusted = BenefitFormula.floorToDime(value);
        if (adjusted.signum() == 0) {
            return adjusted;
        }
        for (int year = baseYear; year < benefitYear; year++) {
            BigDecimal cola = published.getOrDefault(year, DEFAULT_COLA);
            adjusted = BenefitFormula.floorToDime(adjusted.multiply(BigDecimal.ONE.add(cola), MATH_CONTEXT));
        }
        return adjusted;
    }

    /**
     * Expresses an amount from {@code baseYear} in current-year dollars using the unrounded COLA chain.
     */
    public BigDecimal valueInCurrentDollars(BigDecimal value, int baseYear) {
        Objects.requireNonNull(value, "value must not be null");
        if (baseYear == currentYear) {
            return value;
        }
        BigDecimal factor = BigDecimal.ONE;
        for (int year = Math.min(baseYear, currentYear); year < Math.max(baseYear, currentYear); year++) {
            factor = factor.multiply(BigDecimal.ONE.add(published.getOrDefault(year, DEFAULT_COLA)), MATH_CONTEXT);
        }
        return baseYear < currentYear
                ? value.multiply(factor, MATH_CONTEXT)
                : value.divide(factor, MATH_CONTEXT);
    }
}
