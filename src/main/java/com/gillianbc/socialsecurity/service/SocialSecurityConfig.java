package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.BaseBenefit;
import com.gillianbc.socialsecurity.model.IndexHistory;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.YearSeries;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Global economic configuration for one computation session: the historical tables plus the
 * COLA and AWI growth projections, and every per-year lookup derived from them.
 * <p>
 * Workers share a configuration read-only. Replacing a projection re-derives every series
 * in place; workers built before the change keep the benefits they have already cached.
 */
@Slf4j
public class SocialSecurityConfig {

    private final IndexEngine indexEngine;

    /**
     * @param history              validated historical table
     * @param colaProjection       projected COLA, or null for the default rate
     * @param wageGrowthProjection projected AWI growth, or null for the default rate
     */
    public SocialSecurityConfig(IndexHistory history, Projection colaProjection, Projection wageGrowthProjection) {
        this.indexEngine = new IndexEngine(Objects.requireNonNull(history, "history must not be null"),
                colaProjection, wageGrowthProjection);
        log.info("Created configuration for current year {}", indexEngine.getCurrentYear());
    }

    public int getCurrentYear() {
        return indexEngine.getCurrentYear();
    }

    public BigDecimal getMaxWage(int year) {
        return indexEngine.getWageIndex().getMaxWage(year);
    }

    public Map<Integer, BigDecimal> getMaxWageHistory() {
        return indexEngine.getWageIndex().getMaxWageHistory();
    }

    public BigDecimal getAwiValue(int year) {
        return indexEngine.getWageIndex().getAwiValue(year);
    }

    public BigDecimal getCola(int year) {
        return indexEngine.getCola().getCola(year);
    }

    public Map<Integer, BigDecimal> getColaHistory() {
        return indexEngine.getCola().getColaHistory();
    }

    public YearSeries calcIncomeIndexFactor(int birthYear) {
        return indexEngine.getWageIndex().calcIncomeIndexFactor(birthYear);
    }

    /**
     * Base benefit for a worker with the given benefit birth year and AIME.
     *
     * @throws IllegalArgumentException when there is no AWI for the year the worker turns 60
     */
    public BaseBenefit calcBaseBenefit(int birthYear, BigDecimal aime) {
        WageIndexSeries wageIndex = indexEngine.getWageIndex();
        BigDecimal bendPoint1 = wageIndex.bendPoint1(birthYear);
        BigDecimal bendPoint2 = wageIndex.bendPoint2(birthYear);
        return new BaseBenefit(BenefitFormula.baseBenefit(aime, bendPoint1, bendPoint2), bendPoint1, bendPoint2);
    }

    public BigDecimal colaAdjust(BigDecimal value, int baseYear, int benefitYear) {
        return indexEngine.getCola().colaAdjust(value, baseYear, benefitYear);
    }

    public BigDecimal valueInCurrentDollars(BigDecimal value, int baseYear) {
        return indexEngine.getCola().valueInCurrentDollars(value, baseYear);
    }

    public Projection getColaProjection() {
        return indexEngine.getCola().getProjection();
    }

    public Projection getWageGrowthProjection() {
        return indexEngine.getWageIndex().getProjection();
    }

    public void setColaProjection(Projection colaProjection) {
        log.info("Replacing COLA projection with {}", colaProjection);
        indexEngine.setColaProjection(colaProjection);
    }

    public void setWageGrowthProjection(Projection wageGrowthProjection) {
        log.info("Replacing AWI growth projection with {}", wageGrowthProjection);
        indexEngine.setWageGrowthProjection(wageGrowthProjection);
    }
}
