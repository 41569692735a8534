package com.gillianbc.socialsecurity.model;

import lombok.Getter;

import java.util.Objects;

/**
 * Historical (actual, non-projected) maximum taxable wage, COLA and AWI series.
 * <p>
 * The current year is the latest year with a maximum wage. The table is validated once on
 * construction:
 * <ul>
 *     <li>maximum wage is defined for the current year</li>
 *     <li>COLA is defined for the current year - 1 and for no later year</li>
 *     <li>AWI is defined for the current year - 2 and for no later year</li>
 * </ul>
 * Series are copied in, so later changes to the caller's series have no effect.
 */
@Getter
public class IndexHistory {

    /** Years the maximum wage lags the COLA it depends on. */
    public static final int COLA_OFFSET = 1;
    /** Years the maximum wage lags the AWI it is computed from. */
    public static final int AWI_OFFSET = 2;

    private final int currentYear;
    private final YearSeries maxWages;
    private final YearSeries cola;
    private final YearSeries awi;

    public IndexHistory(YearSeries maxWages, YearSeries cola, YearSeries awi) {
        Objects.requireNonNull(maxWages, "maxWages must not be null");
        Objects.requireNonNull(cola, "cola must not be null");
        Objects.requireNonNull(awi, "awi must not be null");
        if (maxWages.isEmpty()) {
            throw new IllegalStateException("history must contain at least one year of maximum wages");
        }
        this.currentYear = maxWages.lastYear();
        this.maxWages = maxWages.copy();
        this.cola = cola.copy();
        this.awi = awi.copy();
        validate();
    }

    /**
     * @return a fresh copy of the historical maximum wages
     */
    public YearSeries getMaxWages() {
        return maxWages.copy();
    }

    /**
     * @return a fresh copy of the historical COLA
     */
    public YearSeries getCola() {
        return cola.copy();
    }

    /**
     * @return a fresh copy of the historical AWI
     */
    public YearSeries getAwi() {
        return awi.copy();
    }

    private void validate() {
        int colaMaxYear = currentYear - COLA_OFFSET;
        int awiMaxYear = currentYear - AWI_OFFSET;
        if (!cola.contains(colaMaxYear)) {
            throw new IllegalStateException("COLA history must end in " + colaMaxYear + " (current year " + currentYear + " - " + COLA_OFFSET + ")");
        }
        if (!awi.contains(awiMaxYear)) {
            throw new IllegalStateException("AWI history must end in " + awiMaxYear + " (current year " + currentYear + " - " + AWI_OFFSET + ")");
        }
        if (cola.lastYear() > colaMaxYear) {
            throw new IllegalStateException("COLA history must not extend past " + colaMaxYear + ", found " + cola.lastYear());
        }
        if (awi.lastYear() > awiMaxYear) {
            throw new IllegalStateException("AWI history must not extend past " + awiMaxYear + ", found " + awi.lastYear());
        }
    }
}
