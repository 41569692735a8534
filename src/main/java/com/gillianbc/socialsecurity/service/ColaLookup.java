package com.gillianbc.socialsecurity.service;

import java.math.BigDecimal;

/**
 * Read-only view of the published COLA series, handed to the wage index so it can
 * apply the max-wage freeze without being able to change COLA.
 */
public interface ColaLookup {

    /**
     * @param year the year
     * @return the published (non-negative) COLA for the year, or null when the year has none
     */
    BigDecimal getCola(int year);
}
