package com.gillianbc.socialsecurity.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An age or age difference expressed as whole years plus months (0-11).
 * Years may be negative when the value is a difference between two ages.
 */
@Getter
@EqualsAndHashCode
public final class YearsMonths implements Comparable<YearsMonths> {

    public static final YearsMonths ZERO = new YearsMonths(0, 0);

    private final int years;
    private final int months;

    public YearsMonths(int years, int months) {
        if (months < 0 || months > 11) {
            throw new IllegalArgumentException("months must be between 0 and 11, was " + months);
        }
        this.years = years;
        this.months = months;
    }

    public static YearsMonths of(int years, int months) {
        return new YearsMonths(years, months);
    }

    /**
     * Subtracts another duration, borrowing a year when this month count is smaller.
     */
    public YearsMonths minus(YearsMonths other) {
        if (months < other.months) {
            return new YearsMonths(years - 1 - other.years, months + 12 - other.months);
        }
        return new YearsMonths(years - other.years, months - other.months);
    }

    @Override
    public int compareTo(YearsMonths other) {
        if (years != other.years) {
            return Integer.compare(years, other.years);
        }
        return Integer.compare(months, other.months);
    }

    @Override
    public String toString() {
        return "(" + years + ", " + months + ")";
    }
}
