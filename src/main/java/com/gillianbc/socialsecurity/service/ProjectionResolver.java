package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.YearSeries;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link Projection} into a contiguous year-indexed series.
 * Used for COLA, AWI growth and personal wage growth projections.
 */
public final class ProjectionResolver {

    private ProjectionResolver() {
    }

    /**
     * Resolves a projection over {@code startYear..finalYear} inclusive.
     * <p>
     * A year with no projected value takes the value of the most recent earlier year in the range;
     * when there is no earlier value, {@code fallback} is used. A null projection resolves to
     * {@code fallback} for every year.
     *
     * @param startYear  first year of the range
     * @param finalYear  last year of the range (inclusive)
     * @param projection the projection, or null
     * @param fallback   value used before any projected value is available
     * @return a series with a value for every year in the range
     */
    public static YearSeries resolve(int startYear, int finalYear, Projection projection, BigDecimal fallback) {
        Objects.requireNonNull(fallback, "fallback must not be null");
        YearSeries resolved = new YearSeries();
        if (finalYear < startYear) {
            return resolved;
        }

        YearSeries given = new YearSeries();
        if (projection != null) {
            switch (projection.getKind()) {
                case SCALAR -> given.put(startYear, projection.getScalar());
                case SEQUENCE -> {
                    List<BigDecimal> values = projection.getSequence();
                    for (int i = 0; i < values.size() && startYear + i <= finalYear; i++) {
                        given.put(startYear + i, values.get(i));
                    }
                }
                case MAPPING -> {
                    for (Map.Entry<Integer, BigDecimal> e : projection.getMapping().entrySet()) {
                        if (e.getKey() >= startYear && e.getKey() <= finalYear) {
                            given.put(e.getKey(), e.getValue());
                        }
                    }
                }
                default -> throw new IllegalStateException("Unhandled projection kind " + projection.getKind());
            }
        }

        // Forward fill
        BigDecimal recent = fallback;
        for (int year = startYear; year <= finalYear; year++) {
            BigDecimal value = given.get(year);
            if (value != null) {
                recent = value;
            }
            resolved.put(year, recent);
        }
        return resolved;
    }
}
