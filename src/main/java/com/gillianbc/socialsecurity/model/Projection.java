package com.gillianbc.socialsecurity.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A projection of future yearly values, in one of three shapes:
 * <ul>
 *     <li>{@link Kind#SCALAR}: one value for every year</li>
 *     <li>{@link Kind#SEQUENCE}: consecutive values, the first one belonging to the start year of the range</li>
 *     <li>{@link Kind#MAPPING}: sparse year to value pairs</li>
 * </ul>
 * Resolved into a contiguous series by {@code ProjectionResolver}.
 */
@Getter
@ToString
public final class Projection {

    public enum Kind { SCALAR, SEQUENCE, MAPPING }

    private final Kind kind;
    private final BigDecimal scalar;
    private final List<BigDecimal> sequence;
    private final Map<Integer, BigDecimal> mapping;

    private Projection(Kind kind, BigDecimal scalar, List<BigDecimal> sequence, Map<Integer, BigDecimal> mapping) {
        this.kind = kind;
        this.scalar = scalar;
        this.sequence = sequence;
        this.mapping = mapping;
    }

    public static Projection scalar(BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        return new Projection(Kind.SCALAR, value, Collections.emptyList(), Collections.emptyMap());
    }

    public static Projection scalar(String value) {
        return scalar(new BigDecimal(value));
    }

    public static Projection sequence(List<BigDecimal> values) {
        Objects.requireNonNull(values, "values must not be null");
        for (BigDecimal v : values) {
            Objects.requireNonNull(v, "sequence contains null");
        }
        return new Projection(Kind.SEQUENCE, null, List.copyOf(values), Collections.emptyMap());
    }

    public static Projection mapping(Map<Integer, BigDecimal> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<Integer, BigDecimal> copy = new TreeMap<>();
        values.forEach((year, v) -> copy.put(year, Objects.requireNonNull(v, "mapping value for " + year + " is null")));
        return new Projection(Kind.MAPPING, null, Collections.emptyList(), Collections.unmodifiableMap(copy));
    }

    public static Projection mapping(YearSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        return mapping(series.asMap());
    }
}
