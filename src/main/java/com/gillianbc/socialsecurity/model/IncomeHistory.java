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
 * A worker's yearly earnings, either as history or as an explicit future profile.
 * <ul>
 *     <li>{@link Kind#MAPPING}: year to amount</li>
 *     <li>{@link Kind#SEQUENCE}: consecutive amounts; for history the first one is the birth year,
 *     for a future profile it is the current year</li>
 *     <li>{@link Kind#USE_MAX}: the statutory maximum every year (history from age 22)</li>
 *     <li>{@link Kind#NONE}: no earnings</li>
 * </ul>
 * Amounts above a year's maximum taxable wage are treated as total earnings and capped.
 */
@Getter
@ToString
public final class IncomeHistory {

    public enum Kind { MAPPING, SEQUENCE, USE_MAX, NONE }

    private static final IncomeHistory USE_MAX = new IncomeHistory(Kind.USE_MAX, Collections.emptyMap(), Collections.emptyList());
    private static final IncomeHistory NONE = new IncomeHistory(Kind.NONE, Collections.emptyMap(), Collections.emptyList());

    private final Kind kind;
    private final Map<Integer, BigDecimal> mapping;
    private final List<BigDecimal> sequence;

    private IncomeHistory(Kind kind, Map<Integer, BigDecimal> mapping, List<BigDecimal> sequence) {
        this.kind = kind;
        this.mapping = mapping;
        this.sequence = sequence;
    }

    public static IncomeHistory mapping(Map<Integer, BigDecimal> earnings) {
        Objects.requireNonNull(earnings, "earnings must not be null");
        Map<Integer, BigDecimal> copy = new TreeMap<>();
        earnings.forEach((year, amount) -> copy.put(year, requireNonNegative(year, amount)));
        return new IncomeHistory(Kind.MAPPING, Collections.unmodifiableMap(copy), Collections.emptyList());
    }

    public static IncomeHistory sequence(List<BigDecimal> earnings) {
        Objects.requireNonNull(earnings, "earnings must not be null");
        for (int i = 0; i < earnings.size(); i++) {
            requireNonNegative(i, earnings.get(i));
        }
        return new IncomeHistory(Kind.SEQUENCE, Collections.emptyMap(), List.copyOf(earnings));
    }

    public static IncomeHistory useMax() {
        return USE_MAX;
    }

    public static IncomeHistory none() {
        return NONE;
    }

    private static BigDecimal requireNonNegative(int key, BigDecimal amount) {
        Objects.requireNonNull(amount, "earnings for " + key + " must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("earnings for " + key + " must be >= 0");
        }
        return amount;
    }
}
