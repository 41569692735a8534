package com.gillianbc.socialsecurity.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * How the first estimated year of future earnings is set.
 * <ul>
 *     <li>{@link Kind#AMOUNT}: an explicit total earnings figure</li>
 *     <li>{@link Kind#USE_MAX}: the maximum taxable wage, for that year and every later year</li>
 *     <li>{@link Kind#EXTRAPOLATE}: the previous year's historical earnings grown by the personal wage growth</li>
 * </ul>
 */
@Getter
@ToString
public final class NextIncomeAmount {

    public enum Kind { AMOUNT, USE_MAX, EXTRAPOLATE }

    private static final NextIncomeAmount USE_MAX = new NextIncomeAmount(Kind.USE_MAX, BigDecimal.ZERO);
    private static final NextIncomeAmount EXTRAPOLATE = new NextIncomeAmount(Kind.EXTRAPOLATE, BigDecimal.ZERO);

    private final Kind kind;
    private final BigDecimal amount;

    private NextIncomeAmount(Kind kind, BigDecimal amount) {
        this.kind = kind;
        this.amount = amount;
    }

    public static NextIncomeAmount of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        return new NextIncomeAmount(Kind.AMOUNT, amount);
    }

    public static NextIncomeAmount useMax() {
        return USE_MAX;
    }

    public static NextIncomeAmount extrapolate() {
        return EXTRAPOLATE;
    }
}
