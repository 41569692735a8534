package com.gillianbc.socialsecurity.model;

import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * A year-indexed series of values (COLA, AWI, maximum wage, earnings, cached benefits).
 * Years are kept in ascending order. A year that was never put has no value; callers
 * choose the fallback through {@link #getOrDefault(int, BigDecimal)}.
 */
@EqualsAndHashCode
public class YearSeries {

    private final NavigableMap<Integer, BigDecimal> values;

    public YearSeries() {
        this.values = new TreeMap<>();
    }

    public YearSeries(Map<Integer, BigDecimal> source) {
        Objects.requireNonNull(source, "source must not be null");
        this.values = new TreeMap<>();
        source.forEach(this::put);
    }

    public YearSeries copy() {
        return new YearSeries(values);
    }

    public void put(int year, BigDecimal value) {
        values.put(year, Objects.requireNonNull(value, "value for year " + year + " must not be null"));
    }

    public void putAll(YearSeries other) {
        values.putAll(other.values);
    }

    /**
     * @return the value for the year, or null when the year has no value
     */
    public BigDecimal get(int year) {
        return values.get(year);
    }

    public BigDecimal getOrDefault(int year, BigDecimal fallback) {
        return values.getOrDefault(year, fallback);
    }

    public boolean contains(int year) {
        return values.containsKey(year);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public int firstYear() {
        requireNotEmpty();
        return values.firstKey();
    }

    public int lastYear() {
        requireNotEmpty();
        return values.lastKey();
    }

    public Set<Integer> years() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * @return a read-only ascending view of the series
     */
    public Map<Integer, BigDecimal> asMap() {
        return Collections.unmodifiableNavigableMap(values);
    }

    public void clear() {
        values.clear();
    }

    private void requireNotEmpty() {
        if (values.isEmpty()) {
            throw new IllegalStateException("series is empty");
        }
    }

    @Override
    public String toString() {
        if (values.isEmpty()) {
            return "YearSeries[]";
        }
        return "YearSeries[" + values.firstKey() + ".." + values.lastKey() + ", " + values.size() + " years]";
    }
}
