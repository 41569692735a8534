package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.Projection;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class ColaSeriesTest {

    private static ColaSeries derive(Projection projection) {
        ColaSeries cola = new ColaSeries(IndexFixtures.CURRENT_YEAR, IndexFixtures.shortHistory().getCola());
        cola.derive(projection);
        return cola;
    }

    @Test
    @DisplayName("History is kept and the projection covers the current year through the lifespan")
    void derive_defaultProjection_coversDomain() {
        ColaSeries cola = derive(null);

        assertEquals(new BigDecimal("0.087"), cola.getCola(2022));
        assertEquals(new BigDecimal("0.025"), cola.getCola(2024));
        assertEquals(new BigDecimal("0.024"), cola.getCola(2025));
        assertEquals(new BigDecimal("0.024"), cola.getCola(2154));
        assertNull(cola.getCola(2155));
        assertNull(cola.getCola(2021));
    }

    @Test
    @DisplayName("A negative COLA publishes zero and is recovered from the next increase")
    void derive_negativeCola_carriedForward() {
        // index 0.99 * 1.015 = 1.00485 -> 0.005 published in 2026
        ColaSeries cola = derive(Projection.mapping(Map.of(
                2025, new BigDecimal("-0.01"),
                2026, new BigDecimal("0.015"),
                2027, new BigDecimal("0.02"))));

        assertEquals(new BigDecimal("0.000"), cola.getCola(2025));
        assertEquals(new BigDecimal("0.005"), cola.getCola(2026));
        assertEquals(new BigDecimal("0.020"), cola.getCola(2027));
        assertEquals(new BigDecimal("0.020"), cola.getCola(2028));
    }

    @Test
    @DisplayName("A deficit larger than the next increase keeps COLA at zero until it is made up")
    void derive_largeDeficit_staysAtZeroUntilRecovered() {
        // 0.98 * 1.01 = 0.9898, then * 1.02 = 1.009596 -> 0.010
        ColaSeries cola = derive(Projection.mapping(Map.of(
                2025, new BigDecimal("-0.02"),
                2026, new BigDecimal("0.01"),
                2027, new BigDecimal("0.02"))));

        assertEquals(new BigDecimal("0.000"), cola.getCola(2025));
        assertEquals(new BigDecimal("0.000"), cola.getCola(2026));
        assertEquals(new BigDecimal("0.010"), cola.getCola(2027));
        assertEquals(new BigDecimal("0.020"), cola.getCola(2028));
    }

    @Test
    @DisplayName("Published COLA is never negative")
    void derive_negativeScalar_allNonNegative() {
        ColaSeries cola = derive(Projection.scalar("-0.005"));

        assertTrue(cola.getColaHistory().values().stream().allMatch(v -> v.signum() >= 0));
        assertEquals(BigDecimal.ZERO.setScale(3), cola.getCola(2100));
    }

    @Test
    @DisplayName("Deriving again with the same projection gives the same series")
    void rederive_unchangedInputs_identical() {
        ColaSeries cola = derive(Projection.mapping(Map.of(2025, new BigDecimal("-0.01"), 2026, new BigDecimal("0.015"))));
        Map<Integer, BigDecimal> first = new TreeMap<>(cola.getColaHistory());

        cola.rederive();
        cola.rederive();

        assertEquals(first, cola.getColaHistory());
    }

    @Test
    @DisplayName("Flat 2.4% COLA over 20 years floors to the dime every year")
    void colaAdjust_flatColaTwentyYears_floorsEachYear() {
        ColaSeries cola = derive(Projection.scalar("0.024"));

        BigDecimal expected = new BigDecimal("1000.00");
        BigDecimal naive = new BigDecimal("1000.00");
        for (int i = 0; i < 20; i++) {
            expected = expected.multiply(new BigDecimal("1.024")).setScale(1, RoundingMode.FLOOR);
            naive = naive.multiply(new BigDecimal("1.024"));
        }

        BigDecimal adjusted = cola.colaAdjust(new BigDecimal("1000.00"), 2025, 2045);

        assertEquals(new BigDecimal("1605.8"), adjusted);
        assertEquals(expected, adjusted);
        assertNotEquals(0, naive.compareTo(adjusted));
        log.info("20 years of 2.4% COLA on 1000.00: floored {} vs compounded {}", adjusted, naive);
    }

    @Test
    @DisplayName("COLA adjustment within the same year only floors to the dime")
    void colaAdjust_sameYear_floorsToDime() {
        assertEquals(new BigDecimal("1000.0"), derive(null).colaAdjust(new BigDecimal("1000.09"), 2030, 2030));
    }

    @Test
    @DisplayName("Zero stays zero")
    void colaAdjust_zero_staysZero() {
        assertEquals(0, derive(null).colaAdjust(BigDecimal.ZERO, 2025, 2040).signum());
    }

    @Test
    @DisplayName("Years without a published COLA use the default rate")
    void colaAdjust_outsideDomain_usesDefault() {
        assertEquals(new BigDecimal("102.4"), derive(null).colaAdjust(new BigDecimal("100"), 2300, 2301));
    }

    @Test
    @DisplayName("Benefit year before the base year throws IllegalArgumentException")
    void colaAdjust_benefitYearBeforeBaseYear_throws() {
        ColaSeries cola = derive(null);
        assertThrows(IllegalArgumentException.class, () -> cola.colaAdjust(new BigDecimal("100"), 2030, 2029));
    }

    @Test
    @DisplayName("Past amounts are grown to current dollars with unrounded COLA")
    void valueInCurrentDollars_pastYear_multiplies() {
        // 2020 and 2021 have no history in the fixture and use 2.4%: 1.024 * 1.024 * 1.087 * 1.032 * 1.025
        BigDecimal value = derive(null).valueInCurrentDollars(new BigDecimal("1000"), 2020);
        assertEquals(0, new BigDecimal("1205.6826740736").compareTo(value));
    }

    @Test
    @DisplayName("Future amounts are discounted to current dollars")
    void valueInCurrentDollars_futureYear_divides() {
        BigDecimal value = derive(null).valueInCurrentDollars(new BigDecimal("1024"), 2026);
        assertEquals(0, new BigDecimal("1000").compareTo(value));
    }

    @Test
    @DisplayName("Current-year amounts are unchanged")
    void valueInCurrentDollars_currentYear_identity() {
        assertEquals(new BigDecimal("1234.56"), derive(null).valueInCurrentDollars(new BigDecimal("1234.56"), 2025));
    }
}
