package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.FutureIncome;
import com.gillianbc.socialsecurity.model.IncomeHistory;
import com.gillianbc.socialsecurity.model.NextIncomeAmount;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.YearsMonths;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class WorkerEarningsTest {

    private static final LocalDate BIRTHDAY = LocalDate.of(1990, 7, 15);
    private static final YearsMonths FRA = YearsMonths.of(67, 0);
    private static final IncomeHistory HISTORY = IncomeHistory.mapping(Map.of(
            2015, new BigDecimal("50000"),
            2016, new BigDecimal("200000"),
            2024, new BigDecimal("80000")));

    private SocialSecurityConfig config;

    @BeforeEach
    void setUp() {
        config = IndexFixtures.defaultConfig();
    }

    private WorkerEarnings earnings(IncomeHistory history, FutureIncome future, YearsMonths retirementAge) {
        return new WorkerEarnings(config, BIRTHDAY, history, future, retirementAge);
    }

    @Test
    @DisplayName("History above the maximum wage is capped in both series")
    void history_aboveMaxWage_capped() {
        WorkerEarnings earnings = earnings(HISTORY, FutureIncome.extrapolateFromHistory(), FRA);

        assertEquals(new BigDecimal("50000"), earnings.getTotalEarningsInYear(2015));
        assertEquals(new BigDecimal("118500"), earnings.getTotalEarningsInYear(2016));
        assertEquals(new BigDecimal("118500"), earnings.getSsEarningsInYear(2016));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2017));
    }

    @Test
    @DisplayName("Default future income extrapolates last year's earnings by 2.912%")
    void future_extrapolateFromHistory() {
        WorkerEarnings earnings = earnings(HISTORY, FutureIncome.extrapolateFromHistory(), FRA);

        assertEquals(new BigDecimal("82329.60"), earnings.getTotalEarningsInYear(2025));
        assertEquals(new BigDecimal("84727.04"), earnings.getTotalEarningsInYear(2026));
        assertEquals(new BigDecimal("15973"), earnings.getAime());
    }

    @Test
    @DisplayName("Explicit next amount grows to the final income year, then stops")
    void future_nextAmountWithGrowth() {
        FutureIncome future = FutureIncome.next(null, NextIncomeAmount.of(new BigDecimal("90000")), Projection.scalar("0.03"), 2040);
        WorkerEarnings earnings = earnings(HISTORY, future, YearsMonths.of(40, 3));

        assertEquals(new BigDecimal("90000"), earnings.getTotalEarningsInYear(2025));
        assertEquals(new BigDecimal("92700.00"), earnings.getTotalEarningsInYear(2026));
        assertEquals(new BigDecimal("101295.79"), earnings.getTotalEarningsInYear(2029));
        assertEquals(new BigDecimal("4879"), earnings.getAime());
    }

    @Test
    @DisplayName("Retirement year keeps the months worked, later years are zero")
    void retirement_proratesRetirementYear() {
        // retires 2030-10-01: 9/12 of 104334.66
        FutureIncome future = FutureIncome.next(null, NextIncomeAmount.of(new BigDecimal("90000")), Projection.scalar("0.03"), 2040);
        WorkerEarnings earnings = earnings(HISTORY, future, YearsMonths.of(40, 3));

        assertEquals(LocalDate.of(2030, 10, 1), earnings.getRetirementDate());
        assertEquals(new BigDecimal("78250"), earnings.getTotalEarningsInYear(2030));
        assertEquals(new BigDecimal("78250"), earnings.getSsEarningsInYear(2030));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2031));
        assertEquals(BigDecimal.ZERO, earnings.getSsEarningsInYear(2040));
    }

    @Test
    @DisplayName("Retiring before the current year also removes history")
    void retirement_beforeCurrentYear_truncatesHistory() {
        WorkerEarnings earnings = earnings(HISTORY, FutureIncome.extrapolateFromHistory(), YearsMonths.of(30, 0));

        assertEquals(new BigDecimal("118500"), earnings.getTotalEarningsInYear(2016));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2024));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2025));
    }

    @Test
    @DisplayName("Maximum-wage rule earns the maximum from the next year to the final year")
    void future_useMaxFromNextYear() {
        FutureIncome future = FutureIncome.next(2027, NextIncomeAmount.useMax(), null, 2030);
        WorkerEarnings earnings = earnings(HISTORY, future, FRA);

        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2026));
        assertEquals(new BigDecimal("191400"), earnings.getTotalEarningsInYear(2027));
        assertEquals(new BigDecimal("213300"), earnings.getTotalEarningsInYear(2030));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2031));
    }

    @Test
    @DisplayName("Future profile sequence starts in the current year and is capped")
    void future_profileSequence() {
        FutureIncome future = FutureIncome.profile(IncomeHistory.sequence(List.of(new BigDecimal("10000"), new BigDecimal("500000"))));
        WorkerEarnings earnings = earnings(HISTORY, future, FRA);

        assertEquals(new BigDecimal("10000"), earnings.getTotalEarningsInYear(2025));
        assertEquals(new BigDecimal("500000"), earnings.getTotalEarningsInYear(2026));
        assertEquals(new BigDecimal("183900"), earnings.getSsEarningsInYear(2026));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2027));
    }

    @Test
    @DisplayName("History wins over a future profile for the same year")
    void future_profileOverlappingHistory_historyWins() {
        FutureIncome future = FutureIncome.profile(IncomeHistory.mapping(Map.of(2016, new BigDecimal("1"), 2025, new BigDecimal("5000"))));
        WorkerEarnings earnings = earnings(HISTORY, future, FRA);

        assertEquals(new BigDecimal("118500"), earnings.getTotalEarningsInYear(2016));
        assertEquals(new BigDecimal("5000"), earnings.getTotalEarningsInYear(2025));
    }

    @Test
    @DisplayName("Sequence history starts in the birth year")
    void history_sequenceStartsAtBirthYear() {
        IncomeHistory history = IncomeHistory.sequence(List.of(BigDecimal.ZERO, new BigDecimal("1000"), new BigDecimal("2000")));
        WorkerEarnings earnings = earnings(history, FutureIncome.profile(IncomeHistory.none()), FRA);

        assertEquals(new BigDecimal("1000"), earnings.getTotalEarningsInYear(1991));
        assertEquals(new BigDecimal("2000"), earnings.getTotalEarningsInYear(1992));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(1993));
    }

    @Test
    @DisplayName("Maximum-wage history starts at age 22")
    void history_useMaxFromAge22() {
        WorkerEarnings earnings = earnings(IncomeHistory.useMax(), FutureIncome.profile(IncomeHistory.none()), FRA);

        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2011));
        assertEquals(new BigDecimal("110100"), earnings.getTotalEarningsInYear(2012));
        assertEquals(new BigDecimal("168600"), earnings.getTotalEarningsInYear(2024));
        assertEquals(BigDecimal.ZERO, earnings.getTotalEarningsInYear(2025));
    }

    @Test
    @DisplayName("AIME never falls when one year's earnings rise")
    void aime_monotonicInOneYear() {
        BigDecimal previous = BigDecimal.ZERO;
        for (int amount = 0; amount <= 200000; amount += 25000) {
            IncomeHistory history = IncomeHistory.mapping(Map.of(2015, new BigDecimal(amount), 2024, new BigDecimal("80000")));
            BigDecimal aime = earnings(history, FutureIncome.extrapolateFromHistory(), FRA).getAime();
            assertTrue(aime.compareTo(previous) >= 0, "AIME fell at " + amount);
            previous = aime;
        }
    }

    @Test
    @DisplayName("Indexed earnings before age 60 are above the nominal amount")
    void indexedEarnings_scaledToAgeSixty() {
        WorkerEarnings earnings = earnings(HISTORY, FutureIncome.extrapolateFromHistory(), FRA);

        assertTrue(earnings.getIndexedEarnings().get(2016).compareTo(new BigDecimal("118500")) > 0);
        assertEquals(0, earnings.getIndexedEarnings().get(2050).compareTo(earnings.getSsEarningsInYear(2050)));
    }

    @Test
    @DisplayName("Changing the retirement age recomputes AIME")
    void setRetirementAge_recomputes() {
        WorkerEarnings earnings = earnings(HISTORY, FutureIncome.extrapolateFromHistory(), FRA);
        BigDecimal atFra = earnings.getAime();

        earnings.setRetirementAge(YearsMonths.of(40, 0));

        assertTrue(earnings.getAime().compareTo(atFra) < 0);
        assertEquals(YearsMonths.of(40, 0), earnings.getRetirementAge());
    }

    @Test
    @DisplayName("A final income year before the next income year is rejected")
    void future_finalBeforeNext_throws() {
        FutureIncome future = FutureIncome.next(null, NextIncomeAmount.of(new BigDecimal("1000")), null, 2020);
        assertThrows(IllegalArgumentException.class, () -> earnings(HISTORY, future, FRA));
    }
}
