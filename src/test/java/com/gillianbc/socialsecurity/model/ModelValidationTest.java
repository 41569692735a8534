package com.gillianbc.socialsecurity.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModelValidationTest {

    @Test
    @DisplayName("Negative earnings are rejected")
    void incomeHistory_negative_throws() {
        assertThrows(IllegalArgumentException.class, () -> IncomeHistory.mapping(Map.of(2020, new BigDecimal("-1"))));
        assertThrows(IllegalArgumentException.class, () -> IncomeHistory.sequence(List.of(new BigDecimal("-1"))));
        assertThrows(IllegalArgumentException.class, () -> NextIncomeAmount.of(new BigDecimal("-0.01")));
    }

    @Test
    @DisplayName("Final income year before next income year is rejected")
    void futureIncome_finalBeforeNext_throws() {
        assertThrows(IllegalArgumentException.class, () ->
                FutureIncome.next(2030, NextIncomeAmount.useMax(), null, 2029));
    }

    @Test
    @DisplayName("Base benefit needs ordered bend points and a non-negative amount")
    void baseBenefit_invalid_throws() {
        assertThrows(IllegalArgumentException.class, () ->
                new BaseBenefit(new BigDecimal("-0.1"), BigDecimal.ONE, BigDecimal.TEN));
        assertThrows(IllegalArgumentException.class, () ->
                new BaseBenefit(BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ONE));
    }

    @Test
    @DisplayName("Worker profile defaults")
    void workerProfile_defaults() {
        WorkerProfile profile = WorkerProfile.builder().birthday(LocalDate.of(1975, 4, 20)).build();

        assertEquals("worker", profile.getName());
        assertEquals(IncomeHistory.Kind.NONE, profile.getIncomeHistory().getKind());
        assertEquals(FutureIncome.Kind.NEXT, profile.getFutureIncome().getKind());
        assertEquals(NextIncomeAmount.Kind.EXTRAPOLATE, profile.getFutureIncome().getNextAmount().getKind());
        assertNull(profile.getRetirementAge());
        assertThrows(NullPointerException.class, () -> WorkerProfile.builder().build());
    }

    @Test
    @DisplayName("Projection options default to the shipped tables")
    void projectionOptions_defaults() {
        ProjectionOptions options = ProjectionOptions.defaults();

        assertEquals(ProjectionOptions.DEFAULT_HISTORY_RESOURCE, options.getHistoryResource());
        assertEquals(ProjectionOptions.DEFAULT_PROJECTIONS_RESOURCE, options.getProjectionsResource());
        assertNull(options.getColaProjection());
    }
}
