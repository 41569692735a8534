package com.gillianbc.socialsecurity.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Everything needed to create a worker. Unset ages default to the worker's full retirement age,
 * an unset history to no earnings, and unset future income to extrapolation from the history.
 */
@Getter
@Builder
@ToString
public class WorkerProfile {

    @Builder.Default
    private final String name = "worker";
    @NonNull
    private final LocalDate birthday;
    @Builder.Default
    private final IncomeHistory incomeHistory = IncomeHistory.none();
    @Builder.Default
    private final FutureIncome futureIncome = FutureIncome.extrapolateFromHistory();
    private final YearsMonths retirementAge;
    private final YearsMonths collectionStartAge;
}
