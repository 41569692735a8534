package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.ClaimingOption;
import com.gillianbc.socialsecurity.model.IndexHistory;
import com.gillianbc.socialsecurity.model.Projection;
import com.gillianbc.socialsecurity.model.ProjectionOptions;
import com.gillianbc.socialsecurity.model.ProjectionTable;
import com.gillianbc.socialsecurity.model.WorkerProfile;
import com.gillianbc.socialsecurity.model.YearsMonths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
public class BenefitService {

    private final IndexTableReader tableReader;

    public BenefitService() {
        this(new IndexTableReader());
    }

    public BenefitService(IndexTableReader tableReader) {
        this.tableReader = Objects.requireNonNull(tableReader, "tableReader must not be null");
    }

    /**
     * Configuration built from the shipped history and projection tables.
     */
    public SocialSecurityConfig loadConfig() {
        return loadConfig(ProjectionOptions.defaults());
    }

    /**
     * Builds a configuration from the history table named in the options. Projections given in the
     * options win; any left unset come from the projection table, which is only read when needed.
     */
    public SocialSecurityConfig loadConfig(ProjectionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        IndexHistory history = tableReader.readHistory(options.getHistoryResource());

        Projection colaProjection = options.getColaProjection();
        Projection wageGrowthProjection = options.getWageGrowthProjection();
        if (!options.overridesAllProjections()) {
            ProjectionTable table = tableReader.readProjections(options.getProjectionsResource());
            if (colaProjection == null) {
                colaProjection = table.getCola();
            }
            if (wageGrowthProjection == null) {
                wageGrowthProjection = table.getWageGrowth();
            }
        }
        return new SocialSecurityConfig(history, colaProjection, wageGrowthProjection);
    }

    public Worker createWorker(SocialSecurityConfig config, WorkerProfile profile) {
        Worker worker = new Worker(config, profile);
        log.info("Created worker {} born {}, AIME {}", worker.getName(), worker.getBirthday(), worker.getAime());
        return worker;
    }

    /**
     * Tabulates the monthly benefit paid in one month for each claiming age. The worker's own
     * collection age is restored afterwards.
     *
     * @param worker       the worker
     * @param year         benefit year
     * @param month        benefit month, 1-12
     * @param claimingAges ages to try, in the order they should be reported
     * @return one row per claiming age
     */
    public List<ClaimingOption> benefitsByClaimingAge(Worker worker, int year, int month, List<YearsMonths> claimingAges) {
        Objects.requireNonNull(worker, "worker must not be null");
        Objects.requireNonNull(claimingAges, "claimingAges must not be null");
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12, was " + month);
        }

        YearsMonths original = worker.getCollectionStartAge();
        List<ClaimingOption> options = new ArrayList<>();
        try {
            for (YearsMonths age : claimingAges) {
                worker.resetCollectionStartAge(age);
                options.add(new ClaimingOption(age, worker.getBenefitMultiplier(), worker.getMonthlyBenefit(year, month)));
            }
        } finally {
            worker.resetCollectionStartAge(original);
        }
        log.debug("Tabulated {} claiming ages for {} in {}-{}", options.size(), worker.getName(), year, month);
        return options;
    }
}
