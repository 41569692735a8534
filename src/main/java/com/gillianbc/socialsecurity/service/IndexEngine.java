package com.gillianbc.socialsecurity.service;

import com.gillianbc.socialsecurity.model.IndexHistory;
import com.gillianbc.socialsecurity.model.Projection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Owns the COLA and wage index series and keeps them consistent: COLA is always derived first,
 * and any COLA change is followed by a re-derivation of AWI and maximum wages.
 */
@Slf4j
@Getter
public class IndexEngine {

    private final int currentYear;
    private final ColaSeries cola;
    private final WageIndexSeries wageIndex;

    public IndexEngine(IndexHistory history, Projection colaProjection, Projection wageGrowthProjection) {
        Objects.requireNonNull(history, "history must not be null");
        this.currentYear = history.getCurrentYear();
        this.cola = new ColaSeries(currentYear, history.getCola());
        this.cola.derive(colaProjection);
        this.wageIndex = new WageIndexSeries(currentYear, history.getAwi(), history.getMaxWages(), cola);
        this.wageIndex.derive(wageGrowthProjection);
    }

    public void setColaProjection(Projection colaProjection) {
        cola.derive(colaProjection);
        wageIndex.rederive();
    }

    public void setWageGrowthProjection(Projection wageGrowthProjection) {
        wageIndex.derive(wageGrowthProjection);
    }

    /**
     * Re-runs both derivations, COLA first, with the projections already in place.
     */
    public void rederive() {
        log.debug("Re-deriving index series for current year {}", currentYear);
        cola.rederive();
        wageIndex.rederive();
    }
}
