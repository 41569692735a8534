package com.gillianbc.socialsecurity.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Caller overrides for building a configuration. Projections left null come from the
 * projection table; table names left at their defaults are read from the classpath.
 */
@Getter
@Builder
@ToString
public class ProjectionOptions {

    public static final String DEFAULT_HISTORY_RESOURCE = "ss_global_history.csv";
    public static final String DEFAULT_PROJECTIONS_RESOURCE = "ss_global_projections.csv";

    private final Projection colaProjection;
    private final Projection wageGrowthProjection;
    @Builder.Default
    private final String historyResource = DEFAULT_HISTORY_RESOURCE;
    @Builder.Default
    private final String projectionsResource = DEFAULT_PROJECTIONS_RESOURCE;

    public static ProjectionOptions defaults() {
        return ProjectionOptions.builder().build();
    }

    /**
     * @return true when both projections are supplied, so the projection table is not needed
     */
    public boolean overridesAllProjections() {
        return colaProjection != null && wageGrowthProjection != null;
    }
}
