package com.gillianbc.socialsecurity.model;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Objects;

/**
 * Default COLA and AWI growth projections, as published alongside the historical table.
 */
@Getter
@ToString
public class ProjectionTable {

    @NonNull private final Projection cola;
    @NonNull private final Projection wageGrowth;

    public ProjectionTable(Projection cola, Projection wageGrowth) {
        this.cola = Objects.requireNonNull(cola, "cola must not be null");
        this.wageGrowth = Objects.requireNonNull(wageGrowth, "wageGrowth must not be null");
    }
}
