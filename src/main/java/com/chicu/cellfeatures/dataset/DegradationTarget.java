package com.chicu.cellfeatures.dataset;

import com.chicu.cellfeatures.common.enums.FeatureType;

import java.util.Optional;

/**
 * Что предсказывает модель деградации поверх предикторов Delta-Q.
 */
public enum DegradationTarget {

    /** Цикл, на котором ёмкость падает ниже 80% номинала. */
    CYCLE_LIFE(FeatureType.TRAJECTORY_FAST_CHARGE),
    /** Циклы достижения сетки порогов ёмкости 0.98 … 0.80. */
    CYCLES_TO_CAPACITIES(FeatureType.TRAJECTORY_FAST_CHARGE),
    /** Ёмкость на фиксированных циклах. */
    CAPACITIES_AT_CYCLES(FeatureType.CAPACITY_AT_SET_CYCLES),
    /** Только предикторы. */
    NONE(null);

    public static final double CYCLE_LIFE_THRESHOLD = 0.8;

    private final FeatureType outcome;

    DegradationTarget(FeatureType outcome) {
        this.outcome = outcome;
    }

    public Optional<FeatureType> outcome() {
        return Optional.ofNullable(outcome);
    }
}
