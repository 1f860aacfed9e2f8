package com.domeball.league.model;

/**
 * Ordered steps of the day 17 -> day 1 transition. A {@link RolloverCheckpoint} stores the
 * last completed one so that a rerun resumes at the next.
 */
public enum RolloverStage {
    PURGE_SYNTHETIC_TEAMS,
    DIVISION_1_RELEGATION,
    DIVISION_2_PROMOTION,
    DIVISION_2_RELEGATION,
    DIVISION_3_POOL_PROMOTION,
    LOWER_DIVISION_CASCADE,
    BALANCE_SUBDIVISIONS,
    RESET_COUNTERS,
    CREATE_SEASON,
    GENERATE_FIXTURES;

    public boolean isAfter(RolloverStage other) {
        return other == null || ordinal() > other.ordinal();
    }
}
