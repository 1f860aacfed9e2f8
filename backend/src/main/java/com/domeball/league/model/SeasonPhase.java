package com.domeball.league.model;

public enum SeasonPhase {
    REGULAR_SEASON,
    PLAYOFFS,
    OFF_SEASON
}
