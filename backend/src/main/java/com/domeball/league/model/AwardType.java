package com.domeball.league.model;

public enum AwardType {
    SUBDIVISION_CHAMPION,
    SUBDIVISION_RUNNER_UP,
    PLAYOFF_CHAMPION
}
