package com.domeball.league.model;

public enum MatchStatus {
    SCHEDULED,
    COMPLETED
}
