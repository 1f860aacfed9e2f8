package com.domeball.league.model;

public enum MatchType {
    LEAGUE,
    PLAYOFF
}
