package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;

final class TestLeagueSettings {

    private TestLeagueSettings() {}

    static LeagueSettings defaults() {
        return new LeagueSettings("16:00,16:30,17:00,17:30,18:00,18:30,19:00", 4, 75, "18:00", 17L,
                "AI_USER_PROFILE", 50000L, 0, 5000, 50, 25000L, 10000L, 15000L);
    }
}
