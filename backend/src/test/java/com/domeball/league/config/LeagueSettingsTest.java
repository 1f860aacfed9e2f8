package com.domeball.league.config;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeagueSettingsTest {

    private final LeagueSettings settings = new LeagueSettings(" 16:00, 16:30 ,17:00", 4, 75, "18:00", 1L,
            "AI_USER_PROFILE", 1L, 0, 1, 1, 1L, 1L, 1L);

    @Test
    void topTierUsesSixteenTeamSubdivisionsAndEightTeamBrackets() {
        assertThat(settings.subdivisionSize(1)).isEqualTo(16);
        assertThat(settings.subdivisionSize(2)).isEqualTo(16);
        assertThat(settings.subdivisionSize(3)).isEqualTo(8);
        assertThat(settings.playoffQualifiers(2)).isEqualTo(8);
        assertThat(settings.playoffQualifiers(8)).isEqualTo(4);
    }

    @Test
    void parsesStartTimesLeniently() {
        assertThat(settings.getDayStartTimes()).containsExactly(LocalTime.of(16, 0), LocalTime.of(16, 30), LocalTime.of(17, 0));
        assertThat(settings.getPlayoffFirstRoundKickoff()).isEqualTo(LocalTime.of(18, 0));
    }

    @Test
    void rejectsEmptyStartTimesAndZeroSlots() {
        assertThatThrownBy(() -> new LeagueSettings(" ", 4, 75, "18:00", 1L, "AI", 1L, 0, 1, 1, 1L, 1L, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LeagueSettings("16:00", 0, 75, "18:00", 1L, "AI", 1L, 0, 1, 1, 1L, 1L, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
