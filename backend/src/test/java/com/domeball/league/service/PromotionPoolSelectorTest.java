package com.domeball.league.service;

import com.domeball.league.dto.StandingEntryDTO;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromotionPoolSelectorTest {

    private final PromotionPoolSelector selector = new PromotionPoolSelector();

    @Test
    void cascadeOrderUsesPointsThenWinsThenFewestLosses() {
        StandingEntryDTO manyDraws = row(1L, 4, 0, 12, 2);    // 12 pts, 0 wins
        StandingEntryDTO winner = row(2L, 4, 4, 0, 10);       // 12 pts, 4 wins
        StandingEntryDTO sameButMoreLosses = row(3L, 4, 4, 0, 11);
        StandingEntryDTO low = row(4L, 1, 1, 0, 13);

        assertThat(selector.rank(List.of(manyDraws, low, sameButMoreLosses, winner)))
                .extracting(StandingEntryDTO::getTeamId).containsExactly(2L, 3L, 1L, 4L);
        assertThat(selector.bottom(List.of(manyDraws, low, sameButMoreLosses, winner), 2))
                .extracting(StandingEntryDTO::getTeamId).containsExactly(1L, 4L);
        assertThat(selector.top(List.of(low, winner), 5)).hasSize(2);
    }

    @Test
    void candidatesAreLeaderAndDistinctPlayoffChampion() {
        List<StandingEntryDTO> table = List.of(row(1L, 10, 10, 0, 4), row(2L, 9, 9, 0, 5), row(3L, 8, 8, 0, 6));

        assertThat(selector.candidates(table, 3L)).extracting(StandingEntryDTO::getTeamId).containsExactly(1L, 3L);
    }

    @Test
    void runnerUpSubstitutesWhenLeaderAlsoWonPlayoffsOrNoChampion() {
        List<StandingEntryDTO> table = List.of(row(1L, 10, 10, 0, 4), row(2L, 9, 9, 0, 5), row(3L, 8, 8, 0, 6));

        assertThat(selector.candidates(table, 1L)).extracting(StandingEntryDTO::getTeamId).containsExactly(1L, 2L);
        assertThat(selector.candidates(table, null)).extracting(StandingEntryDTO::getTeamId).containsExactly(1L, 2L);
        // champion no longer in the group (moved or purged)
        assertThat(selector.candidates(table, 77L)).extracting(StandingEntryDTO::getTeamId).containsExactly(1L, 2L);
    }

    @Test
    void poolOfTwelveFillsTwelveVacanciesByWinPercentage() {
        List<StandingEntryDTO> pool = new ArrayList<>();
        for (long sub = 0; sub < 6; sub++) {
            pool.add(row(sub * 10 + 1, 14, 12 - (int) sub, 0, 2 + (int) sub));
            pool.add(row(sub * 10 + 2, 14, 10 - (int) sub, 0, 5 + (int) sub));
        }

        assertThat(selector.selectFromPool(pool, 12)).hasSize(12);
        List<StandingEntryDTO> best = selector.selectFromPool(pool, 3);
        assertThat(best).extracting(StandingEntryDTO::getTeamId).containsExactly(1L, 11L, 21L);
        assertThat(selector.selectFromPool(pool, 0)).isEmpty();
    }

    @Test
    void poolTieBreakIsPointsMinusLossesThenTeamId() {
        StandingEntryDTO a = row(5L, 10, 5, 0, 5);   // 50%, 15 - 5 = 10
        StandingEntryDTO b = row(4L, 10, 5, 3, 2);   // 50%, 18 - 2 = 16
        StandingEntryDTO c = row(3L, 10, 5, 0, 5);   // same as a, lower id

        assertThat(selector.selectFromPool(List.of(a, b, c), 3))
                .extracting(StandingEntryDTO::getTeamId).containsExactly(4L, 3L, 5L);
    }

    private static StandingEntryDTO row(Long id, int played, int wins, int draws, int losses) {
        return new StandingEntryDTO(0, id, "T" + id, played, wins, draws, losses, 0, 0, wins * 3 + draws);
    }
}
