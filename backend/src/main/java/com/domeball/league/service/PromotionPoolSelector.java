package com.domeball.league.service;

import com.domeball.league.dto.StandingEntryDTO;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranking rules of the end-of-season cascade. Kept apart from the table order used on screen:
 * relegation and direct promotion rank by points, wins, then fewest losses, and the cross
 * subdivision promotion pool ranks by win percentage.
 */
@Component
public class PromotionPoolSelector {

    public static final Comparator<StandingEntryDTO> CASCADE_ORDER =
            Comparator.comparingInt(StandingEntryDTO::getPoints).reversed()
                    .thenComparing(Comparator.comparingInt(StandingEntryDTO::getWins).reversed())
                    .thenComparingInt(StandingEntryDTO::getLosses)
                    .thenComparing(StandingEntryDTO::getTeamId, Comparator.nullsLast(Comparator.naturalOrder()));

    public static final Comparator<StandingEntryDTO> POOL_ORDER =
            Comparator.comparingDouble(StandingEntryDTO::getWinPercentage).reversed()
                    .thenComparing(Comparator.comparingInt((StandingEntryDTO e) -> e.getPoints() - e.getLosses()).reversed())
                    .thenComparing(StandingEntryDTO::getTeamId, Comparator.nullsLast(Comparator.naturalOrder()));

    public List<StandingEntryDTO> rank(List<StandingEntryDTO> standings) {
        List<StandingEntryDTO> ranked = new ArrayList<>(standings);
        ranked.sort(CASCADE_ORDER);
        return ranked;
    }

    public List<StandingEntryDTO> top(List<StandingEntryDTO> standings, int count) {
        List<StandingEntryDTO> ranked = rank(standings);
        return List.copyOf(ranked.subList(0, Math.min(count, ranked.size())));
    }

    public List<StandingEntryDTO> bottom(List<StandingEntryDTO> standings, int count) {
        List<StandingEntryDTO> ranked = rank(standings);
        return List.copyOf(ranked.subList(Math.max(0, ranked.size() - count), ranked.size()));
    }

    /**
     * Up to two candidates of one subdivision: the regular-season winner and the playoff champion.
     * When both titles went to the same team, or there is no eligible champion, the runner-up
     * takes the second place.
     *
     * @param playoffChampionId may be null
     */
    public List<StandingEntryDTO> candidates(List<StandingEntryDTO> standings, Long playoffChampionId) {
        List<StandingEntryDTO> ranked = rank(standings);
        List<StandingEntryDTO> out = new ArrayList<>(2);
        if (ranked.isEmpty()) return out;

        StandingEntryDTO leader = ranked.get(0);
        out.add(leader);
        StandingEntryDTO champion = null;
        if (playoffChampionId != null && !Objects.equals(playoffChampionId, leader.getTeamId())) {
            champion = ranked.stream().filter(e -> playoffChampionId.equals(e.getTeamId())).findFirst().orElse(null);
        }
        if (champion != null) {
            out.add(champion);
        } else if (ranked.size() > 1) {
            out.add(ranked.get(1));
        }
        return out;
    }

    /** Best {@code needed} entries of the pool. */
    public List<StandingEntryDTO> selectFromPool(List<StandingEntryDTO> pool, int needed) {
        if (needed <= 0) return List.of();
        List<StandingEntryDTO> ordered = new ArrayList<>(pool);
        ordered.sort(POOL_ORDER);
        return List.copyOf(ordered.subList(0, Math.min(needed, ordered.size())));
    }
}
