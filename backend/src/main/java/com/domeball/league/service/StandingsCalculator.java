package com.domeball.league.service;

import com.domeball.league.dto.StandingEntryDTO;
import com.domeball.league.model.Match;
import com.domeball.league.model.Team;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table of one group from its completed matches. Win 3, draw 1, loss 0; ordered by points,
 * differential, score for, then team id.
 */
@Component
public class StandingsCalculator {

    public static final int POINTS_FOR_WIN = 3;
    public static final int POINTS_FOR_DRAW = 1;

    public static final Comparator<StandingEntryDTO> TABLE_ORDER =
            Comparator.comparingInt(StandingEntryDTO::getPoints).reversed()
                    .thenComparing(Comparator.comparingInt(StandingEntryDTO::getDifferential).reversed())
                    .thenComparing(Comparator.comparingInt(StandingEntryDTO::getScoreFor).reversed())
                    .thenComparing(StandingEntryDTO::getTeamId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Every team of {@code teams} gets a row, also without games. Matches that are not completed
     * are ignored, as are sides that do not belong to {@code teams}.
     */
    public List<StandingEntryDTO> calculate(List<Team> teams, List<Match> matches) {
        Map<Long, Tally> tallies = new LinkedHashMap<>();
        for (Team t : teams) {
            tallies.put(t.getId(), new Tally(t));
        }
        for (Match m : matches) {
            if (!m.isCompleted()) continue;
            int home = m.getHomeScore();
            int away = m.getAwayScore();
            Tally h = tallies.get(m.getHomeTeam().getId());
            Tally a = tallies.get(m.getAwayTeam().getId());
            if (h != null) h.add(home, away);
            if (a != null) a.add(away, home);
        }

        List<StandingEntryDTO> rows = new ArrayList<>(tallies.size());
        for (Tally t : tallies.values()) {
            rows.add(t.toEntry());
        }
        rows.sort(TABLE_ORDER);
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).setPosition(i + 1);
        }
        return rows;
    }

    private static final class Tally {
        private final Team team;
        private int wins, draws, losses, scoreFor, scoreAgainst;

        Tally(Team team) {
            this.team = team;
        }

        void add(int own, int opponent) {
            scoreFor += own;
            scoreAgainst += opponent;
            if (own > opponent) wins++;
            else if (own == opponent) draws++;
            else losses++;
        }

        StandingEntryDTO toEntry() {
            int played = wins + draws + losses;
            int points = wins * POINTS_FOR_WIN + draws * POINTS_FOR_DRAW;
            return new StandingEntryDTO(0, team.getId(), team.getName(), played, wins, draws, losses, scoreFor, scoreAgainst, points);
        }
    }
}
