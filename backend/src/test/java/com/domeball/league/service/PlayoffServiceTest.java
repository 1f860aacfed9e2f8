package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.PlayoffBracket;
import com.domeball.league.model.Match;
import com.domeball.league.model.MatchStatus;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Season;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.TeamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import({PlayoffService.class, MatchResultService.class, StandingsService.class, StandingsCalculator.class, PlayoffBracketBuilder.class, LeagueSettings.class})
class PlayoffServiceTest {

    @Autowired private SeasonRepository seasonRepository;
    @Autowired private TeamRepository teamRepository;
    @Autowired private MatchRepository matchRepository;
    @Autowired private PlayoffService playoffService;
    @Autowired private MatchResultService matchResultService;

    private Season season;
    private List<Team> teams;

    @BeforeEach
    void setUp() {
        season = seasonRepository.save(new Season(3, LocalDate.of(2025, 10, 1)));
        teams = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            teams.add(teamRepository.save(new Team("Gamma " + i, 4, "gamma")));
        }
        // team 8 tops the table, so it is seed 1; the rest follow by id
        Match win = new Match(season, teams.get(7), teams.get(0), 4, "gamma", 1, LocalDateTime.of(2025, 10, 1, 16, 0), MatchType.LEAGUE);
        finish(win, 2, 1);
    }

    @Test
    void schedulesSemifinalsOnPlayoffDayAtFixedKickoff() {
        List<PlayoffBracket> brackets = playoffService.schedulePlayoffs(season.getId());

        assertThat(brackets).hasSize(1);
        PlayoffBracket bracket = brackets.get(0);
        assertThat(bracket.seeds()).extracting(PlayoffBracket.Seed::teamId).containsExactly(
                teams.get(7).getId(), teams.get(1).getId(), teams.get(2).getId(), teams.get(3).getId());

        List<Match> semis = matchRepository.findPlayoffMatches(season.getId(), 4, "gamma");
        assertThat(semis).hasSize(2);
        assertThat(semis).allMatch(m -> m.getGameDay() == Season.PLAYOFF_DAY
                && m.getScheduledAt().equals(LocalDateTime.of(2025, 10, 15, 18, 0))
                && m.getBracketRound() == 1);
        assertThat(semis.get(0).getHomeTeam().getId()).isEqualTo(teams.get(7).getId());
        assertThat(semis.get(0).getAwayTeam().getId()).isEqualTo(teams.get(3).getId());
        assertThat(semis.get(1).getHomeTeam().getId()).isEqualTo(teams.get(1).getId());
        assertThat(semis.get(1).getAwayTeam().getId()).isEqualTo(teams.get(2).getId());
    }

    @Test
    void secondSchedulingRunLeavesExistingBracketAlone() {
        playoffService.schedulePlayoffs(season.getId());
        assertThat(playoffService.schedulePlayoffs(season.getId())).isEmpty();
        assertThat(matchRepository.findPlayoffMatches(season.getId(), 4, "gamma")).hasSize(2);
    }

    @Test
    void subdivisionWithTooFewTeamsGetsNoBracket() {
        for (int i = 1; i <= 3; i++) teamRepository.save(new Team("Delta " + i, 5, "delta"));

        playoffService.schedulePlayoffs(season.getId());

        assertThat(matchRepository.findPlayoffMatches(season.getId(), 5, "delta")).isEmpty();
    }

    @Test
    void winnersAdvanceInBracketOrderAndFinalDecidesChampion() {
        playoffService.schedulePlayoffs(season.getId());
        List<Match> semis = matchRepository.findPlayoffMatches(season.getId(), 4, "gamma");

        finish(semis.get(0), 0, 1);   // seed 4 upsets seed 1
        assertThat(playoffService.advance(season.getId(), 4, "gamma")).isZero();
        finish(semis.get(1), 2, 2);   // draw goes to the higher seed at home

        assertThat(playoffService.advance(season.getId(), 4, "gamma")).isEqualTo(1);
        Match fin = matchRepository.findPlayoffMatches(season.getId(), 4, "gamma").stream()
                .filter(m -> m.getBracketRound() == 2).findFirst().orElseThrow();
        assertThat(fin.getHomeTeam().getId()).isEqualTo(teams.get(3).getId());
        assertThat(fin.getAwayTeam().getId()).isEqualTo(teams.get(1).getId());
        assertThat(playoffService.champion(season.getId(), 4, "gamma")).isEmpty();

        finish(fin, 1, 3);

        assertThat(playoffService.champion(season.getId(), 4, "gamma"))
                .hasValueSatisfying(t -> assertThat(t.getId()).isEqualTo(teams.get(1).getId()));
        assertThat(playoffService.advance(season.getId(), 4, "gamma")).isZero();
    }

    @Test
    void recordingPlayoffResultsPlaysTheBracketOut() {
        playoffService.schedulePlayoffs(season.getId());
        List<Match> semis = matchRepository.findPlayoffMatches(season.getId(), 4, "gamma");

        matchResultService.recordResult(semis.get(0).getId(), 3, 0);
        assertThat(matchRepository.findPlayoffMatches(season.getId(), 4, "gamma")).hasSize(2);
        matchResultService.recordResult(semis.get(1).getId(), 1, 2);

        List<Match> bracket = matchRepository.findPlayoffMatches(season.getId(), 4, "gamma");
        assertThat(bracket).hasSize(3);
        Match fin = bracket.get(2);
        assertThat(fin.getBracketRound()).isEqualTo(2);
        assertThat(fin.getHomeTeam().getId()).isEqualTo(teams.get(7).getId());
        assertThat(fin.getAwayTeam().getId()).isEqualTo(teams.get(2).getId());

        matchResultService.recordResult(fin.getId(), 0, 2);

        assertThat(playoffService.champion(season.getId(), 4, "gamma"))
                .hasValueSatisfying(t -> assertThat(t.getId()).isEqualTo(teams.get(2).getId()));
        assertThat(teams.get(2).getWins()).isZero();
    }

    private void finish(Match m, int home, int away) {
        m.setHomeScore(home);
        m.setAwayScore(away);
        m.setStatus(MatchStatus.COMPLETED);
        matchRepository.save(m);
    }
}
