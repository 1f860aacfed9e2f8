package com.domeball.league.service;

import com.domeball.league.model.Match;
import com.domeball.league.model.MatchStatus;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Season;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.TeamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchResultServiceTest {

    @Mock private MatchRepository matchRepository;
    @Mock private TeamRepository teamRepository;
    @Mock private PlayoffService playoffService;

    private MatchResultService service;
    private Team home;
    private Team away;

    @BeforeEach
    void setUp() {
        service = new MatchResultService(matchRepository, teamRepository, playoffService);
        home = new Team("Home", 3, "alpha");
        away = new Team("Away", 3, "alpha");
    }

    @Test
    void leagueWinUpdatesBothTeams() {
        Match m = match(MatchType.LEAGUE);
        when(matchRepository.findById(5L)).thenReturn(Optional.of(m));
        when(matchRepository.save(any(Match.class))).thenAnswer(inv -> inv.getArgument(0));

        Match saved = service.recordResult(5L, 1, 3);

        assertThat(saved.getStatus()).isEqualTo(MatchStatus.COMPLETED);
        assertThat(saved.getWinner()).isSameAs(away);
        assertThat(away.getWins()).isEqualTo(1);
        assertThat(away.getPoints()).isEqualTo(3);
        assertThat(home.getLosses()).isEqualTo(1);
        assertThat(home.getPoints()).isZero();
        verify(teamRepository).save(home);
        verify(teamRepository).save(away);
        verify(playoffService, never()).advance(anyLong(), anyInt(), anyString());
    }

    @Test
    void drawGivesOnePointEach() {
        when(matchRepository.findById(5L)).thenReturn(Optional.of(match(MatchType.LEAGUE)));
        when(matchRepository.save(any(Match.class))).thenAnswer(inv -> inv.getArgument(0));

        service.recordResult(5L, 2, 2);

        assertThat(home.getDraws()).isEqualTo(1);
        assertThat(away.getDraws()).isEqualTo(1);
        assertThat(home.getPoints()).isEqualTo(1);
        assertThat(away.getPoints()).isEqualTo(1);
    }

    @Test
    void playoffResultLeavesSeasonCountersAloneAndAdvancesTheBracket() {
        when(matchRepository.findById(5L)).thenReturn(Optional.of(match(MatchType.PLAYOFF)));
        when(matchRepository.save(any(Match.class))).thenAnswer(inv -> inv.getArgument(0));

        service.recordResult(5L, 4, 0);

        assertThat(home.getGamesPlayed()).isZero();
        verify(teamRepository, never()).save(any());
        verify(playoffService).advance(11L, 3, "alpha");
    }

    @Test
    void rejectsSecondResultUnknownMatchAndNegativeScores() {
        Match done = match(MatchType.LEAGUE);
        done.setStatus(MatchStatus.COMPLETED);
        when(matchRepository.findById(5L)).thenReturn(Optional.of(done));
        when(matchRepository.findById(6L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.recordResult(5L, 1, 0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.recordResult(6L, 1, 0)).hasMessage("Match not found: 6");
        assertThatThrownBy(() -> service.recordResult(5L, -1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private Match match(MatchType type) {
        Season season = new Season(2, LocalDate.of(2025, 8, 16));
        season.setId(11L);
        return new Match(season, home, away, 3, "alpha", 4, LocalDateTime.of(2025, 8, 19, 16, 0), type);
    }
}
