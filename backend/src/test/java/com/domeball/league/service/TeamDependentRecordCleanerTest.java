package com.domeball.league.service;

import com.domeball.league.dto.StandingEntryDTO;
import com.domeball.league.model.Match;
import com.domeball.league.model.MatchStatus;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Season;
import com.domeball.league.model.Stadium;
import com.domeball.league.model.Team;
import com.domeball.league.model.TeamFinances;
import com.domeball.league.model.TeamOrigin;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.StadiumRepository;
import com.domeball.league.repository.TeamFinancesRepository;
import com.domeball.league.repository.TeamRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import({TeamFinancesCleaner.class, StadiumCleaner.class, SeasonAwardCleaner.class, MatchReferenceCleaner.class,
        StandingsCalculator.class})
class TeamDependentRecordCleanerTest {

    @Autowired private SeasonRepository seasonRepository;
    @Autowired private TeamRepository teamRepository;
    @Autowired private MatchRepository matchRepository;
    @Autowired private TeamFinancesRepository financesRepository;
    @Autowired private StadiumRepository stadiumRepository;
    @Autowired private List<TeamDependentRecordCleaner> cleaners;
    @Autowired private StandingsCalculator calculator;

    @Test
    void syntheticTeamCanBeDeletedWhilePlayedMatchesSurvive() {
        Season season = seasonRepository.save(new Season(6, LocalDate.of(2026, 1, 1)));
        Team real = teamRepository.save(new Team("Real Club", 8, "alpha"));
        Team bot = new Team("Bot Club", 8, "alpha");
        bot.setOrigin(TeamOrigin.SYNTHETIC);
        bot = teamRepository.save(bot);
        financesRepository.save(new TeamFinances(bot, 100L, 0));
        stadiumRepository.save(new Stadium(bot, 5000, 50));
        Match m = new Match(season, real, bot, 8, "alpha", 1, season.dateOfDay(1).atTime(16, 0), MatchType.LEAGUE);
        m.setHomeScore(4);
        m.setAwayScore(1);
        m.setStatus(MatchStatus.COMPLETED);
        matchRepository.save(m);

        int affected = 0;
        for (TeamDependentRecordCleaner cleaner : cleaners) {
            affected += cleaner.clean(bot);
        }
        teamRepository.delete(bot);
        teamRepository.flush();

        assertThat(affected).isEqualTo(3);
        assertThat(teamRepository.findByOrigin(TeamOrigin.SYNTHETIC)).isEmpty();
        assertThat(financesRepository.findByTeamId(bot.getId())).isEmpty();
        Team placeholder = teamRepository.findFirstByOriginOrderByIdAsc(TeamOrigin.PLACEHOLDER).orElseThrow();
        assertThat(placeholder.getDivision()).isNull();

        List<Match> left = matchRepository.findCompleted(season.getId(), 8, "alpha", MatchType.LEAGUE);
        assertThat(left).hasSize(1);
        assertThat(left.get(0).getAwayTeam().getId()).isEqualTo(placeholder.getId());
        StandingEntryDTO row = calculator.calculate(List.of(real), left).get(0);
        assertThat(row.getWins()).isEqualTo(1);
        assertThat(row.getScoreFor()).isEqualTo(4);
    }

    @Test
    void placeholderIsCreatedOnce() {
        MatchReferenceCleaner cleaner = cleaners.stream()
                .filter(MatchReferenceCleaner.class::isInstance)
                .map(MatchReferenceCleaner.class::cast)
                .findFirst().orElseThrow();

        Team first = cleaner.placeholder();
        Team second = cleaner.placeholder();

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getName()).isEqualTo(MatchReferenceCleaner.PLACEHOLDER_NAME);
    }
}
