package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.BalanceSummary;
import com.domeball.league.model.Team;
import com.domeball.league.repository.StadiumRepository;
import com.domeball.league.repository.TeamFinancesRepository;
import com.domeball.league.repository.TeamRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Synthetic teams cannot be stored here: the owner id is longer than its column. */
@DataJpaTest
@ActiveProfiles("test")
@Import({SubdivisionBalancer.class, SyntheticTeamFactory.class, LeagueSettings.class})
@TestPropertySource(properties = "league.synthetic.owner-id="
        + "AI_USER_PROFILE_AI_USER_PROFILE_AI_USER_PROFILE_AI_USER_PROFILE_AI_USER_PROFILE_AI_USER_PROFILE")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class SubdivisionBalancerPaddingFailureTest {

    @Autowired private TeamRepository teamRepository;
    @Autowired private TeamFinancesRepository financesRepository;
    @Autowired private StadiumRepository stadiumRepository;
    @Autowired private SubdivisionBalancer balancer;

    @AfterEach
    void cleanUp() {
        stadiumRepository.deleteAll();
        financesRepository.deleteAll();
        teamRepository.deleteAll();
    }

    @Test
    void failedPaddingIsReportedAndPlacementsSurvive() {
        for (int i = 1; i <= 10; i++) {
            Team t = new Team("Arrival-5-" + i, 5, null);
            t.setMovedInSeason(1);
            t.setMovedFromDivision(4);
            t.setArrivalSequence((long) i);
            teamRepository.save(t);
        }

        BalanceSummary summary = balancer.balanceAll();

        assertThat(summary.getTeamsPlaced()).isEqualTo(10);
        assertThat(summary.getSyntheticTeamsCreated()).isZero();
        assertThat(summary.getErrors()).singleElement().satisfies(e -> assertThat(e).startsWith("Division 5-alpha"));
        assertThat(teamRepository.findUnplacedByDivision(5)).isEmpty();
        assertThat(teamRepository.findByDivisionAndSubdivisionOrderByIdAsc(5, "main")).hasSize(8);
        List<Team> alpha = teamRepository.findByDivisionAndSubdivisionOrderByIdAsc(5, "alpha");
        assertThat(alpha).hasSize(2).noneMatch(Team::isSynthetic);
    }
}
