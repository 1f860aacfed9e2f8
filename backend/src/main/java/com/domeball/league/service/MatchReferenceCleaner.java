package com.domeball.league.service;

import com.domeball.league.model.Team;
import com.domeball.league.model.TeamOrigin;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Played matches outlive the synthetic teams in them: both sides are re-pointed to a shared
 * placeholder team that sits outside every division.
 */
@Component
@Order(40)
public class MatchReferenceCleaner implements TeamDependentRecordCleaner {

    private static final Logger log = LoggerFactory.getLogger(MatchReferenceCleaner.class);

    static final String PLACEHOLDER_NAME = "Retired Team";

    private final MatchRepository matchRepository;
    private final TeamRepository teamRepository;

    public MatchReferenceCleaner(MatchRepository matchRepository, TeamRepository teamRepository) {
        this.matchRepository = matchRepository;
        this.teamRepository = teamRepository;
    }

    @Override
    public int clean(Team team) {
        Team placeholder = placeholder();
        return matchRepository.repointHomeTeam(team, placeholder) + matchRepository.repointAwayTeam(team, placeholder);
    }

    Team placeholder() {
        return teamRepository.findFirstByOriginOrderByIdAsc(TeamOrigin.PLACEHOLDER).orElseGet(() -> {
            Team t = new Team(PLACEHOLDER_NAME, null, null);
            t.setOrigin(TeamOrigin.PLACEHOLDER);
            log.info("[PURGE] Creating placeholder team '{}' for historical matches", PLACEHOLDER_NAME);
            return teamRepository.save(t);
        });
    }
}
