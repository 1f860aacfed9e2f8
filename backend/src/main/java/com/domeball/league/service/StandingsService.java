package com.domeball.league.service;

import com.domeball.league.dto.StandingEntryDTO;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.TeamRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class StandingsService {

    private final SeasonRepository seasonRepository;
    private final TeamRepository teamRepository;
    private final MatchRepository matchRepository;
    private final StandingsCalculator calculator;

    public StandingsService(SeasonRepository seasonRepository, TeamRepository teamRepository,
                            MatchRepository matchRepository, StandingsCalculator calculator) {
        this.seasonRepository = seasonRepository;
        this.teamRepository = teamRepository;
        this.matchRepository = matchRepository;
        this.calculator = calculator;
    }

    /** League-match table of the current members of a subdivision. */
    public List<StandingEntryDTO> standings(Long seasonId, int division, String subdivision) {
        if (seasonId == null) throw new IllegalArgumentException("seasonId is required");
        if (!seasonRepository.existsById(seasonId)) throw new IllegalArgumentException("Season not found: " + seasonId);
        List<Team> teams = teamRepository.findByDivisionAndSubdivisionOrderByIdAsc(division, subdivision);
        return calculator.calculate(teams, matchRepository.findCompleted(seasonId, division, subdivision, MatchType.LEAGUE));
    }
}
