package com.domeball.league.service;

import com.domeball.league.model.Match;
import com.domeball.league.model.MatchStatus;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Entry point for finished scores coming from the match engine. */
@Service
public class MatchResultService {

    private static final Logger log = LoggerFactory.getLogger(MatchResultService.class);

    private final MatchRepository matchRepository;
    private final TeamRepository teamRepository;
    private final PlayoffService playoffService;

    public MatchResultService(MatchRepository matchRepository, TeamRepository teamRepository,
                              PlayoffService playoffService) {
        this.matchRepository = matchRepository;
        this.teamRepository = teamRepository;
        this.playoffService = playoffService;
    }

    /**
     * Stores the final score. League results also update both teams' season counters. A playoff
     * result that closes its round schedules the next one.
     */
    @Transactional
    public Match recordResult(Long matchId, int homeScore, int awayScore) {
        if (homeScore < 0 || awayScore < 0) throw new IllegalArgumentException("Scores must be >= 0");
        Match match = matchRepository.findById(matchId)
                .orElseThrow(() -> new IllegalArgumentException("Match not found: " + matchId));
        if (match.getStatus() == MatchStatus.COMPLETED) {
            throw new IllegalStateException("Match " + matchId + " already has a result");
        }
        match.setHomeScore(homeScore);
        match.setAwayScore(awayScore);
        match.setStatus(MatchStatus.COMPLETED);

        if (match.getMatchType() == MatchType.LEAGUE) {
            Team home = match.getHomeTeam();
            Team away = match.getAwayTeam();
            if (homeScore > awayScore) {
                win(home);
                loss(away);
            } else if (homeScore < awayScore) {
                win(away);
                loss(home);
            } else {
                draw(home);
                draw(away);
            }
            teamRepository.save(home);
            teamRepository.save(away);
        }
        log.debug("Recorded match {}: {}-{}", matchId, homeScore, awayScore);
        Match saved = matchRepository.save(match);
        if (saved.getMatchType() == MatchType.PLAYOFF) {
            playoffService.advance(saved.getSeason().getId(), saved.getDivision(), saved.getSubdivision());
        }
        return saved;
    }

    private static void win(Team t) {
        t.setWins(t.getWins() + 1);
        t.setPoints(t.getPoints() + StandingsCalculator.POINTS_FOR_WIN);
    }

    private static void draw(Team t) {
        t.setDraws(t.getDraws() + 1);
        t.setPoints(t.getPoints() + StandingsCalculator.POINTS_FOR_DRAW);
    }

    private static void loss(Team t) {
        t.setLosses(t.getLosses() + 1);
    }
}
