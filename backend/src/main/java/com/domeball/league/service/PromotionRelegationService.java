package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.CascadeSummary;
import com.domeball.league.dto.StandingEntryDTO;
import com.domeball.league.dto.TeamMove;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.RolloverStage;
import com.domeball.league.model.Season;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Top-down promotion/relegation waterfall of a closing season. Each public method is one stage
 * and moves teams exactly one division. A moved team leaves its subdivision (the balancer places
 * it) and is stamped with the closing season number, so it is ignored by every later stage.
 */
@Service
public class PromotionRelegationService {

    private static final Logger log = LoggerFactory.getLogger(PromotionRelegationService.class);

    static final int DIVISION_1_RELEGATED = 6;
    static final int DIVISION_2_PROMOTED_PER_SUBDIVISION = 2;
    static final int DIVISION_2_RELEGATED_PER_SUBDIVISION = 4;
    static final int LOWER_RELEGATED_PER_SUBDIVISION = 4;

    private final TeamRepository teamRepository;
    private final MatchRepository matchRepository;
    private final StandingsCalculator standingsCalculator;
    private final PromotionPoolSelector selector;
    private final PlayoffService playoffService;

    public PromotionRelegationService(TeamRepository teamRepository, MatchRepository matchRepository,
                                      StandingsCalculator standingsCalculator, PromotionPoolSelector selector,
                                      PlayoffService playoffService) {
        this.teamRepository = teamRepository;
        this.matchRepository = matchRepository;
        this.standingsCalculator = standingsCalculator;
        this.selector = selector;
        this.playoffService = playoffService;
    }

    @Transactional
    public CascadeSummary relegateFromDivisionOne(Season closing) {
        CascadeSummary summary = new CascadeSummary();
        Moves moves = new Moves(closing, RolloverStage.DIVISION_1_RELEGATION, summary);
        for (String sub : teamRepository.findSubdivisionNames(LeagueSettings.TOP_DIVISION)) {
            Group g = group(closing, LeagueSettings.TOP_DIVISION, sub);
            moves.moveAll(g, selector.bottom(g.standings, DIVISION_1_RELEGATED), 2);
        }
        log.info("[CASCADE] Division 1 relegated {} team(s)", summary.getMoves().size());
        return summary;
    }

    @Transactional
    public CascadeSummary promoteFromDivisionTwo(Season closing) {
        CascadeSummary summary = new CascadeSummary();
        Moves moves = new Moves(closing, RolloverStage.DIVISION_2_PROMOTION, summary);
        for (String sub : teamRepository.findSubdivisionNames(2)) {
            Group g = group(closing, 2, sub);
            moves.moveAll(g, selector.top(g.standings, DIVISION_2_PROMOTED_PER_SUBDIVISION), 1);
        }
        log.info("[CASCADE] Division 2 promoted {} team(s)", summary.getMoves().size());
        return summary;
    }

    @Transactional
    public CascadeSummary relegateFromDivisionTwo(Season closing) {
        CascadeSummary summary = new CascadeSummary();
        Moves moves = new Moves(closing, RolloverStage.DIVISION_2_RELEGATION, summary);
        for (String sub : teamRepository.findSubdivisionNames(2)) {
            Group g = group(closing, 2, sub);
            moves.moveAll(g, selector.bottom(g.standings, DIVISION_2_RELEGATED_PER_SUBDIVISION), 3);
        }
        log.info("[CASCADE] Division 2 relegated {} team(s)", summary.getMoves().size());
        return summary;
    }

    /**
     * Fills the Division 2 places left by this rollover's Division 2 relegations from the
     * Division 3 promotion pool.
     */
    @Transactional
    public CascadeSummary promoteDivisionThreePool(Season closing) {
        CascadeSummary summary = new CascadeSummary();
        int vacancies = arrivalsFrom(closing, 2, 3);
        promotePool(closing, 3, vacancies, new Moves(closing, RolloverStage.DIVISION_3_POOL_PROMOTION, summary));
        return summary;
    }

    /**
     * Divisions 3 to 7: relegate the bottom of every subdivision, then promote the best of the
     * pool below into the places just freed. Division 8 only feeds its pool upward.
     */
    @Transactional
    public CascadeSummary cascadeLowerDivisions(Season closing) {
        CascadeSummary summary = new CascadeSummary();
        Moves moves = new Moves(closing, RolloverStage.LOWER_DIVISION_CASCADE, summary);
        for (int division = 3; division < LeagueSettings.BOTTOM_DIVISION; division++) {
            int before = summary.getMoves().size();
            for (String sub : teamRepository.findSubdivisionNames(division)) {
                Group g = group(closing, division, sub);
                moves.moveAll(g, selector.bottom(g.standings, LOWER_RELEGATED_PER_SUBDIVISION), division + 1);
            }
            int vacancies = summary.getMoves().size() - before;
            promotePool(closing, division + 1, vacancies, moves);
        }
        return summary;
    }

    private void promotePool(Season closing, int fromDivision, int vacancies, Moves moves) {
        int target = fromDivision - 1;
        if (vacancies <= 0) {
            log.info("[CASCADE] No vacancies in Division {}, Division {} pool not drawn", target, fromDivision);
            return;
        }
        List<StandingEntryDTO> pool = new ArrayList<>();
        Map<Long, Team> members = new HashMap<>();
        for (String sub : teamRepository.findSubdivisionNames(fromDivision)) {
            Group g = group(closing, fromDivision, sub);
            members.putAll(g.teams);
            Long championId = playoffService.champion(closing.getId(), fromDivision, sub)
                    .map(Team::getId)
                    .orElse(null);
            pool.addAll(selector.candidates(g.standings, championId));
        }
        List<StandingEntryDTO> promoted = selector.selectFromPool(pool, vacancies);
        if (promoted.size() < vacancies) {
            String msg = "Division " + fromDivision + " pool has " + pool.size() + " candidate(s) for " + vacancies + " vacancies";
            log.warn("[CASCADE] {}", msg);
            moves.summary.getWarnings().add(msg);
        }
        moves.moveAll(new Group(members, pool), promoted, target);
        log.info("[CASCADE] Division {} pool: {} candidate(s), {} promoted to Division {}",
                fromDivision, pool.size(), promoted.size(), target);
    }

    private int arrivalsFrom(Season closing, int fromDivision, int division) {
        int n = closing.getSeasonNumber();
        return (int) teamRepository.findByDivisionOrderByIdAsc(division).stream()
                .filter(t -> t.hasMovedIn(n) && Integer.valueOf(fromDivision).equals(t.getMovedFromDivision()))
                .count();
    }

    /** Members not yet moved in this rollover and their table over the closing season. */
    private Group group(Season closing, int division, String subdivision) {
        List<Team> eligible = teamRepository.findByDivisionAndSubdivisionOrderByIdAsc(division, subdivision).stream()
                .filter(t -> !t.hasMovedIn(closing.getSeasonNumber()))
                .toList();
        List<StandingEntryDTO> table = standingsCalculator.calculate(eligible,
                matchRepository.findCompleted(closing.getId(), division, subdivision, MatchType.LEAGUE));
        return new Group(eligible.stream().collect(Collectors.toMap(Team::getId, Function.identity())), table);
    }

    private record Group(Map<Long, Team> teams, List<StandingEntryDTO> standings) {}

    private final class Moves {
        private final Season closing;
        private final RolloverStage stage;
        private final CascadeSummary summary;
        private long nextSequence;

        Moves(Season closing, RolloverStage stage, CascadeSummary summary) {
            this.closing = closing;
            this.stage = stage;
            this.summary = summary;
            Long max = teamRepository.findMaxArrivalSequence();
            this.nextSequence = max == null ? 1L : max + 1;
        }

        void moveAll(Group group, List<StandingEntryDTO> selected, int toDivision) {
            for (StandingEntryDTO row : selected) {
                Team team = group.teams().get(row.getTeamId());
                try {
                    if (team == null) throw new IllegalStateException("team not in group");
                    move(team, toDivision);
                } catch (RuntimeException ex) {
                    log.error("[CASCADE] {}: failed to move team {} ({}) to Division {}: {}",
                            stage, row.getTeamId(), row.getTeamName(), toDivision, ex.getMessage(), ex);
                    summary.getErrors().add(stage + ": team " + row.getTeamId() + ": " + ex.getMessage());
                }
            }
        }

        private void move(Team team, int toDivision) {
            int from = team.getDivision();
            if (Math.abs(from - toDivision) != 1) {
                throw new IllegalStateException("move from Division " + from + " to " + toDivision + " skips a tier");
            }
            if (team.hasMovedIn(closing.getSeasonNumber())) {
                throw new IllegalStateException("already moved in season " + closing.getSeasonNumber());
            }
            String fromSubdivision = team.getSubdivision();
            Integer previousMoveSeason = team.getMovedInSeason();
            Integer previousMoveFrom = team.getMovedFromDivision();
            Long previousSequence = team.getArrivalSequence();
            team.setDivision(toDivision);
            team.setSubdivision(null);
            team.setMovedInSeason(closing.getSeasonNumber());
            team.setMovedFromDivision(from);
            team.setArrivalSequence(nextSequence);
            try {
                teamRepository.save(team);
            } catch (RuntimeException ex) {
                // managed entity: roll the in-memory move back
                team.setDivision(from);
                team.setSubdivision(fromSubdivision);
                team.setMovedInSeason(previousMoveSeason);
                team.setMovedFromDivision(previousMoveFrom);
                team.setArrivalSequence(previousSequence);
                throw ex;
            }
            nextSequence++;
            summary.getMoves().add(new TeamMove(team.getId(), team.getName(), from, toDivision, stage));
            log.debug("[CASCADE] {} {} Division {} -> {}", stage, team.getName(), from, toDivision);
        }
    }
}
