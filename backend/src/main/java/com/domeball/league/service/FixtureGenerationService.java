package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.FixtureGenerationSummary;
import com.domeball.league.model.Match;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Season;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.TeamRepository;
import com.domeball.league.service.RoundRobinScheduler.Pairing;
import com.domeball.league.service.RoundRobinScheduler.Round;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Service
public class FixtureGenerationService {

    private static final Logger log = LoggerFactory.getLogger(FixtureGenerationService.class);

    private final SeasonRepository seasonRepository;
    private final TeamRepository teamRepository;
    private final MatchRepository matchRepository;
    private final RoundRobinScheduler scheduler;
    private final KickoffSlotSource kickoffSlotSource;
    private final LeagueSettings settings;

    public FixtureGenerationService(SeasonRepository seasonRepository,
                                    TeamRepository teamRepository,
                                    MatchRepository matchRepository,
                                    RoundRobinScheduler scheduler,
                                    KickoffSlotSource kickoffSlotSource,
                                    LeagueSettings settings) {
        this.seasonRepository = seasonRepository;
        this.teamRepository = teamRepository;
        this.matchRepository = matchRepository;
        this.scheduler = scheduler;
        this.kickoffSlotSource = kickoffSlotSource;
        this.settings = settings;
    }

    /**
     * Builds the 14-day league schedule of every subdivision and stores it in one batch. A season
     * that already has league fixtures is left untouched.
     */
    @Transactional
    public FixtureGenerationSummary generateSeasonFixtures(Long seasonId) {
        Season season = seasonRepository.findById(seasonId)
                .orElseThrow(() -> new IllegalArgumentException("Season not found: " + seasonId));

        // Advisory check only; a concurrent run is not locked out
        long existing = matchRepository.countBySeasonIdAndMatchType(seasonId, MatchType.LEAGUE);
        if (existing > 0) {
            log.info("[FIXTURES] Season {} already has {} league fixtures, skipping generation", season.getSeasonNumber(), existing);
            return FixtureGenerationSummary.alreadyGenerated(seasonId, existing);
        }

        FixtureGenerationSummary summary = new FixtureGenerationSummary(seasonId);
        Random random = new Random(settings.getFixtureSeed() * 31 + season.getSeasonNumber());
        List<Match> batch = new ArrayList<>();

        for (Object[] row : teamRepository.countMembersBySubdivision()) {
            int division = ((Number) row[0]).intValue();
            String subdivision = (String) row[1];
            long members = ((Number) row[2]).longValue();
            String group = "Division " + division + "-" + subdivision;

            if (members < 2) {
                log.warn("[FIXTURES] {} has {} team(s), not enough to schedule", group, members);
                summary.getWarnings().add(group + ": insufficient teams (" + members + ")");
                continue;
            }
            try {
                List<Team> teams = teamRepository.findByDivisionAndSubdivisionOrderByIdAsc(division, subdivision);
                List<Match> groupMatches = toMatches(season, division, subdivision, scheduleGroup(division, teams, random, summary));
                batch.addAll(groupMatches);
                summary.addGroup(groupMatches.size());
            } catch (RuntimeException ex) {
                log.error("[FIXTURES] Failed to schedule {}: {}", group, ex.getMessage(), ex);
                summary.getErrors().add(group + ": " + ex.getMessage());
            }
        }

        matchRepository.saveAll(batch);
        log.info("[FIXTURES] Season {}: {} fixtures across {} subdivisions", season.getSeasonNumber(),
                summary.getMatchesCreated(), summary.getGroupsScheduled());
        return summary;
    }

    List<Round<Team>> scheduleGroup(int division, List<Team> teams, Random random, FixtureGenerationSummary summary) {
        if (teams.size() == 16 && settings.isTopTier(division)) {
            return scheduler.topTierOfSixteen(teams, random);
        }
        if (teams.size() == 8) {
            return scheduler.doubleRoundRobinOfEight(teams);
        }
        String group = "Division " + division + "-" + (teams.isEmpty() ? "?" : teams.get(0).getSubdivision());
        log.warn("[FIXTURES] {} has {} teams, using best-effort rotation", group, teams.size());
        summary.getWarnings().add(group + ": best-effort rotation for " + teams.size() + " teams");
        List<Round<Team>> rounds = new ArrayList<>(RoundRobinScheduler.REGULAR_SEASON_DAYS);
        for (int day = 1; day <= RoundRobinScheduler.REGULAR_SEASON_DAYS; day++) {
            rounds.add(new Round<>(day, scheduler.bestEffortRotation(teams, day)));
        }
        return rounds;
    }

    private List<Match> toMatches(Season season, int division, String subdivision, List<Round<Team>> rounds) {
        List<Match> matches = new ArrayList<>();
        for (Round<Team> round : rounds) {
            List<LocalTime> slots = kickoffSlotSource.slotsForDay(round.day());
            List<Pairing<Team>> pairings = round.pairings();
            for (int i = 0; i < pairings.size(); i++) {
                Pairing<Team> p = pairings.get(i);
                LocalDateTime kickoff = LocalDateTime.of(season.dateOfDay(round.day()), slots.get(i % slots.size()));
                matches.add(new Match(season, p.home(), p.away(), division, subdivision, round.day(), kickoff, MatchType.LEAGUE));
            }
        }
        return matches;
    }
}
