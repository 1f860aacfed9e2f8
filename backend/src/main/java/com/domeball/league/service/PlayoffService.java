package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.PlayoffBracket;
import com.domeball.league.dto.StandingEntryDTO;
import com.domeball.league.model.Match;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Season;
import com.domeball.league.model.Team;
import com.domeball.league.repository.MatchRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class PlayoffService {

    private static final Logger log = LoggerFactory.getLogger(PlayoffService.class);

    private final SeasonRepository seasonRepository;
    private final TeamRepository teamRepository;
    private final MatchRepository matchRepository;
    private final StandingsService standingsService;
    private final PlayoffBracketBuilder bracketBuilder;
    private final LeagueSettings settings;

    public PlayoffService(SeasonRepository seasonRepository, TeamRepository teamRepository,
                          MatchRepository matchRepository, StandingsService standingsService,
                          PlayoffBracketBuilder bracketBuilder, LeagueSettings settings) {
        this.seasonRepository = seasonRepository;
        this.teamRepository = teamRepository;
        this.matchRepository = matchRepository;
        this.standingsService = standingsService;
        this.bracketBuilder = bracketBuilder;
        this.settings = settings;
    }

    /**
     * Seeds every subdivision and schedules the first round on the playoff day. Subdivisions with
     * too few teams or an existing first round are skipped.
     */
    @Transactional
    public List<PlayoffBracket> schedulePlayoffs(Long seasonId) {
        Season season = requireSeason(seasonId);
        List<PlayoffBracket> scheduled = new ArrayList<>();
        for (Object[] row : teamRepository.countMembersBySubdivision()) {
            int division = ((Number) row[0]).intValue();
            String subdivision = (String) row[1];
            schedulePlayoffs(season, division, subdivision).ifPresent(scheduled::add);
        }
        log.info("[PLAYOFFS] Season {}: {} bracket(s) scheduled", season.getSeasonNumber(), scheduled.size());
        return scheduled;
    }

    @Transactional
    public Optional<PlayoffBracket> schedulePlayoffs(Long seasonId, int division, String subdivision) {
        return schedulePlayoffs(requireSeason(seasonId), division, subdivision);
    }

    private Optional<PlayoffBracket> schedulePlayoffs(Season season, int division, String subdivision) {
        if (matchRepository.existsBySeasonIdAndDivisionAndSubdivisionAndMatchType(season.getId(), division, subdivision, MatchType.PLAYOFF)) {
            log.debug("[PLAYOFFS] Division {}-{} already has a bracket", division, subdivision);
            return Optional.empty();
        }
        int qualifiers = settings.playoffQualifiers(division);
        List<StandingEntryDTO> table = standingsService.standings(season.getId(), division, subdivision);
        Optional<PlayoffBracket> bracket = bracketBuilder.build(division, subdivision, table, qualifiers);
        if (bracket.isEmpty()) {
            log.warn("[PLAYOFFS] Division {}-{} has {} team(s), {} needed; no bracket", division, subdivision, table.size(), qualifiers);
            return Optional.empty();
        }

        LocalDateTime kickoff = LocalDateTime.of(season.dateOfDay(Season.PLAYOFF_DAY), settings.getPlayoffFirstRoundKickoff());
        List<Match> matches = new ArrayList<>();
        for (PlayoffBracket.Pairing p : bracket.get().firstRound()) {
            Match m = new Match(season, teamRepository.getReferenceById(p.home().teamId()),
                    teamRepository.getReferenceById(p.away().teamId()), division, subdivision,
                    Season.PLAYOFF_DAY, kickoff, MatchType.PLAYOFF);
            m.setBracketRound(1);
            m.setBracketPosition(p.position());
            matches.add(m);
        }
        matchRepository.saveAll(matches);
        return bracket;
    }

    /**
     * Pairs the winners of a fully completed round into the next one, in bracket order. Returns
     * the number of matches created; 0 while the round is still open or after the final.
     */
    @Transactional
    public int advance(Long seasonId, int division, String subdivision) {
        Season season = requireSeason(seasonId);
        List<Match> latest = latestRound(matchRepository.findPlayoffMatches(seasonId, division, subdivision));
        if (latest.size() < 2) return 0;
        if (latest.stream().anyMatch(m -> !m.isCompleted())) {
            log.debug("[PLAYOFFS] Division {}-{} round {} still in progress", division, subdivision, latest.get(0).getBracketRound());
            return 0;
        }

        int nextRound = latest.get(0).getBracketRound() + 1;
        LocalDateTime kickoff = LocalDateTime.of(season.dateOfDay(Season.PLAYOFF_DAY), settings.getPlayoffFirstRoundKickoff())
                .plusMinutes((long) (nextRound - 1) * settings.getSlotSpacingMinutes());
        List<Match> next = new ArrayList<>();
        for (int i = 0; i + 1 < latest.size(); i += 2) {
            Team home = latest.get(i).getWinner();
            Team away = latest.get(i + 1).getWinner();
            Match m = new Match(season, home, away, division, subdivision, Season.PLAYOFF_DAY, kickoff, MatchType.PLAYOFF);
            m.setBracketRound(nextRound);
            m.setBracketPosition(i / 2 + 1);
            next.add(m);
        }
        matchRepository.saveAll(next);
        log.info("[PLAYOFFS] Division {}-{} advanced to round {} ({} match(es))", division, subdivision, nextRound, next.size());
        return next.size();
    }

    /** Winner of the completed final, if the bracket has been played out. */
    @Transactional(readOnly = true)
    public Optional<Team> champion(Long seasonId, int division, String subdivision) {
        List<Match> latest = latestRound(matchRepository.findPlayoffMatches(seasonId, division, subdivision));
        if (latest.size() != 1 || !latest.get(0).isCompleted()) return Optional.empty();
        return Optional.of(latest.get(0).getWinner());
    }

    private static List<Match> latestRound(List<Match> playoffMatches) {
        int max = playoffMatches.stream().mapToInt(Match::getBracketRound).max().orElse(0);
        return playoffMatches.stream().filter(m -> m.getBracketRound() == max).toList();
    }

    private Season requireSeason(Long seasonId) {
        return seasonRepository.findById(seasonId)
                .orElseThrow(() -> new IllegalArgumentException("Season not found: " + seasonId));
    }
}
