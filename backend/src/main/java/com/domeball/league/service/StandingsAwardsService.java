package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.AwardsResult;
import com.domeball.league.dto.StandingEntryDTO;
import com.domeball.league.model.AwardType;
import com.domeball.league.model.Season;
import com.domeball.league.model.SeasonAward;
import com.domeball.league.model.Team;
import com.domeball.league.model.TeamFinances;
import com.domeball.league.repository.SeasonAwardRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.TeamFinancesRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Default awards: champion and runner-up of every subdivision table plus the playoff champion,
 * each with a fixed credit prize. Re-running either step does not duplicate awards or payouts.
 */
@Service
public class StandingsAwardsService implements SeasonAwardsGateway {

    private static final Logger log = LoggerFactory.getLogger(StandingsAwardsService.class);

    private final SeasonRepository seasonRepository;
    private final TeamRepository teamRepository;
    private final SeasonAwardRepository awardRepository;
    private final TeamFinancesRepository financesRepository;
    private final StandingsService standingsService;
    private final PlayoffService playoffService;
    private final LeagueSettings settings;

    public StandingsAwardsService(SeasonRepository seasonRepository, TeamRepository teamRepository,
                                  SeasonAwardRepository awardRepository, TeamFinancesRepository financesRepository,
                                  StandingsService standingsService, PlayoffService playoffService,
                                  LeagueSettings settings) {
        this.seasonRepository = seasonRepository;
        this.teamRepository = teamRepository;
        this.awardRepository = awardRepository;
        this.financesRepository = financesRepository;
        this.standingsService = standingsService;
        this.playoffService = playoffService;
        this.settings = settings;
    }

    @Override
    @Transactional
    public AwardsResult computeAwards(Long seasonId) {
        Season season = seasonRepository.findById(seasonId)
                .orElseThrow(() -> new IllegalArgumentException("Season not found: " + seasonId));
        int granted = 0;
        long total = 0;
        for (Object[] row : teamRepository.countMembersBySubdivision()) {
            int division = ((Number) row[0]).intValue();
            String subdivision = (String) row[1];
            List<StandingEntryDTO> table = standingsService.standings(seasonId, division, subdivision);
            if (table.isEmpty() || table.get(0).getPlayed() == 0) continue;

            if (grant(season, table.get(0).getTeamId(), AwardType.SUBDIVISION_CHAMPION, division, subdivision, settings.getChampionPrizeCredits())) {
                granted++;
                total += settings.getChampionPrizeCredits();
            }
            if (table.size() > 1 && grant(season, table.get(1).getTeamId(), AwardType.SUBDIVISION_RUNNER_UP, division, subdivision, settings.getRunnerUpPrizeCredits())) {
                granted++;
                total += settings.getRunnerUpPrizeCredits();
            }
            Optional<Team> champion = playoffService.champion(seasonId, division, subdivision);
            if (champion.isPresent() && grant(season, champion.get().getId(), AwardType.PLAYOFF_CHAMPION, division, subdivision, settings.getPlayoffChampionPrizeCredits())) {
                granted++;
                total += settings.getPlayoffChampionPrizeCredits();
            }
        }
        log.info("[AWARDS] Season {}: {} award(s) worth {} credits", season.getSeasonNumber(), granted, total);
        return new AwardsResult(granted, total);
    }

    @Override
    @Transactional
    public AwardsResult distributePrizes(Long seasonId) {
        if (!seasonRepository.existsById(seasonId)) throw new IllegalArgumentException("Season not found: " + seasonId);
        int paid = 0;
        long total = 0;
        for (SeasonAward award : awardRepository.findBySeasonIdOrderByIdAsc(seasonId)) {
            if (award.isPaidOut()) continue;
            Team team = award.getTeam();
            TeamFinances finances = financesRepository.findByTeamId(team.getId())
                    .orElseGet(() -> new TeamFinances(team, 0L, 0));
            finances.setCredits(finances.getCredits() + award.getPrizeCredits());
            financesRepository.save(finances);
            award.setPaidOut(true);
            awardRepository.save(award);
            paid++;
            total += award.getPrizeCredits();
        }
        log.info("[AWARDS] Paid {} prize(s), {} credits in total", paid, total);
        return new AwardsResult(paid, total);
    }

    private boolean grant(Season season, Long teamId, AwardType type, int division, String subdivision, long credits) {
        if (awardRepository.existsBySeasonIdAndTeamIdAndAwardType(season.getId(), teamId, type)) return false;
        Team team = teamRepository.getReferenceById(teamId);
        awardRepository.save(new SeasonAward(season, team, type, division, subdivision, credits));
        return true;
    }
}
