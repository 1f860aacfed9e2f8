package com.domeball.league.service;

import com.domeball.league.dto.AwardsResult;
import com.domeball.league.dto.CascadeSummary;
import com.domeball.league.dto.FixtureGenerationSummary;
import com.domeball.league.dto.RolloverSummary;
import com.domeball.league.model.RolloverCheckpoint;
import com.domeball.league.model.RolloverStage;
import com.domeball.league.model.Season;
import com.domeball.league.model.SeasonPhase;
import com.domeball.league.repository.RolloverCheckpointRepository;
import com.domeball.league.repository.SeasonRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.function.Function;

/**
 * Day-boundary driver of the 17-day cycle.
 *
 * <ul>
 *   <li>14 -> 15: playoffs are seeded and the first round scheduled</li>
 *   <li>15 -> 16: awards and prizes, then off-season</li>
 *   <li>17 -> 1: {@link #rollover(Long)}</li>
 * </ul>
 * Every other boundary only moves the day counter.
 */
@Service
public class SeasonRolloverService {

    private static final Logger log = LoggerFactory.getLogger(SeasonRolloverService.class);

    private final SeasonService seasonService;
    private final SeasonRepository seasonRepository;
    private final TeamRepository teamRepository;
    private final RolloverCheckpointRepository checkpointRepository;
    private final PlayoffService playoffService;
    private final SeasonAwardsGateway awardsGateway;
    private final SyntheticTeamPurgeService purgeService;
    private final PromotionRelegationService promotionRelegationService;
    private final SubdivisionBalancer balancer;
    private final FixtureGenerationService fixtureGenerationService;
    private final TransactionTemplate tx;

    public SeasonRolloverService(SeasonService seasonService,
                                 SeasonRepository seasonRepository,
                                 TeamRepository teamRepository,
                                 RolloverCheckpointRepository checkpointRepository,
                                 PlayoffService playoffService,
                                 SeasonAwardsGateway awardsGateway,
                                 SyntheticTeamPurgeService purgeService,
                                 PromotionRelegationService promotionRelegationService,
                                 SubdivisionBalancer balancer,
                                 FixtureGenerationService fixtureGenerationService,
                                 PlatformTransactionManager transactionManager) {
        this.seasonService = seasonService;
        this.seasonRepository = seasonRepository;
        this.teamRepository = teamRepository;
        this.checkpointRepository = checkpointRepository;
        this.playoffService = playoffService;
        this.awardsGateway = awardsGateway;
        this.purgeService = purgeService;
        this.promotionRelegationService = promotionRelegationService;
        this.balancer = balancer;
        this.fixtureGenerationService = fixtureGenerationService;
        this.tx = new TransactionTemplate(transactionManager);
    }

    /** Opens season 1 on a league that has none yet and schedules its fixtures. */
    public Season openFirstSeason(LocalDate startDate) {
        return tx.execute(status -> {
            Season created = seasonService.createSeason(1, startDate);
            FixtureGenerationSummary fixtures = fixtureGenerationService.generateSeasonFixtures(created.getId());
            log.info("[SEASON] Opened season 1 on {} with {} match(es), {} warning(s)",
                    startDate, fixtures.getMatchesCreated(), fixtures.getWarnings().size());
            return created;
        });
    }

    /** Moves the season one day forward; returns the season that is active afterwards. */
    public Season advanceDay(Long seasonId) {
        Season season = seasonService.getSeason(seasonId);
        int day = season.getCurrentDay();
        log.info("[SEASON] Season {} closing day {}", season.getSeasonNumber(), day);

        if (day == Season.LAST_REGULAR_DAY) {
            Season updated = moveTo(season, Season.PLAYOFF_DAY, SeasonPhase.PLAYOFFS);
            playoffService.schedulePlayoffs(seasonId);
            return updated;
        }
        if (day == Season.PLAYOFF_DAY) {
            AwardsResult awards = awardsGateway.computeAwards(seasonId);
            AwardsResult prizes = awardsGateway.distributePrizes(seasonId);
            log.info("[SEASON] Season {}: {} award(s), {} prize(s) paid for {} credits", season.getSeasonNumber(),
                    awards.awardsGranted(), prizes.awardsGranted(), prizes.creditsDistributed());
            return moveTo(season, Season.PLAYOFF_DAY + 1, SeasonPhase.OFF_SEASON);
        }
        if (day >= Season.CYCLE_LENGTH_DAYS) {
            RolloverSummary summary = rollover(seasonId);
            return seasonService.getSeason(summary.getNewSeasonId());
        }
        return moveTo(season, day + 1, season.getPhase());
    }

    /**
     * Closes a season and opens the next: purge, cascade, balance, counter reset, new season,
     * fixtures. Stages already recorded in the checkpoint of this season are skipped, so a failed
     * run can simply be repeated.
     */
    public RolloverSummary rollover(Long seasonId) {
        Season closing = seasonService.getSeason(seasonId);
        if (closing.getPhase() != SeasonPhase.OFF_SEASON) {
            throw new IllegalStateException("Season " + closing.getSeasonNumber() + " is in " + closing.getPhase() + ", not the off-season");
        }
        int number = closing.getSeasonNumber();
        RolloverSummary summary = new RolloverSummary(number);
        log.info("[ROLLOVER] Starting rollover of season {}", number);

        // Purge commits team by team, so only the checkpoint is written transactionally
        if (pending(number, RolloverStage.PURGE_SYNTHETIC_TEAMS, summary)) {
            summary.setPurge(purgeService.purgeSyntheticTeams());
            summary.getErrors().addAll(summary.getPurge().getErrors());
            tx.executeWithoutResult(status -> complete(number, RolloverStage.PURGE_SYNTHETIC_TEAMS, summary));
        }

        cascadeStage(closing, RolloverStage.DIVISION_1_RELEGATION, summary, promotionRelegationService::relegateFromDivisionOne);
        cascadeStage(closing, RolloverStage.DIVISION_2_PROMOTION, summary, promotionRelegationService::promoteFromDivisionTwo);
        cascadeStage(closing, RolloverStage.DIVISION_2_RELEGATION, summary, promotionRelegationService::relegateFromDivisionTwo);
        cascadeStage(closing, RolloverStage.DIVISION_3_POOL_PROMOTION, summary, promotionRelegationService::promoteDivisionThreePool);
        cascadeStage(closing, RolloverStage.LOWER_DIVISION_CASCADE, summary, promotionRelegationService::cascadeLowerDivisions);

        if (pending(number, RolloverStage.BALANCE_SUBDIVISIONS, summary)) {
            tx.executeWithoutResult(status -> {
                summary.setBalance(balancer.balanceAll());
                complete(number, RolloverStage.BALANCE_SUBDIVISIONS, summary);
            });
            summary.getErrors().addAll(summary.getBalance().getErrors());
        }

        if (pending(number, RolloverStage.RESET_COUNTERS, summary)) {
            tx.executeWithoutResult(status -> {
                summary.setCountersReset(teamRepository.resetAllCounters());
                complete(number, RolloverStage.RESET_COUNTERS, summary);
            });
        }

        Season next;
        if (pending(number, RolloverStage.CREATE_SEASON, summary)) {
            next = tx.execute(status -> {
                Season created = seasonService.openNextSeason(closing);
                complete(number, RolloverStage.CREATE_SEASON, summary);
                return created;
            });
        } else {
            next = seasonRepository.findBySeasonNumber(number + 1)
                    .orElseThrow(() -> new IllegalStateException("Checkpoint says season " + (number + 1) + " exists but it was not found"));
        }
        summary.setNewSeasonId(next.getId());

        if (pending(number, RolloverStage.GENERATE_FIXTURES, summary)) {
            tx.executeWithoutResult(status -> {
                summary.setFixtures(fixtureGenerationService.generateSeasonFixtures(next.getId()));
                complete(number, RolloverStage.GENERATE_FIXTURES, summary);
            });
            summary.getErrors().addAll(summary.getFixtures().getErrors());
        }

        CascadeSummary cascade = summary.getCascade();
        log.info("[ROLLOVER] Season {} -> {}: {} promoted, {} relegated, {} stage(s) run, {} skipped, {} error(s)",
                number, next.getSeasonNumber(), cascade.getPromotedCount(), cascade.getRelegatedCount(),
                summary.getStagesRun().size(), summary.getStagesSkipped().size(), summary.getErrors().size());
        return summary;
    }

    private void cascadeStage(Season closing, RolloverStage stage, RolloverSummary summary,
                              Function<Season, CascadeSummary> work) {
        int number = closing.getSeasonNumber();
        if (!pending(number, stage, summary)) return;
        CascadeSummary result = tx.execute(status -> {
            CascadeSummary s = work.apply(closing);
            complete(number, stage, summary);
            return s;
        });
        summary.getCascade().merge(result);
        if (result != null) summary.getErrors().addAll(result.getErrors());
    }

    private boolean pending(int seasonNumber, RolloverStage stage, RolloverSummary summary) {
        RolloverStage last = checkpointRepository.findBySeasonNumber(seasonNumber)
                .map(RolloverCheckpoint::getLastCompletedStage)
                .orElse(null);
        if (stage.isAfter(last)) return true;
        log.info("[ROLLOVER] Season {}: stage {} already done, skipping", seasonNumber, stage);
        summary.getStagesSkipped().add(stage);
        return false;
    }

    private void complete(int seasonNumber, RolloverStage stage, RolloverSummary summary) {
        RolloverCheckpoint cp = checkpointRepository.findBySeasonNumber(seasonNumber)
                .orElseGet(() -> new RolloverCheckpoint(seasonNumber));
        cp.setLastCompletedStage(stage);
        checkpointRepository.save(cp);
        summary.getStagesRun().add(stage);
        log.info("[ROLLOVER] Season {}: stage {} complete", seasonNumber, stage);
    }

    private Season moveTo(Season season, int day, SeasonPhase phase) {
        season.setCurrentDay(day);
        season.setPhase(phase);
        Season saved = tx.execute(status -> seasonRepository.save(season));
        log.info("[SEASON] Season {} now on day {} ({})", season.getSeasonNumber(), day, phase);
        return saved;
    }
}
