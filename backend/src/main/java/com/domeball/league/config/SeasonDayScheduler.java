package com.domeball.league.config;

import com.domeball.league.service.SeasonRolloverService;
import com.domeball.league.service.SeasonService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Component
public class SeasonDayScheduler {
    private static final Logger log = LoggerFactory.getLogger(SeasonDayScheduler.class);

    private final SeasonService seasonService;
    private final SeasonRolloverService rolloverService;
    private final boolean enabled;

    public SeasonDayScheduler(SeasonService seasonService, SeasonRolloverService rolloverService,
                              @Value("${league.scheduler.enabled:true}") boolean enabled) {
        this.seasonService = seasonService;
        this.rolloverService = rolloverService;
        this.enabled = enabled;
    }

    // Once per day boundary, advance the active season
    @Scheduled(cron = "${league.scheduler.cron:0 0 3 * * *}")
    public void advanceActiveSeason() {
        if (!enabled) return;
        try {
            seasonService.findActiveSeason().ifPresentOrElse(
                    season -> rolloverService.advanceDay(season.getId()),
                    () -> {
                        log.info("[SEASON] No season found, opening season 1");
                        rolloverService.openFirstSeason(LocalDate.now());
                    });
        } catch (Exception e) {
            log.warn("[SEASON] Day advance failed: {}", e.getMessage(), e);
        }
    }
}
