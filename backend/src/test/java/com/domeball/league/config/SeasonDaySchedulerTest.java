package com.domeball.league.config;

import com.domeball.league.model.Season;
import com.domeball.league.service.SeasonRolloverService;
import com.domeball.league.service.SeasonService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeasonDaySchedulerTest {

    @Mock private SeasonService seasonService;
    @Mock private SeasonRolloverService rolloverService;

    @Test
    void advancesTheActiveSeason() {
        Season season = new Season(3, LocalDate.of(2025, 8, 1));
        season.setId(9L);
        when(seasonService.findActiveSeason()).thenReturn(Optional.of(season));

        new SeasonDayScheduler(seasonService, rolloverService, true).advanceActiveSeason();

        verify(rolloverService).advanceDay(9L);
    }

    @Test
    void opensTheFirstSeasonOnAnEmptyLeague() {
        when(seasonService.findActiveSeason()).thenReturn(Optional.empty());

        new SeasonDayScheduler(seasonService, rolloverService, true).advanceActiveSeason();

        verify(rolloverService).openFirstSeason(any(LocalDate.class));
        verify(rolloverService, never()).advanceDay(anyLong());
    }

    @Test
    void disabledSchedulerNeverTouchesTheSeason() {
        new SeasonDayScheduler(seasonService, rolloverService, false).advanceActiveSeason();

        verifyNoInteractions(seasonService, rolloverService);
    }

    @Test
    void failureIsLoggedNotThrown() {
        Season season = new Season(3, LocalDate.of(2025, 8, 1));
        season.setId(9L);
        when(seasonService.findActiveSeason()).thenReturn(Optional.of(season));
        when(rolloverService.advanceDay(9L)).thenThrow(new IllegalStateException("db down"));

        SeasonDayScheduler scheduler = new SeasonDayScheduler(seasonService, rolloverService, true);

        assertThatCode(scheduler::advanceActiveSeason).doesNotThrowAnyException();
    }
}
