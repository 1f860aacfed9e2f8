package com.domeball.league.service;

import com.domeball.league.model.Season;
import com.domeball.league.model.SeasonPhase;
import com.domeball.league.repository.SeasonRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeasonServiceTest {

    @Mock private SeasonRepository seasonRepository;
    @InjectMocks private SeasonService seasonService;

    @Test
    void createSeasonStartsOnDayOneOfTheRegularSeason() {
        when(seasonRepository.findBySeasonNumber(1)).thenReturn(Optional.empty());
        when(seasonRepository.save(any(Season.class))).thenAnswer(inv -> inv.getArgument(0));

        Season created = seasonService.createSeason(1, LocalDate.of(2025, 9, 1));

        assertThat(created.getSeasonNumber()).isEqualTo(1);
        assertThat(created.getCurrentDay()).isEqualTo(Season.FIRST_DAY);
        assertThat(created.getPhase()).isEqualTo(SeasonPhase.REGULAR_SEASON);
    }

    @Test
    void createSeasonRefusesAnExistingNumber() {
        when(seasonRepository.findBySeasonNumber(1)).thenReturn(Optional.of(new Season(1, LocalDate.of(2025, 9, 1))));

        assertThatThrownBy(() -> seasonService.createSeason(1, LocalDate.of(2025, 9, 1)))
                .isInstanceOf(IllegalStateException.class);
        verify(seasonRepository, never()).save(any());
    }

    @Test
    void nextSeasonStartsTheDayAfterTheCycleEnds() {
        Season closing = new Season(4, LocalDate.of(2025, 8, 1));
        when(seasonRepository.findBySeasonNumber(5)).thenReturn(Optional.empty());
        when(seasonRepository.save(any(Season.class))).thenAnswer(inv -> inv.getArgument(0));

        Season next = seasonService.openNextSeason(closing);

        assertThat(next.getSeasonNumber()).isEqualTo(5);
        assertThat(next.getStartDate()).isEqualTo(LocalDate.of(2025, 8, 18));
    }
}
