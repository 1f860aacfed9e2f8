package com.domeball.league.service;

import com.domeball.league.model.Season;
import com.domeball.league.repository.SeasonRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class SeasonService {

    private final SeasonRepository seasonRepository;

    public SeasonService(SeasonRepository seasonRepository) {
        this.seasonRepository = seasonRepository;
    }

    public Season getSeason(Long seasonId) {
        if (seasonId == null) throw new IllegalArgumentException("seasonId is required");
        return seasonRepository.findById(seasonId)
                .orElseThrow(() -> new IllegalArgumentException("Season not found: " + seasonId));
    }

    /** Highest-numbered season. */
    public Optional<Season> findActiveSeason() {
        return seasonRepository.findTopByOrderBySeasonNumberDesc();
    }

    @Transactional
    public Season createSeason(int seasonNumber, LocalDate startDate) {
        if (seasonNumber < 1) throw new IllegalArgumentException("seasonNumber must be >= 1");
        if (startDate == null) throw new IllegalArgumentException("startDate is required");
        if (seasonRepository.findBySeasonNumber(seasonNumber).isPresent()) {
            throw new IllegalStateException("Season " + seasonNumber + " already exists");
        }
        return seasonRepository.save(new Season(seasonNumber, startDate));
    }

    /**
     * Season following {@code closing}, starting the day after its last cycle day. Returns the
     * existing record when it was already created.
     */
    @Transactional
    public Season openNextSeason(Season closing) {
        int next = closing.getSeasonNumber() + 1;
        return seasonRepository.findBySeasonNumber(next)
                .orElseGet(() -> seasonRepository.save(new Season(next, closing.dateOfDay(Season.CYCLE_LENGTH_DAYS + 1))));
    }
}
