package com.domeball.league.repository;

import com.domeball.league.model.Season;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SeasonRepository extends JpaRepository<Season, Long> {

    // The active season is the one with the highest number
    Optional<Season> findTopByOrderBySeasonNumberDesc();

    Optional<Season> findBySeasonNumber(Integer seasonNumber);
}
