package com.domeball.league.repository;

import com.domeball.league.model.RolloverCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RolloverCheckpointRepository extends JpaRepository<RolloverCheckpoint, Long> {

    Optional<RolloverCheckpoint> findBySeasonNumber(Integer seasonNumber);
}
