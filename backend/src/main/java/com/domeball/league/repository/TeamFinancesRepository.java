package com.domeball.league.repository;

import com.domeball.league.model.TeamFinances;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TeamFinancesRepository extends JpaRepository<TeamFinances, Long> {

    Optional<TeamFinances> findByTeamId(Long teamId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TeamFinances f where f.team.id = :teamId")
    int deleteByTeamId(@Param("teamId") Long teamId);
}
