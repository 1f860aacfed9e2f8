package com.domeball.league.repository;

import com.domeball.league.model.AwardType;
import com.domeball.league.model.SeasonAward;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SeasonAwardRepository extends JpaRepository<SeasonAward, Long> {

    List<SeasonAward> findBySeasonIdOrderByIdAsc(Long seasonId);

    boolean existsBySeasonIdAndTeamIdAndAwardType(Long seasonId, Long teamId, AwardType awardType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from SeasonAward a where a.team.id = :teamId")
    int deleteByTeamId(@Param("teamId") Long teamId);
}
