package com.domeball.league.repository;

import com.domeball.league.model.Stadium;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StadiumRepository extends JpaRepository<Stadium, Long> {

    Optional<Stadium> findByTeamId(Long teamId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Stadium s where s.team.id = :teamId")
    int deleteByTeamId(@Param("teamId") Long teamId);
}
