package com.domeball.league.repository;

import com.domeball.league.model.Match;
import com.domeball.league.model.MatchType;
import com.domeball.league.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MatchRepository extends JpaRepository<Match, Long> {

    long countBySeasonIdAndMatchType(Long seasonId, MatchType matchType);

    boolean existsBySeasonIdAndDivisionAndSubdivisionAndMatchType(Long seasonId, Integer division, String subdivision, MatchType matchType);

    // Completed matches of one group, teams eager-loaded for standings
    @Query("select m from Match m join fetch m.homeTeam join fetch m.awayTeam where m.season.id = :seasonId and m.division = :division and m.subdivision = :subdivision and m.matchType = :matchType and m.status = com.domeball.league.model.MatchStatus.COMPLETED")
    List<Match> findCompleted(@Param("seasonId") Long seasonId, @Param("division") Integer division,
                              @Param("subdivision") String subdivision, @Param("matchType") MatchType matchType);

    @Query("select m from Match m join fetch m.homeTeam join fetch m.awayTeam where m.season.id = :seasonId and m.division = :division and m.subdivision = :subdivision and m.matchType = com.domeball.league.model.MatchType.PLAYOFF order by m.bracketRound asc, m.bracketPosition asc")
    List<Match> findPlayoffMatches(@Param("seasonId") Long seasonId, @Param("division") Integer division,
                                   @Param("subdivision") String subdivision);

    // Historical rows keep their scores; only the team reference moves
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Match m set m.homeTeam = :replacement where m.homeTeam = :team")
    int repointHomeTeam(@Param("team") Team team, @Param("replacement") Team replacement);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Match m set m.awayTeam = :replacement where m.awayTeam = :team")
    int repointAwayTeam(@Param("team") Team team, @Param("replacement") Team replacement);
}
