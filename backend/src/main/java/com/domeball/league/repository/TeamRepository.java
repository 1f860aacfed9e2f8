package com.domeball.league.repository;

import com.domeball.league.model.Team;
import com.domeball.league.model.TeamOrigin;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findByDivisionAndSubdivisionOrderByIdAsc(Integer division, String subdivision);

    List<Team> findByDivisionOrderByIdAsc(Integer division);

    // Teams moved by the cascade and not yet placed by the balancer, in arrival order
    @Query("select t from Team t where t.division = :division and t.subdivision is null order by t.arrivalSequence asc, t.id asc")
    List<Team> findUnplacedByDivision(@Param("division") Integer division);

    // Membership aggregation: rows of [division, subdivision, count]
    @Query("select t.division, t.subdivision, count(t) from Team t where t.division is not null and t.subdivision is not null group by t.division, t.subdivision order by t.division asc, t.subdivision asc")
    List<Object[]> countMembersBySubdivision();

    @Query("select distinct t.subdivision from Team t where t.division = :division and t.subdivision is not null order by t.subdivision asc")
    List<String> findSubdivisionNames(@Param("division") Integer division);

    List<Team> findByOrigin(TeamOrigin origin);

    Optional<Team> findFirstByOriginOrderByIdAsc(TeamOrigin origin);

    boolean existsByName(String name);

    @Query("select max(t.arrivalSequence) from Team t")
    Long findMaxArrivalSequence();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Team t set t.wins = 0, t.losses = 0, t.draws = 0, t.points = 0")
    int resetAllCounters();
}
