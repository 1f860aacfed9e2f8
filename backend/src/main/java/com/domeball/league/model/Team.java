package com.domeball.league.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "teams", uniqueConstraints = {
        @UniqueConstraint(name = "uk_team_name", columnNames = {"name"})
}, indexes = {
        @Index(name = "idx_team_division_subdivision", columnList = "division, subdivision"),
        @Index(name = "idx_team_origin", columnList = "origin")
})
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Null only for the placeholder team
    @Column(name = "division")
    private Integer division;

    // Null while a moved team waits for the balancer
    @Column(name = "subdivision", length = 32)
    private String subdivision;

    @Column(nullable = false)
    private int wins;

    @Column(nullable = false)
    private int losses;

    @Column(nullable = false)
    private int draws;

    @Column(nullable = false)
    private int points;

    @Enumerated(EnumType.STRING)
    @Column(name = "origin", nullable = false, length = 16)
    private TeamOrigin origin = TeamOrigin.USER;

    @Column(name = "owner_id", length = 64)
    private String ownerId;

    // Cascade bookkeeping: the closing season number of the last move and where it came from
    @Column(name = "moved_in_season")
    private Integer movedInSeason;

    @Column(name = "moved_from_division")
    private Integer movedFromDivision;

    @Column(name = "arrival_sequence")
    private Long arrivalSequence;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    private void prePersist() {
        if (this.name != null) {
            this.name = this.name.trim();
        }
        if (createdAt == null) createdAt = Instant.now();
    }

    public Team() {}

    public Team(String name, Integer division, String subdivision) {
        this.name = name;
        this.division = division;
        this.subdivision = subdivision;
    }

    public boolean isSynthetic() {
        return origin == TeamOrigin.SYNTHETIC;
    }

    public boolean hasMovedIn(int seasonNumber) {
        return movedInSeason != null && movedInSeason == seasonNumber;
    }

    public int getGamesPlayed() {
        return wins + losses + draws;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Integer getDivision() { return division; }
    public void setDivision(Integer division) { this.division = division; }

    public String getSubdivision() { return subdivision; }
    public void setSubdivision(String subdivision) { this.subdivision = subdivision; }

    public int getWins() { return wins; }
    public void setWins(int wins) { this.wins = wins; }

    public int getLosses() { return losses; }
    public void setLosses(int losses) { this.losses = losses; }

    public int getDraws() { return draws; }
    public void setDraws(int draws) { this.draws = draws; }

    public int getPoints() { return points; }
    public void setPoints(int points) { this.points = points; }

    public TeamOrigin getOrigin() { return origin; }
    public void setOrigin(TeamOrigin origin) { this.origin = origin; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public Integer getMovedInSeason() { return movedInSeason; }
    public void setMovedInSeason(Integer movedInSeason) { this.movedInSeason = movedInSeason; }

    public Integer getMovedFromDivision() { return movedFromDivision; }
    public void setMovedFromDivision(Integer movedFromDivision) { this.movedFromDivision = movedFromDivision; }

    public Long getArrivalSequence() { return arrivalSequence; }
    public void setArrivalSequence(Long arrivalSequence) { this.arrivalSequence = arrivalSequence; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
