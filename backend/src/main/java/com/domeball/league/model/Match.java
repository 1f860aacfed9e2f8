package com.domeball.league.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_matches_season_type", columnList = "season_id, match_type"),
        @Index(name = "idx_matches_season_group", columnList = "season_id, division, subdivision"),
        @Index(name = "idx_matches_scheduled_at", columnList = "scheduled_at")
})
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "season_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_season"))
    private Season season;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "home_team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_home_team"))
    private Team homeTeam;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "away_team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_away_team"))
    private Team awayTeam;

    @Column(nullable = false)
    private Integer division;

    @Column(length = 32)
    private String subdivision;

    @Column(name = "game_day", nullable = false)
    private Integer gameDay;

    @Column(name = "scheduled_at", nullable = false)
    private LocalDateTime scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 16)
    private MatchType matchType = MatchType.LEAGUE;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MatchStatus status = MatchStatus.SCHEDULED;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    // Playoff rows only
    @Column(name = "bracket_round")
    private Integer bracketRound;

    @Column(name = "bracket_position")
    private Integer bracketPosition;

    public Match() {}

    public Match(Season season, Team homeTeam, Team awayTeam, Integer division, String subdivision,
                 Integer gameDay, LocalDateTime scheduledAt, MatchType matchType) {
        this.season = season;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.division = division;
        this.subdivision = subdivision;
        this.gameDay = gameDay;
        this.scheduledAt = scheduledAt;
        this.matchType = matchType;
    }

    public boolean isCompleted() {
        return status == MatchStatus.COMPLETED && homeScore != null && awayScore != null;
    }

    /** Winner of a completed match; a drawn playoff game goes to the home side (the higher seed). */
    public Team getWinner() {
        if (!isCompleted()) return null;
        return awayScore > homeScore ? awayTeam : homeTeam;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Season getSeason() { return season; }
    public void setSeason(Season season) { this.season = season; }

    public Team getHomeTeam() { return homeTeam; }
    public void setHomeTeam(Team homeTeam) { this.homeTeam = homeTeam; }

    public Team getAwayTeam() { return awayTeam; }
    public void setAwayTeam(Team awayTeam) { this.awayTeam = awayTeam; }

    public Integer getDivision() { return division; }
    public void setDivision(Integer division) { this.division = division; }

    public String getSubdivision() { return subdivision; }
    public void setSubdivision(String subdivision) { this.subdivision = subdivision; }

    public Integer getGameDay() { return gameDay; }
    public void setGameDay(Integer gameDay) { this.gameDay = gameDay; }

    public LocalDateTime getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(LocalDateTime scheduledAt) { this.scheduledAt = scheduledAt; }

    public MatchType getMatchType() { return matchType; }
    public void setMatchType(MatchType matchType) { this.matchType = matchType; }

    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }

    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }

    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }

    public Integer getBracketRound() { return bracketRound; }
    public void setBracketRound(Integer bracketRound) { this.bracketRound = bracketRound; }

    public Integer getBracketPosition() { return bracketPosition; }
    public void setBracketPosition(Integer bracketPosition) { this.bracketPosition = bracketPosition; }
}
