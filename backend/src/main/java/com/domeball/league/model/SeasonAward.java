package com.domeball.league.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "season_awards", uniqueConstraints = {
        @UniqueConstraint(name = "uk_award_season_team_type", columnNames = {"season_id", "team_id", "award_type"})
})
public class SeasonAward {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "season_id", nullable = false, foreignKey = @ForeignKey(name = "fk_award_season"))
    private Season season;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_award_team"))
    private Team team;

    @Enumerated(EnumType.STRING)
    @Column(name = "award_type", nullable = false, length = 32)
    private AwardType awardType;

    @Column(nullable = false)
    private Integer division;

    @Column(length = 32)
    private String subdivision;

    @Column(name = "prize_credits", nullable = false)
    private long prizeCredits;

    @Column(name = "paid_out", nullable = false)
    private boolean paidOut;

    @Column(name = "awarded_at")
    private Instant awardedAt;

    @PrePersist
    public void prePersist() {
        if (awardedAt == null) awardedAt = Instant.now();
    }

    public SeasonAward() {}

    public SeasonAward(Season season, Team team, AwardType awardType, Integer division, String subdivision, long prizeCredits) {
        this.season = season;
        this.team = team;
        this.awardType = awardType;
        this.division = division;
        this.subdivision = subdivision;
        this.prizeCredits = prizeCredits;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Season getSeason() { return season; }
    public void setSeason(Season season) { this.season = season; }

    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }

    public AwardType getAwardType() { return awardType; }
    public void setAwardType(AwardType awardType) { this.awardType = awardType; }

    public Integer getDivision() { return division; }
    public void setDivision(Integer division) { this.division = division; }

    public String getSubdivision() { return subdivision; }
    public void setSubdivision(String subdivision) { this.subdivision = subdivision; }

    public long getPrizeCredits() { return prizeCredits; }
    public void setPrizeCredits(long prizeCredits) { this.prizeCredits = prizeCredits; }

    public boolean isPaidOut() { return paidOut; }
    public void setPaidOut(boolean paidOut) { this.paidOut = paidOut; }

    public Instant getAwardedAt() { return awardedAt; }
    public void setAwardedAt(Instant awardedAt) { this.awardedAt = awardedAt; }
}
