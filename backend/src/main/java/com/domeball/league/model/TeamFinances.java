package com.domeball.league.model;

import jakarta.persistence.*;

@Entity
@Table(name = "team_finances", uniqueConstraints = {
        @UniqueConstraint(name = "uk_finances_team", columnNames = {"team_id"})
})
public class TeamFinances {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_finances_team"))
    private Team team;

    @Column(nullable = false)
    private long credits;

    @Column(nullable = false)
    private int gems;

    public TeamFinances() {}

    public TeamFinances(Team team, long credits, int gems) {
        this.team = team;
        this.credits = credits;
        this.gems = gems;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }

    public long getCredits() { return credits; }
    public void setCredits(long credits) { this.credits = credits; }

    public int getGems() { return gems; }
    public void setGems(int gems) { this.gems = gems; }
}
