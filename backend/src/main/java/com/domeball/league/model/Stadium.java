package com.domeball.league.model;

import jakarta.persistence.*;

@Entity
@Table(name = "stadiums", uniqueConstraints = {
        @UniqueConstraint(name = "uk_stadium_team", columnNames = {"team_id"})
})
public class Stadium {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_stadium_team"))
    private Team team;

    @Column(nullable = false)
    private int capacity;

    @Column(name = "fan_loyalty", nullable = false)
    private int fanLoyalty;

    public Stadium() {}

    public Stadium(Team team, int capacity, int fanLoyalty) {
        this.team = team;
        this.capacity = capacity;
        this.fanLoyalty = fanLoyalty;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }

    public int getCapacity() { return capacity; }
    public void setCapacity(int capacity) { this.capacity = capacity; }

    public int getFanLoyalty() { return fanLoyalty; }
    public void setFanLoyalty(int fanLoyalty) { this.fanLoyalty = fanLoyalty; }
}
