package com.domeball.league.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "seasons", uniqueConstraints = {
        @UniqueConstraint(name = "uk_season_number", columnNames = {"season_number"})
})
public class Season {

    public static final int FIRST_DAY = 1;
    public static final int LAST_REGULAR_DAY = 14;
    public static final int PLAYOFF_DAY = 15;
    public static final int CYCLE_LENGTH_DAYS = 17;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_number", nullable = false)
    private Integer seasonNumber;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "current_day", nullable = false)
    private Integer currentDay = FIRST_DAY;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 16)
    private SeasonPhase phase = SeasonPhase.REGULAR_SEASON;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public Season() {}

    public Season(Integer seasonNumber, LocalDate startDate) {
        this.seasonNumber = seasonNumber;
        this.startDate = startDate;
    }

    /** Calendar date of a given season day (day 1 is the start date). */
    public LocalDate dateOfDay(int day) {
        return startDate.plusDays(day - 1L);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Integer getSeasonNumber() { return seasonNumber; }
    public void setSeasonNumber(Integer seasonNumber) { this.seasonNumber = seasonNumber; }

    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }

    public Integer getCurrentDay() { return currentDay; }
    public void setCurrentDay(Integer currentDay) { this.currentDay = currentDay; }

    public SeasonPhase getPhase() { return phase; }
    public void setPhase(SeasonPhase phase) { this.phase = phase; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
