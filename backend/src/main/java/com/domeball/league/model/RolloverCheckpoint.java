package com.domeball.league.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "rollover_checkpoints", uniqueConstraints = {
        @UniqueConstraint(name = "uk_checkpoint_season_number", columnNames = {"season_number"})
})
public class RolloverCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Number of the season being closed
    @Column(name = "season_number", nullable = false)
    private Integer seasonNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_completed_stage", length = 32)
    private RolloverStage lastCompletedStage;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = Instant.now();
    }

    public RolloverCheckpoint() {}

    public RolloverCheckpoint(Integer seasonNumber) {
        this.seasonNumber = seasonNumber;
    }

    public boolean isCompleted(RolloverStage stage) {
        return lastCompletedStage != null && lastCompletedStage.ordinal() >= stage.ordinal();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Integer getSeasonNumber() { return seasonNumber; }
    public void setSeasonNumber(Integer seasonNumber) { this.seasonNumber = seasonNumber; }

    public RolloverStage getLastCompletedStage() { return lastCompletedStage; }
    public void setLastCompletedStage(RolloverStage lastCompletedStage) { this.lastCompletedStage = lastCompletedStage; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
