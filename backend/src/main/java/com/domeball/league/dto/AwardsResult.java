package com.domeball.league.dto;

/** Counts reported by the awards collaborator; used for logging only. */
public record AwardsResult(int awardsGranted, long creditsDistributed) {

    public static AwardsResult none() {
        return new AwardsResult(0, 0L);
    }
}
