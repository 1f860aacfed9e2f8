package com.domeball.league.dto;

import java.util.List;

/**
 * Seeded single-elimination bracket of one league (division + subdivision). Only the first
 * round is planned; later rounds are paired from winners once a round completes.
 */
public record PlayoffBracket(
        int division,
        String subdivision,
        List<Seed> seeds,
        List<Pairing> firstRound
) {

    public record Seed(int seed, Long teamId, String teamName) {}

    public record Pairing(int position, Seed home, Seed away) {}

    public int size() {
        return seeds.size();
    }
}
