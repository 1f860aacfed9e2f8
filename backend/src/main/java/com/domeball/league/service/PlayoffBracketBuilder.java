package com.domeball.league.service;

import com.domeball.league.dto.PlayoffBracket;
import com.domeball.league.dto.PlayoffBracket.Pairing;
import com.domeball.league.dto.PlayoffBracket.Seed;
import com.domeball.league.dto.StandingEntryDTO;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Seeds a single-elimination bracket from a final table: seed k plays seed N+1-k, so 8 teams give
 * 1v8, 2v7, 3v6, 4v5 and 4 teams give 1v4, 2v3. The higher seed hosts.
 */
@Component
public class PlayoffBracketBuilder {

    /**
     * @param standings table already in final order
     * @param qualifiers bracket size, a power of two
     * @return empty when fewer than {@code qualifiers} teams are in the table
     */
    public Optional<PlayoffBracket> build(int division, String subdivision, List<StandingEntryDTO> standings, int qualifiers) {
        if (qualifiers < 2 || Integer.bitCount(qualifiers) != 1) {
            throw new IllegalArgumentException("Bracket size must be a power of two, got " + qualifiers);
        }
        if (standings == null || standings.size() < qualifiers) {
            return Optional.empty();
        }

        List<Seed> seeds = new ArrayList<>(qualifiers);
        for (int i = 0; i < qualifiers; i++) {
            StandingEntryDTO row = standings.get(i);
            seeds.add(new Seed(i + 1, row.getTeamId(), row.getTeamName()));
        }

        List<Pairing> firstRound = new ArrayList<>(qualifiers / 2);
        for (int i = 0; i < qualifiers / 2; i++) {
            firstRound.add(new Pairing(i + 1, seeds.get(i), seeds.get(qualifiers - 1 - i)));
        }
        return Optional.of(new PlayoffBracket(division, subdivision, List.copyOf(seeds), List.copyOf(firstRound)));
    }
}
