package com.domeball.league.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Pairing tables for a regular season of {@value #REGULAR_SEASON_DAYS} game days.
 *
 * <p>Three paths:
 * <ul>
 *   <li>{@link #doubleRoundRobinOfEight}: canonical 7-round table played twice, second half with
 *   home/away reversed</li>
 *   <li>{@link #topTierOfSixteen}: shuffled circle method, 8 games a day, no pair repeated</li>
 *   <li>{@link #bestEffortRotation}: index rotation for odd-sized groups, not guaranteed complete</li>
 * </ul>
 */
@Component
public class RoundRobinScheduler {

    public static final int REGULAR_SEASON_DAYS = 14;

    /** A single game: first team hosts. */
    public record Pairing<T>(T home, T away) {}

    /** All games of one game day (1-based). */
    public record Round<T>(int day, List<Pairing<T>> pairings) {}

    /**
     * Double round-robin for exactly 8 teams over 14 days. Round r pairs index i with i XOR r, so
     * day 1 is (1,2) (3,4) (5,6) (7,8) with the first-listed team at home. Days 8-14 replay days
     * 1-7 reversed.
     */
    public <T> List<Round<T>> doubleRoundRobinOfEight(List<T> teams) {
        if (teams == null || teams.size() != 8) throw new IllegalArgumentException("Expected 8 teams");

        List<Round<T>> firstHalf = new ArrayList<>(7);
        for (int r = 1; r <= 7; r++) {
            List<Pairing<T>> pairings = new ArrayList<>(4);
            for (int i = 0; i < 8; i++) {
                int j = i ^ r;
                if (j < i) continue;
                // alternate hosting so nobody hosts every first-half game
                boolean flip = (r - 1) % 2 == 1 && i % 4 != 0;
                pairings.add(flip ? new Pairing<>(teams.get(j), teams.get(i)) : new Pairing<>(teams.get(i), teams.get(j)));
            }
            firstHalf.add(new Round<>(r, pairings));
        }

        List<Round<T>> all = new ArrayList<>(REGULAR_SEASON_DAYS);
        all.addAll(firstHalf);
        for (Round<T> round : firstHalf) {
            List<Pairing<T>> reversed = round.pairings().stream()
                    .map(p -> new Pairing<>(p.away(), p.home()))
                    .toList();
            all.add(new Round<>(round.day() + 7, reversed));
        }
        return all;
    }

    /**
     * 14 days of 8 games for a 16-team cohort (112 games). The order is shuffled with the given
     * random source, then paired with the circle method; 14 of its 15 rounds are used, so no pair
     * meets twice.
     */
    public <T> List<Round<T>> topTierOfSixteen(List<T> teams, Random random) {
        if (teams == null || teams.size() != 16) throw new IllegalArgumentException("Expected 16 teams");

        List<T> order = new ArrayList<>(teams);
        Collections.shuffle(order, random);
        int n = order.size();

        List<Round<T>> rounds = new ArrayList<>(REGULAR_SEASON_DAYS);
        for (int r = 0; r < REGULAR_SEASON_DAYS; r++) {
            List<Pairing<T>> pairings = new ArrayList<>(n / 2);
            for (int i = 0; i < n / 2; i++) {
                T a = order.get(i);
                T b = order.get(n - 1 - i);
                boolean swap = i == 0 ? r % 2 == 1 : (r + i) % 2 == 1;
                pairings.add(swap ? new Pairing<>(b, a) : new Pairing<>(a, b));
            }
            rounds.add(new Round<>(r + 1, pairings));
            // keep slot 0 fixed, rotate the rest one step
            T last = order.remove(n - 1);
            order.add(1, last);
        }
        return rounds;
    }

    /**
     * Index rotation {@code team[i] vs team[(i + day + n/2 - 1) mod n]} for one day, skipping
     * self-pairings and teams already paired that day. Some teams may sit out and some pairs may
     * repeat across days.
     */
    public <T> List<Pairing<T>> bestEffortRotation(List<T> teams, int day) {
        int n = teams == null ? 0 : teams.size();
        List<Pairing<T>> pairings = new ArrayList<>();
        if (n < 2) return pairings;

        boolean[] paired = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (paired[i]) continue;
            int j = Math.floorMod(i + day + n / 2 - 1, n);
            if (j == i || paired[j]) continue;
            pairings.add(new Pairing<>(teams.get(i), teams.get(j)));
            paired[i] = true;
            paired[j] = true;
        }
        return pairings;
    }
}
