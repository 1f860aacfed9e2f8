package com.domeball.league.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * League structure and tunables. Division sizes are fixed; the rest is bound from
 * {@code league.*} properties.
 */
@Component
public class LeagueSettings {

    public static final int TOP_DIVISION = 1;
    public static final int BOTTOM_DIVISION = 8;
    public static final int TOP_TIER_LAST_DIVISION = 2;

    private static final int TOP_TIER_SUBDIVISION_SIZE = 16;
    private static final int STANDARD_SUBDIVISION_SIZE = 8;

    private final List<LocalTime> dayStartTimes;
    private final int slotsPerDay;
    private final int slotSpacingMinutes;
    private final LocalTime playoffFirstRoundKickoff;
    private final long fixtureSeed;
    private final String syntheticOwnerId;
    private final long syntheticStartingCredits;
    private final int syntheticStartingGems;
    private final int syntheticStadiumCapacity;
    private final int syntheticFanLoyalty;
    private final long championPrizeCredits;
    private final long runnerUpPrizeCredits;
    private final long playoffChampionPrizeCredits;

    public LeagueSettings(
            @Value("${league.schedule.day-start-times:16:00,16:30,17:00,17:30,18:00,18:30,19:00}") String dayStartTimes,
            @Value("${league.schedule.slots-per-day:4}") int slotsPerDay,
            @Value("${league.schedule.slot-spacing-minutes:75}") int slotSpacingMinutes,
            @Value("${league.playoffs.first-round-kickoff:18:00}") String playoffFirstRoundKickoff,
            @Value("${league.fixtures.seed:17}") long fixtureSeed,
            @Value("${league.synthetic.owner-id:AI_USER_PROFILE}") String syntheticOwnerId,
            @Value("${league.synthetic.starting-credits:50000}") long syntheticStartingCredits,
            @Value("${league.synthetic.starting-gems:0}") int syntheticStartingGems,
            @Value("${league.synthetic.stadium-capacity:5000}") int syntheticStadiumCapacity,
            @Value("${league.synthetic.fan-loyalty:50}") int syntheticFanLoyalty,
            @Value("${league.prizes.champion-credits:25000}") long championPrizeCredits,
            @Value("${league.prizes.runner-up-credits:10000}") long runnerUpPrizeCredits,
            @Value("${league.prizes.playoff-champion-credits:15000}") long playoffChampionPrizeCredits) {
        this.dayStartTimes = parseTimes(dayStartTimes);
        if (slotsPerDay < 1) throw new IllegalArgumentException("league.schedule.slots-per-day must be >= 1");
        this.slotsPerDay = slotsPerDay;
        this.slotSpacingMinutes = slotSpacingMinutes;
        this.playoffFirstRoundKickoff = LocalTime.parse(playoffFirstRoundKickoff.trim());
        this.fixtureSeed = fixtureSeed;
        this.syntheticOwnerId = syntheticOwnerId;
        this.syntheticStartingCredits = syntheticStartingCredits;
        this.syntheticStartingGems = syntheticStartingGems;
        this.syntheticStadiumCapacity = syntheticStadiumCapacity;
        this.syntheticFanLoyalty = syntheticFanLoyalty;
        this.championPrizeCredits = championPrizeCredits;
        this.runnerUpPrizeCredits = runnerUpPrizeCredits;
        this.playoffChampionPrizeCredits = playoffChampionPrizeCredits;
    }

    public boolean isTopTier(int division) {
        return division <= TOP_TIER_LAST_DIVISION;
    }

    /** Teams per subdivision: 16 for Divisions 1-2, 8 below. */
    public int subdivisionSize(int division) {
        return isTopTier(division) ? TOP_TIER_SUBDIVISION_SIZE : STANDARD_SUBDIVISION_SIZE;
    }

    public int playoffQualifiers(int division) {
        return isTopTier(division) ? 8 : 4;
    }

    private static List<LocalTime> parseTimes(String csv) {
        List<LocalTime> out = new ArrayList<>();
        if (csv != null) {
            for (String part : csv.split(",")) {
                String p = part.trim();
                if (!p.isEmpty()) out.add(LocalTime.parse(p));
            }
        }
        if (out.isEmpty()) throw new IllegalArgumentException("league.schedule.day-start-times must list at least one time");
        return Collections.unmodifiableList(out);
    }

    public List<LocalTime> getDayStartTimes() { return dayStartTimes; }
    public int getSlotsPerDay() { return slotsPerDay; }
    public int getSlotSpacingMinutes() { return slotSpacingMinutes; }
    public LocalTime getPlayoffFirstRoundKickoff() { return playoffFirstRoundKickoff; }
    public long getFixtureSeed() { return fixtureSeed; }
    public String getSyntheticOwnerId() { return syntheticOwnerId; }
    public long getSyntheticStartingCredits() { return syntheticStartingCredits; }
    public int getSyntheticStartingGems() { return syntheticStartingGems; }
    public int getSyntheticStadiumCapacity() { return syntheticStadiumCapacity; }
    public int getSyntheticFanLoyalty() { return syntheticFanLoyalty; }
    public long getChampionPrizeCredits() { return championPrizeCredits; }
    public long getRunnerUpPrizeCredits() { return runnerUpPrizeCredits; }
    public long getPlayoffChampionPrizeCredits() { return playoffChampionPrizeCredits; }
}
