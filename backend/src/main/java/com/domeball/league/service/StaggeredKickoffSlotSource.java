package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * First kickoff moves through the configured start times, one per day (16:00 on day 1, 16:30 on
 * day 2, ... back to 16:00 on day 8); each day then has a fixed number of slots at a fixed spacing.
 */
@Component
public class StaggeredKickoffSlotSource implements KickoffSlotSource {

    private final LeagueSettings settings;

    public StaggeredKickoffSlotSource(LeagueSettings settings) {
        this.settings = settings;
    }

    @Override
    public List<LocalTime> slotsForDay(int day) {
        if (day < 1) throw new IllegalArgumentException("day must be >= 1");
        List<LocalTime> starts = settings.getDayStartTimes();
        LocalTime first = starts.get((day - 1) % starts.size());
        List<LocalTime> slots = new ArrayList<>(settings.getSlotsPerDay());
        for (int k = 0; k < settings.getSlotsPerDay(); k++) {
            slots.add(first.plusMinutes((long) k * settings.getSlotSpacingMinutes()));
        }
        return slots;
    }
}
