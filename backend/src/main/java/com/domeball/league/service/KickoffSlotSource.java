package com.domeball.league.service;

import java.time.LocalTime;
import java.util.List;

/** Ordered kickoff times available on a game day. */
public interface KickoffSlotSource {

    List<LocalTime> slotsForDay(int day);
}
