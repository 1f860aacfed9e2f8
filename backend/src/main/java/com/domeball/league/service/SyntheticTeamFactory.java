package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.model.Stadium;
import com.domeball.league.model.Team;
import com.domeball.league.model.TeamFinances;
import com.domeball.league.model.TeamOrigin;
import com.domeball.league.repository.StadiumRepository;
import com.domeball.league.repository.TeamFinancesRepository;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/** Creates computer-run teams that pad subdivisions to size. They are purged at the next rollover. */
@Component
public class SyntheticTeamFactory {

    private static final Logger log = LoggerFactory.getLogger(SyntheticTeamFactory.class);

    private static final List<String> NAMES = List.of(
            "Iron Wolves", "Fire Hawks", "Storm Eagles", "Thunder Lions", "Ice Dragons",
            "Crimson Tigers", "Golden Phoenixes", "Silver Falcons", "Dark Panthers", "Steel Rhinos",
            "Flame Vipers", "Lightning Cobras", "Frost Bears", "Ember Foxes", "Stone Badgers",
            "Wind Raptors", "Ocean Sharks", "Desert Scorpions", "Mountain Lions", "Valley Wolves",
            "Sky Eagles", "River Dragons", "Forest Panthers", "City Hawks", "Battle Tigers");

    private final TeamRepository teamRepository;
    private final TeamFinancesRepository financesRepository;
    private final StadiumRepository stadiumRepository;
    private final LeagueSettings settings;

    public SyntheticTeamFactory(TeamRepository teamRepository, TeamFinancesRepository financesRepository,
                                StadiumRepository stadiumRepository, LeagueSettings settings) {
        this.teamRepository = teamRepository;
        this.financesRepository = financesRepository;
        this.stadiumRepository = stadiumRepository;
        this.settings = settings;
    }

    @Transactional
    public List<Team> create(int division, String subdivision, int count) {
        List<Team> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created.add(createOne(division, subdivision));
        }
        if (count > 0) {
            log.info("[SYNTHETIC] Created {} synthetic team(s) in Division {}-{}", count, division, subdivision);
        }
        return created;
    }

    private Team createOne(int division, String subdivision) {
        Team team = new Team(uniqueName(), division, subdivision);
        team.setOrigin(TeamOrigin.SYNTHETIC);
        team.setOwnerId(settings.getSyntheticOwnerId());
        team = teamRepository.save(team);
        financesRepository.save(new TeamFinances(team, settings.getSyntheticStartingCredits(), settings.getSyntheticStartingGems()));
        stadiumRepository.save(new Stadium(team, settings.getSyntheticStadiumCapacity(), settings.getSyntheticFanLoyalty()));
        return team;
    }

    String uniqueName() {
        int offset = (int) (teamRepository.count() % NAMES.size());
        for (int round = 1; ; round++) {
            for (int i = 0; i < NAMES.size(); i++) {
                String base = NAMES.get((offset + i) % NAMES.size());
                String candidate = round == 1 ? base : base + " " + round;
                if (!teamRepository.existsByName(candidate)) return candidate;
            }
        }
    }
}
