package com.domeball.league.service;

import com.domeball.league.config.LeagueSettings;
import com.domeball.league.dto.BalanceSummary;
import com.domeball.league.model.Team;
import com.domeball.league.repository.TeamRepository;
import com.domeball.league.util.SubdivisionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places teams left without a subdivision by the cascade. Arrivals fill open places of the
 * existing subdivisions in name order, then new full-size subdivisions; any subdivision still
 * short afterwards is padded with synthetic teams. Each subdivision's padding commits in its own
 * transaction, so a failed one leaves the placements and the other subdivisions intact.
 */
@Service
public class SubdivisionBalancer {

    private static final Logger log = LoggerFactory.getLogger(SubdivisionBalancer.class);

    private final TeamRepository teamRepository;
    private final SyntheticTeamFactory syntheticTeamFactory;
    private final LeagueSettings settings;
    private final TransactionTemplate paddingTx;

    public SubdivisionBalancer(TeamRepository teamRepository, SyntheticTeamFactory syntheticTeamFactory,
                               LeagueSettings settings, PlatformTransactionManager transactionManager) {
        this.teamRepository = teamRepository;
        this.syntheticTeamFactory = syntheticTeamFactory;
        this.settings = settings;
        this.paddingTx = new TransactionTemplate(transactionManager);
        this.paddingTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional
    public BalanceSummary balanceAll() {
        BalanceSummary summary = new BalanceSummary();
        for (int division = LeagueSettings.TOP_DIVISION; division <= LeagueSettings.BOTTOM_DIVISION; division++) {
            summary.merge(balanceDivision(division));
        }
        log.info("[BALANCE] Placed {} team(s), {} new subdivision(s), {} synthetic team(s)",
                summary.getTeamsPlaced(), summary.getSubdivisionsCreated(), summary.getSyntheticTeamsCreated());
        return summary;
    }

    @Transactional
    public BalanceSummary balanceDivision(int division) {
        BalanceSummary summary = new BalanceSummary();
        int capacity = settings.subdivisionSize(division);
        List<Team> arrivals = teamRepository.findUnplacedByDivision(division);

        Map<String, Integer> occupancy = new LinkedHashMap<>();
        for (String name : teamRepository.findSubdivisionNames(division)) {
            occupancy.put(name, teamRepository.findByDivisionAndSubdivisionOrderByIdAsc(division, name).size());
        }

        Iterator<Team> queue = arrivals.iterator();
        for (Map.Entry<String, Integer> e : new ArrayList<>(occupancy.entrySet())) {
            int filled = e.getValue();
            while (filled < capacity && queue.hasNext()) {
                place(queue.next(), e.getKey(), summary);
                filled++;
            }
            occupancy.put(e.getKey(), filled);
        }
        while (queue.hasNext()) {
            String name = SubdivisionNames.nextUnused(occupancy.keySet());
            summary.incrementSubdivisionsCreated();
            int filled = 0;
            while (filled < capacity && queue.hasNext()) {
                place(queue.next(), name, summary);
                filled++;
            }
            occupancy.put(name, filled);
            log.info("[BALANCE] Division {}: opened subdivision '{}' with {} team(s)", division, name, filled);
        }

        for (Map.Entry<String, Integer> e : occupancy.entrySet()) {
            int missing = capacity - e.getValue();
            if (missing <= 0) continue;
            try {
                String subdivision = e.getKey();
                paddingTx.executeWithoutResult(status -> syntheticTeamFactory.create(division, subdivision, missing));
                summary.addSyntheticTeams(missing);
            } catch (RuntimeException ex) {
                log.error("[BALANCE] Division {}-{}: could not create {} synthetic team(s): {}",
                        division, e.getKey(), missing, ex.getMessage(), ex);
                summary.getErrors().add("Division " + division + "-" + e.getKey() + ": " + ex.getMessage());
            }
        }
        return summary;
    }

    private void place(Team team, String subdivision, BalanceSummary summary) {
        team.setSubdivision(subdivision);
        teamRepository.save(team);
        summary.incrementTeamsPlaced();
    }
}
