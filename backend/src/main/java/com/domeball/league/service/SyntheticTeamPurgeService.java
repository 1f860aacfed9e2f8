package com.domeball.league.service;

import com.domeball.league.dto.PurgeSummary;
import com.domeball.league.model.Team;
import com.domeball.league.model.TeamOrigin;
import com.domeball.league.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Deletes every synthetic team with its dependent records. Each team is removed in its own
 * transaction; a failure leaves that team in place and the loop goes on.
 */
@Service
public class SyntheticTeamPurgeService {

    private static final Logger log = LoggerFactory.getLogger(SyntheticTeamPurgeService.class);

    private final TeamRepository teamRepository;
    private final List<TeamDependentRecordCleaner> cleaners;
    private final TransactionTemplate perTeamTx;

    public SyntheticTeamPurgeService(TeamRepository teamRepository, List<TeamDependentRecordCleaner> cleaners,
                                     PlatformTransactionManager transactionManager) {
        this.teamRepository = teamRepository;
        this.cleaners = cleaners;
        this.perTeamTx = new TransactionTemplate(transactionManager);
        this.perTeamTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public PurgeSummary purgeSyntheticTeams() {
        PurgeSummary summary = new PurgeSummary();
        List<Team> synthetic = teamRepository.findByOrigin(TeamOrigin.SYNTHETIC);
        log.info("[PURGE] {} synthetic team(s) to remove", synthetic.size());
        for (Team team : synthetic) {
            try {
                Integer affected = perTeamTx.execute(status -> purge(team.getId()));
                summary.recordPurged(affected == null ? 0 : affected);
            } catch (RuntimeException ex) {
                log.error("[PURGE] Failed to remove synthetic team {} ({}): {}", team.getId(), team.getName(), ex.getMessage(), ex);
                summary.getErrors().add("team " + team.getId() + ": " + ex.getMessage());
            }
        }
        log.info("[PURGE] Removed {} synthetic team(s), {} dependent row(s)", summary.getTeamsPurged(), summary.getDependentRecordsAffected());
        return summary;
    }

    private int purge(Long teamId) {
        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> new IllegalArgumentException("Team not found: " + teamId));
        int affected = 0;
        for (TeamDependentRecordCleaner cleaner : cleaners) {
            affected += cleaner.clean(team);
        }
        teamRepository.delete(team);
        return affected;
    }
}
