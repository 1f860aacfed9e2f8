package com.domeball.league.service;

import com.domeball.league.model.Team;
import com.domeball.league.repository.TeamFinancesRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class TeamFinancesCleaner implements TeamDependentRecordCleaner {

    private final TeamFinancesRepository financesRepository;

    public TeamFinancesCleaner(TeamFinancesRepository financesRepository) {
        this.financesRepository = financesRepository;
    }

    @Override
    public int clean(Team team) {
        return financesRepository.deleteByTeamId(team.getId());
    }
}
