package com.domeball.league.service;

import com.domeball.league.model.Team;
import com.domeball.league.repository.SeasonAwardRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class SeasonAwardCleaner implements TeamDependentRecordCleaner {

    private final SeasonAwardRepository awardRepository;

    public SeasonAwardCleaner(SeasonAwardRepository awardRepository) {
        this.awardRepository = awardRepository;
    }

    @Override
    public int clean(Team team) {
        return awardRepository.deleteByTeamId(team.getId());
    }
}
