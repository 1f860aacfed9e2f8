package com.domeball.league.service;

import com.domeball.league.model.Team;
import com.domeball.league.repository.StadiumRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
public class StadiumCleaner implements TeamDependentRecordCleaner {

    private final StadiumRepository stadiumRepository;

    public StadiumCleaner(StadiumRepository stadiumRepository) {
        this.stadiumRepository = stadiumRepository;
    }

    @Override
    public int clean(Team team) {
        return stadiumRepository.deleteByTeamId(team.getId());
    }
}
