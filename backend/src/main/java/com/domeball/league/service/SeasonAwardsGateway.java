package com.domeball.league.service;

import com.domeball.league.dto.AwardsResult;

/** End-of-season awards and prize money, run once the playoffs are over. */
public interface SeasonAwardsGateway {

    AwardsResult computeAwards(Long seasonId);

    AwardsResult distributePrizes(Long seasonId);
}
