package com.domeball.league.dto;

import com.domeball.league.model.RolloverStage;

/** One team moved by the cascade. */
public record TeamMove(Long teamId, String teamName, int fromDivision, int toDivision, RolloverStage stage) {

    public boolean isPromotion() {
        return toDivision < fromDivision;
    }
}
