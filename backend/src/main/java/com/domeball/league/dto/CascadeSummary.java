package com.domeball.league.dto;

import java.util.ArrayList;
import java.util.List;

public class CascadeSummary {
    private List<TeamMove> moves = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private List<String> errors = new ArrayList<>();

    public void merge(CascadeSummary other) {
        if (other == null) return;
        moves.addAll(other.moves);
        warnings.addAll(other.warnings);
        errors.addAll(other.errors);
    }

    public long getPromotedCount() {
        return moves.stream().filter(TeamMove::isPromotion).count();
    }

    public long getRelegatedCount() {
        return moves.size() - getPromotedCount();
    }

    public List<TeamMove> getMoves() { return moves; }
    public List<String> getWarnings() { return warnings; }
    public List<String> getErrors() { return errors; }

    public void setMoves(List<TeamMove> moves) { this.moves = moves; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
