package com.domeball.league.dto;

import java.util.ArrayList;
import java.util.List;

public class BalanceSummary {
    private int teamsPlaced;
    private int subdivisionsCreated;
    private int syntheticTeamsCreated;
    private List<String> errors = new ArrayList<>();

    public void merge(BalanceSummary other) {
        if (other == null) return;
        teamsPlaced += other.teamsPlaced;
        subdivisionsCreated += other.subdivisionsCreated;
        syntheticTeamsCreated += other.syntheticTeamsCreated;
        errors.addAll(other.errors);
    }

    public void incrementTeamsPlaced() { teamsPlaced++; }
    public void incrementSubdivisionsCreated() { subdivisionsCreated++; }
    public void addSyntheticTeams(int count) { syntheticTeamsCreated += count; }

    public int getTeamsPlaced() { return teamsPlaced; }
    public int getSubdivisionsCreated() { return subdivisionsCreated; }
    public int getSyntheticTeamsCreated() { return syntheticTeamsCreated; }
    public List<String> getErrors() { return errors; }

    public void setTeamsPlaced(int teamsPlaced) { this.teamsPlaced = teamsPlaced; }
    public void setSubdivisionsCreated(int subdivisionsCreated) { this.subdivisionsCreated = subdivisionsCreated; }
    public void setSyntheticTeamsCreated(int syntheticTeamsCreated) { this.syntheticTeamsCreated = syntheticTeamsCreated; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
