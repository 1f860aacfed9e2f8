package com.domeball.league.dto;

import java.util.ArrayList;
import java.util.List;

public class PurgeSummary {
    private int teamsPurged;
    private int dependentRecordsAffected;
    private List<String> errors = new ArrayList<>();

    public void recordPurged(int dependentRecords) {
        teamsPurged++;
        dependentRecordsAffected += dependentRecords;
    }

    public int getTeamsPurged() { return teamsPurged; }
    public int getDependentRecordsAffected() { return dependentRecordsAffected; }
    public List<String> getErrors() { return errors; }

    public void setTeamsPurged(int teamsPurged) { this.teamsPurged = teamsPurged; }
    public void setDependentRecordsAffected(int dependentRecordsAffected) { this.dependentRecordsAffected = dependentRecordsAffected; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
