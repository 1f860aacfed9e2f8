package com.domeball.league.dto;

import com.domeball.league.model.RolloverStage;

import java.util.ArrayList;
import java.util.List;

public class RolloverSummary {
    private int closedSeasonNumber;
    private Long newSeasonId;
    private List<RolloverStage> stagesRun = new ArrayList<>();
    private List<RolloverStage> stagesSkipped = new ArrayList<>();
    private PurgeSummary purge;
    private CascadeSummary cascade = new CascadeSummary();
    private BalanceSummary balance;
    private int countersReset;
    private FixtureGenerationSummary fixtures;
    private List<String> errors = new ArrayList<>();

    public RolloverSummary() {}

    public RolloverSummary(int closedSeasonNumber) {
        this.closedSeasonNumber = closedSeasonNumber;
    }

    public int getClosedSeasonNumber() { return closedSeasonNumber; }
    public Long getNewSeasonId() { return newSeasonId; }
    public List<RolloverStage> getStagesRun() { return stagesRun; }
    public List<RolloverStage> getStagesSkipped() { return stagesSkipped; }
    public PurgeSummary getPurge() { return purge; }
    public CascadeSummary getCascade() { return cascade; }
    public BalanceSummary getBalance() { return balance; }
    public int getCountersReset() { return countersReset; }
    public FixtureGenerationSummary getFixtures() { return fixtures; }
    public List<String> getErrors() { return errors; }

    public void setClosedSeasonNumber(int closedSeasonNumber) { this.closedSeasonNumber = closedSeasonNumber; }
    public void setNewSeasonId(Long newSeasonId) { this.newSeasonId = newSeasonId; }
    public void setStagesRun(List<RolloverStage> stagesRun) { this.stagesRun = stagesRun; }
    public void setStagesSkipped(List<RolloverStage> stagesSkipped) { this.stagesSkipped = stagesSkipped; }
    public void setPurge(PurgeSummary purge) { this.purge = purge; }
    public void setCascade(CascadeSummary cascade) { this.cascade = cascade; }
    public void setBalance(BalanceSummary balance) { this.balance = balance; }
    public void setCountersReset(int countersReset) { this.countersReset = countersReset; }
    public void setFixtures(FixtureGenerationSummary fixtures) { this.fixtures = fixtures; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
