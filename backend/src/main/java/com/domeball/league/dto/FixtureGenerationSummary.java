package com.domeball.league.dto;

import java.util.ArrayList;
import java.util.List;

public class FixtureGenerationSummary {
    private Long seasonId;
    private boolean skipped;
    private int groupsScheduled;
    private int matchesCreated;
    private List<String> warnings = new ArrayList<>();
    private List<String> errors = new ArrayList<>();

    public FixtureGenerationSummary() {}

    public FixtureGenerationSummary(Long seasonId) {
        this.seasonId = seasonId;
    }

    public static FixtureGenerationSummary alreadyGenerated(Long seasonId, long existing) {
        FixtureGenerationSummary s = new FixtureGenerationSummary(seasonId);
        s.skipped = true;
        s.warnings.add("League fixtures already exist for season " + seasonId + " (" + existing + " matches), generation skipped");
        return s;
    }

    public void addGroup(int matches) {
        groupsScheduled++;
        matchesCreated += matches;
    }

    public Long getSeasonId() { return seasonId; }
    public boolean isSkipped() { return skipped; }
    public int getGroupsScheduled() { return groupsScheduled; }
    public int getMatchesCreated() { return matchesCreated; }
    public List<String> getWarnings() { return warnings; }
    public List<String> getErrors() { return errors; }

    public void setSeasonId(Long seasonId) { this.seasonId = seasonId; }
    public void setSkipped(boolean skipped) { this.skipped = skipped; }
    public void setGroupsScheduled(int groupsScheduled) { this.groupsScheduled = groupsScheduled; }
    public void setMatchesCreated(int matchesCreated) { this.matchesCreated = matchesCreated; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
