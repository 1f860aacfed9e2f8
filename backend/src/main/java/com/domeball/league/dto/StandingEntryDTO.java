package com.domeball.league.dto;

public class StandingEntryDTO {
    private int position;
    private Long teamId;
    private String teamName;
    private int played;
    private int wins;
    private int draws;
    private int losses;
    private int scoreFor;
    private int scoreAgainst;
    private int differential;
    private int points;

    public StandingEntryDTO() {}

    public StandingEntryDTO(int position, Long teamId, String teamName, int played, int wins, int draws, int losses,
                            int scoreFor, int scoreAgainst, int points) {
        this.position = position;
        this.teamId = teamId;
        this.teamName = teamName;
        this.played = played;
        this.wins = wins;
        this.draws = draws;
        this.losses = losses;
        this.scoreFor = scoreFor;
        this.scoreAgainst = scoreAgainst;
        this.differential = scoreFor - scoreAgainst;
        this.points = points;
    }

    /** Share of played games won; 0 when nothing has been played. */
    public double getWinPercentage() {
        return played == 0 ? 0.0 : (double) wins / played;
    }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public int getPlayed() { return played; }
    public void setPlayed(int played) { this.played = played; }

    public int getWins() { return wins; }
    public void setWins(int wins) { this.wins = wins; }

    public int getDraws() { return draws; }
    public void setDraws(int draws) { this.draws = draws; }

    public int getLosses() { return losses; }
    public void setLosses(int losses) { this.losses = losses; }

    public int getScoreFor() { return scoreFor; }
    public void setScoreFor(int scoreFor) { this.scoreFor = scoreFor; }

    public int getScoreAgainst() { return scoreAgainst; }
    public void setScoreAgainst(int scoreAgainst) { this.scoreAgainst = scoreAgainst; }

    public int getDifferential() { return differential; }
    public void setDifferential(int differential) { this.differential = differential; }

    public int getPoints() { return points; }
    public void setPoints(int points) { this.points = points; }
}
