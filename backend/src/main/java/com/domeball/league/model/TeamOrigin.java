package com.domeball.league.model;

public enum TeamOrigin {
    USER,
    SYNTHETIC,
    // Keeps historical match references alive once synthetic teams are purged
    PLACEHOLDER
}
