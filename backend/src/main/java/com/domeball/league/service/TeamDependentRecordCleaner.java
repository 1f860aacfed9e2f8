package com.domeball.league.service;

import com.domeball.league.model.Team;

/**
 * Removes or detaches records that reference a team about to be deleted. Every bean of this type
 * runs, in {@link org.springframework.core.annotation.Order} order, before the team row goes.
 */
public interface TeamDependentRecordCleaner {

    /** @return number of rows deleted or updated */
    int clean(Team team);
}
