package com.domeball.league.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseSafetyConfigTest {

    @Test
    void createDropOutsideTestProfileAbortsStartup() {
        DatabaseSafetyConfig config = new DatabaseSafetyConfig("prod", "create-drop", "jdbc:mysql://db/league");
        assertThatThrownBy(config::verifyHibernateDdlAutoSafety)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("create-drop");
    }

    @Test
    void underscoreSpellingIsCaughtToo() {
        DatabaseSafetyConfig config = new DatabaseSafetyConfig("default", "CREATE_DROP", "");
        assertThatThrownBy(config::verifyHibernateDdlAutoSafety).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testProfileAndValidateAreAllowed() {
        assertThatCode(new DatabaseSafetyConfig("test", "create-drop", "jdbc:h2:mem:x")::verifyHibernateDdlAutoSafety)
                .doesNotThrowAnyException();
        assertThatCode(new DatabaseSafetyConfig("prod", "validate", "jdbc:mysql://db/league")::verifyHibernateDdlAutoSafety)
                .doesNotThrowAnyException();
    }
}
