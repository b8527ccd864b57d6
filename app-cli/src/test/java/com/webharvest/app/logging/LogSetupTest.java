package com.webharvest.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void level_names_fall_back_to_info() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" warning ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void int_properties_fall_back_to_default() {
        assertThat(LogSetup.parseInt("8", 2)).isEqualTo(8);
        assertThat(LogSetup.parseInt(" ", 2)).isEqualTo(2);
        assertThat(LogSetup.parseInt("big", 5)).isEqualTo(5);
    }
}
