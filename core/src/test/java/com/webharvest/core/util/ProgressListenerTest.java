package com.webharvest.core.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressListenerTest {

    @Test
    void step_derives_fraction_and_tolerates_unknown_total() {
        List<Double> seen = new ArrayList<>();
        ProgressListener l = (p, phase, d, t) -> seen.add(p);

        l.step("extract", 1, 4);
        l.step("extract", 4, 4);
        l.step("discover", 0, -1);

        assertThat(seen).containsExactly(0.25, 1.0, 0.0);
    }
}
