package com.iimsoft.binassign.solver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolveConfigTest {

    @Test
    void defaults() {
        SolveConfig config = new SolveConfig();

        assertThat(config.getTimeLimitSeconds()).isEqualTo(10.0);
        assertThat(config.isAllowUnassigned()).isFalse();
        assertThat(config.getStrategy()).isEqualTo(SolveStrategy.EXACT);
        assertThat(config.timeLimitMillis()).isEqualTo(10_000L);
    }

    @Test
    void copyIsIndependent() {
        SolveConfig original = new SolveConfig().withRandomSeed(7).withStrategy(SolveStrategy.HEURISTIC);
        SolveConfig copy = original.copy().withRandomSeed(8);

        assertThat(original.getRandomSeed()).isEqualTo(7);
        assertThat(copy.getRandomSeed()).isEqualTo(8);
        assertThat(copy.getStrategy()).isEqualTo(SolveStrategy.HEURISTIC);
    }

    @Test
    void rejectsNonPositiveTimeLimit() {
        assertThatThrownBy(() -> new SolveConfig().withTimeLimitSeconds(0).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeLimitSeconds");
    }

    @Test
    void rejectsMissingStrategy() {
        assertThatThrownBy(() -> new SolveConfig().withStrategy(null).validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveNodeLimit() {
        assertThatThrownBy(() -> new SolveConfig().withNodeLimit(0).validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
