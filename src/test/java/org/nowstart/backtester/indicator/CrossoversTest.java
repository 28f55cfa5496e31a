package org.nowstart.backtester.indicator;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CrossoversTest {

    @Test
    void crossedAbove_requiresStrictComparisonsOnBothBars() {
        assertThat(Crossovers.crossedAbove(1.0, 2.0, 3.0, 2.0)).isTrue();
        assertThat(Crossovers.crossedAbove(2.0, 2.0, 3.0, 2.0)).isFalse();
        assertThat(Crossovers.crossedAbove(1.0, 2.0, 2.0, 2.0)).isFalse();
    }

    @Test
    void crossedBelow_detectsDownwardCross() {
        assertThat(Crossovers.crossedBelow(3.0, 2.0, 1.0, 2.0)).isTrue();
        assertThat(Crossovers.crossedBelow(1.0, 2.0, 0.5, 2.0)).isFalse();
    }

    @Test
    void undefinedOperand_meansNoCross() {
        assertThat(Crossovers.crossedAbove(Double.NaN, 2.0, 3.0, 2.0)).isFalse();
        assertThat(Crossovers.crossedBelow(3.0, 2.0, 1.0, Double.NaN)).isFalse();
    }
}
