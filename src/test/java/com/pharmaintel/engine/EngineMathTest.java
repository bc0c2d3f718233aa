package com.pharmaintel.engine;

import com.pharmaintel.exception.InvalidEngineInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EngineMathTest {

    @Test
    void inverseStandardNormal_matchesKnownQuantiles() {
        assertThat(EngineMath.inverseStandardNormal(0.5)).isCloseTo(0.0, within(1e-9));
        assertThat(EngineMath.inverseStandardNormal(0.95)).isCloseTo(1.6449, within(1e-4));
        assertThat(EngineMath.inverseStandardNormal(0.01)).isCloseTo(-2.3263, within(1e-4));
    }

    @Test
    void inverseStandardNormal_rejectsBounds() {
        assertThatThrownBy(() -> EngineMath.inverseStandardNormal(1.0)).isInstanceOf(InvalidEngineInputException.class);
    }

    @Test
    void sampleStd_isZeroBelowTwoValues() {
        assertThat(EngineMath.sampleStd(new double[] {4})).isZero();
        assertThat(EngineMath.sampleStd(new double[] {2, 4, 4, 4, 5, 5, 7, 9})).isCloseTo(2.138, within(1e-3));
    }
}
