package com.pharmaintel.engine.model;

import com.pharmaintel.exception.ComputationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForecastErrorsTest {

    @Test
    void score_usesPercentageErrorWhenActualsAreNonZero() {
        ForecastErrors.ErrorScore score = ForecastErrors.score(new double[] {10, 20}, new double[] {11, 18});

        assertThat(score.metric()).isEqualTo(ForecastErrors.MAPE);
        assertThat(score.value()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void score_fallsBackToAbsoluteErrorWhenAnyActualIsZero() {
        ForecastErrors.ErrorScore score = ForecastErrors.score(new double[] {0, 20}, new double[] {2, 18});

        assertThat(score.metric()).isEqualTo(ForecastErrors.MAE);
        assertThat(score.value()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void score_rejectsNonFinitePredictions() {
        assertThatThrownBy(() -> ForecastErrors.score(new double[] {1}, new double[] {Double.NaN}))
            .isInstanceOf(ComputationException.class);
    }
}
