package org.genemeta.datapipeline.statistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class FisherZTransformTest {

    @Test
    void backTransformRecoversCorrelation() {
        for (double r : new double[]{-0.95, -0.5, 0.0, 0.1, 0.63, 0.999}) {
            assertThat(FisherZTransform.toR(FisherZTransform.toZ(r))).isCloseTo(r, within(1e-12));
        }
    }

    @Test
    void rejectsCorrelationsOutsideOpenInterval() {
        assertThatThrownBy(() -> FisherZTransform.toZ(1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FisherZTransform.toZ(-1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FisherZTransform.toZ(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void standardErrorUsesNMinusThree() {
        assertThat(FisherZTransform.standardError(28)).isCloseTo(0.2, within(1e-12));
        assertThat(FisherZTransform.standardError(4)).isCloseTo(1.0, within(1e-12));
        assertThatThrownBy(() -> FisherZTransform.standardError(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void backTransformKeepsStandardErrorAndSignificanceOnZScale() {
        PooledEstimate onZ = new PooledEstimate(0.5, 0.6, 0.1, 0.02, 4.0, 50.0, 6.0, 1e-9, 0.4, 0.8, 3);

        PooledEstimate onR = FisherZTransform.backTransform(onZ);

        assertThat(onR.thetaFixed()).isCloseTo(Math.tanh(0.5), within(1e-12));
        assertThat(onR.thetaRandom()).isCloseTo(Math.tanh(0.6), within(1e-12));
        assertThat(onR.ciLower()).isCloseTo(Math.tanh(0.4), within(1e-12));
        assertThat(onR.ciUpper()).isCloseTo(Math.tanh(0.8), within(1e-12));
        assertThat(onR.standardError()).isEqualTo(0.1);
        assertThat(onR.z()).isEqualTo(6.0);
        assertThat(onR.p()).isEqualTo(1e-9);
        assertThat(onR.i2()).isEqualTo(50.0);
    }
}
