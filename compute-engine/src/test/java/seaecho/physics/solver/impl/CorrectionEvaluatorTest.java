package seaecho.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import seaecho.config.EngineConfig;
import seaecho.factory.CorrectionEvaluatorFactory;
import seaecho.physics.solver.CorrectionEvaluator;
import seaecho.physics.solver.CorrectionEvaluator.ThermalCorrection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
class CorrectionEvaluatorTest {

    private static final double GAMMA = 1.4;

    private final DoublePrecisionCorrectionEvaluator doubleEvaluator = new DoublePrecisionCorrectionEvaluator();
    private final ExtendedPrecisionCorrectionEvaluator extendedEvaluator = new ExtendedPrecisionCorrectionEvaluator(40);

    @Test
    @DisplayName("En el rango de la doble precisión ambas aritméticas coinciden")
    void moderateX_shouldAgreeBetweenPrecisions() {
        // ACT
        ThermalCorrection fromDouble = doubleEvaluator.evaluate(5.0, GAMMA);
        ThermalCorrection fromExtended = extendedEvaluator.evaluate(5.0, GAMMA);

        // ASSERT
        assertThat(fromDouble.isFinite()).isTrue();
        assertThat(fromExtended.polytropicFactor()).isCloseTo(fromDouble.polytropicFactor(), within(1e-12));
        assertThat(fromExtended.dampingRatio()).isCloseTo(fromDouble.dampingRatio(), within(1e-12));
    }

    @Test
    @DisplayName("Con X grande la doble precisión degenera en NaN y la extendida sigue siendo finita")
    void largeX_shouldOverflowOnlyInDoublePrecision() {
        // ARRANGE
        double x = 1000.0;
        // Para X >> 1: sinh ≈ cosh ≈ e^X / 2 y sin, cos son despreciables
        double expectedRatio = 3.0 * (GAMMA - 1.0) * (x - 2.0) / (x * x + 3.0 * (GAMMA - 1.0) * x);
        double expectedFactor = 1.0 / ((1.0 + expectedRatio * expectedRatio) * (1.0 + 3.0 * (GAMMA - 1.0) / x));

        // ACT
        ThermalCorrection fromDouble = doubleEvaluator.evaluate(x, GAMMA);
        ThermalCorrection fromExtended = extendedEvaluator.evaluate(x, GAMMA);

        // ASSERT
        log.info("X=1000 -> doble: {}, extendida: {}", fromDouble, fromExtended);
        assertThat(fromDouble.isFinite()).isFalse();
        assertThat(fromExtended.isFinite()).isTrue();
        assertThat(fromExtended.dampingRatio()).isCloseTo(expectedRatio, within(1e-12));
        assertThat(fromExtended.polytropicFactor()).isCloseTo(expectedFactor, within(1e-12));
    }

    @Test
    @DisplayName("X = 0 es singular en cualquier precisión")
    void zeroX_shouldBeUndefined() {
        assertThat(doubleEvaluator.evaluate(0.0, GAMMA).isFinite()).isFalse();
        assertThat(extendedEvaluator.evaluate(0.0, GAMMA).isFinite()).isFalse();
    }

    @Test
    @DisplayName("La cadena usa el evaluador secundario cuando el primario devuelve NaN")
    void fallback_shouldUseSecondaryOnNaN() {
        // ARRANGE
        CorrectionEvaluator primary = mock(CorrectionEvaluator.class);
        CorrectionEvaluator secondary = mock(CorrectionEvaluator.class);
        ThermalCorrection rescue = new ThermalCorrection(0.9, 0.1);
        when(primary.evaluate(7.0, GAMMA)).thenReturn(ThermalCorrection.UNDEFINED);
        when(secondary.evaluate(7.0, GAMMA)).thenReturn(rescue);

        // ACT
        ThermalCorrection result = new FallbackCorrectionEvaluator(primary, secondary).evaluate(7.0, GAMMA);

        // ASSERT
        assertThat(result).isEqualTo(rescue);
        verify(secondary).evaluate(7.0, GAMMA);
    }

    @Test
    @DisplayName("La cadena usa el evaluador secundario cuando el primario lanza un error aritmético")
    void fallback_shouldUseSecondaryOnArithmeticFailure() {
        CorrectionEvaluator primary = mock(CorrectionEvaluator.class);
        CorrectionEvaluator secondary = mock(CorrectionEvaluator.class);
        ThermalCorrection rescue = new ThermalCorrection(0.95, 0.05);
        when(primary.evaluate(3.0, GAMMA)).thenThrow(new ArithmeticException("desbordamiento"));
        when(secondary.evaluate(3.0, GAMMA)).thenReturn(rescue);

        ThermalCorrection result = new FallbackCorrectionEvaluator(primary, secondary).evaluate(3.0, GAMMA);

        assertThat(result).isEqualTo(rescue);
    }

    @Test
    @DisplayName("Si el primario es finito el secundario no se consulta")
    void fallback_shouldNotCallSecondaryWhenPrimarySucceeds() {
        CorrectionEvaluator secondary = mock(CorrectionEvaluator.class);

        ThermalCorrection result = new FallbackCorrectionEvaluator(extendedEvaluator, secondary).evaluate(2.0, GAMMA);

        assertThat(result.isFinite()).isTrue();
        verify(secondary, never()).evaluate(2.0, GAMMA);
    }

    @Test
    @DisplayName("La fábrica traduce la política de precisión de la configuración")
    void factory_shouldFollowPrecisionPolicy() {
        CorrectionEvaluator extended = CorrectionEvaluatorFactory.create(EngineConfig.defaults());
        CorrectionEvaluator plain = CorrectionEvaluatorFactory.create(
                EngineConfig.defaults().withPrecisionPolicy(EngineConfig.PrecisionPolicy.DOUBLE));

        assertThat(extended).isInstanceOf(FallbackCorrectionEvaluator.class);
        assertThat(plain).isInstanceOf(DoublePrecisionCorrectionEvaluator.class);
        assertThat(extended.evaluate(1000.0, GAMMA).isFinite()).isTrue();
    }

    @Test
    @DisplayName("Una precisión extendida inferior a la doble se rechaza")
    void extended_tooFewDigits_shouldThrow() {
        assertThatThrownBy(() -> new ExtendedPrecisionCorrectionEvaluator(8))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
