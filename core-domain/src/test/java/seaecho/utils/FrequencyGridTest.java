package seaecho.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FrequencyGridTest {

    @Test
    @DisplayName("linSpace incluye ambos extremos con paso constante")
    void linSpace_shouldIncludeEndpoints() {
        double[] values = FrequencyGrid.linSpace(1.0, 5.0, 5);

        assertThat(values).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
        assertThat(FrequencyGrid.linSpace(7.0, 9.0, 1)).containsExactly(7.0);
    }

    @Test
    @DisplayName("logSpace produce una progresión geométrica estrictamente creciente")
    void logSpace_shouldBeGeometric() {
        double[] values = FrequencyGrid.logSpace(1.0, 1000.0, 4);

        assertThat(values[0]).isEqualTo(1.0);
        assertThat(values[1]).isCloseTo(10.0, within(1e-9));
        assertThat(values[2]).isCloseTo(100.0, within(1e-9));
        assertThat(values[3]).isEqualTo(1000.0);
    }

    @Test
    @DisplayName("Número de puntos o extremos inválidos se rechazan")
    void invalidArguments_shouldThrow() {
        assertThatThrownBy(() -> FrequencyGrid.linSpace(1.0, 2.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FrequencyGrid.logSpace(0.0, 2.0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
