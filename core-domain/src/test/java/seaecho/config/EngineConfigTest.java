package seaecho.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EngineConfigTest {

    @Test
    @DisplayName("La configuración por defecto usa precisión extendida y al menos un hilo")
    void defaults_shouldUseExtendedPrecision() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getPrecisionPolicy()).isEqualTo(EngineConfig.PrecisionPolicy.EXTENDED);
        assertThat(config.getCpuProcessorCount()).isGreaterThanOrEqualTo(1);
        assertThat(config.getExtendedPrecisionDigits()).isPositive();
    }

    @Test
    @DisplayName("Los withers devuelven una copia modificada sin alterar el original")
    void with_shouldReturnModifiedCopy() {
        EngineConfig base = EngineConfig.defaults();

        EngineConfig single = base.withCpuProcessorCount(1).withPrecisionPolicy(EngineConfig.PrecisionPolicy.DOUBLE);

        assertThat(single.getCpuProcessorCount()).isEqualTo(1);
        assertThat(single.getPrecisionPolicy()).isEqualTo(EngineConfig.PrecisionPolicy.DOUBLE);
        assertThat(base.getPrecisionPolicy()).isEqualTo(EngineConfig.PrecisionPolicy.EXTENDED);
    }
}
