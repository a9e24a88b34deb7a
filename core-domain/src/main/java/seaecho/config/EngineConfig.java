package seaecho.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuración del motor de cálculo de TS.
 * <p>
 * Agrupa los parámetros que no afectan a la física del problema sino a cómo
 * se ejecuta: tamaño del pool de trabajadores y política de precisión numérica.
 */
@Value
@Builder
@With
public class EngineConfig {

    /**
     * Número de hilos del pool que evalúa los puntos del barrido.
     */
    @Builder.Default
    int cpuProcessorCount = Runtime.getRuntime().availableProcessors();

    /**
     * Precisión con la que se evalúan los términos hiperbólicos/trigonométricos
     * de la corrección de resonancia. Por defecto: EXTENDED.
     */
    @Builder.Default
    PrecisionPolicy precisionPolicy = PrecisionPolicy.EXTENDED;

    /**
     * Dígitos decimales de la aritmética extendida (solo aplica a EXTENDED).
     */
    @Builder.Default
    int extendedPrecisionDigits = 40;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /**
     * Políticas de precisión para la corrección térmica y de tensión superficial.
     */
    public enum PrecisionPolicy {
        /**
         * Aritmética decimal de precisión arbitraria. Si el resultado no es finito,
         * se reintenta en doble precisión.
         */
        EXTENDED,

        /**
         * Doble precisión IEEE 754. Para X grandes (burbujas grandes o frecuencias altas)
         * sinh/cosh desbordan y la corrección degenera en NaN.
         */
        DOUBLE
    }
}
