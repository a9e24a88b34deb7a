package seaecho.physics.scattering;

import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.scatterer.ScattererType;
import seaecho.domain.water.SeawaterState;

/**
 * Contrato común de todos los modelos de dispersión.
 * <p>
 * Una implementación es una función pura de sus argumentos: no guarda estado mutable
 * y puede invocarse concurrentemente desde cualquier hilo del barrido.
 */
public interface ScatteringModel {

    /**
     * Nombre con el que el modelo se registra y se solicita.
     */
    String getName();

    /**
     * Tipo de dispersor al que se aplica el modelo.
     */
    ScattererType getScattererType();

    /**
     * Calcula el Target Strength.
     *
     * @param frequencyKhz Frecuencia [kHz].
     * @param soundSpeed   Velocidad del sonido en el agua [m/s].
     * @param water        Estado del agua.
     * @param scatterer    Dispersor. Debe ser del tipo de {@link #getScattererType()}.
     * @return TS [dB re 1 m²].
     * @throws ScatteringComputationException si el resultado no es finito.
     * @throws IllegalArgumentException       si el dispersor no es del tipo soportado.
     */
    double calculateTs(double frequencyKhz, double soundSpeed, SeawaterState water, Scatterer scatterer);

    default boolean supports(Scatterer scatterer) {
        return scatterer != null && scatterer.type() == getScattererType();
    }
}
