package seaecho.physics.model;

import seaecho.domain.water.SeawaterState;

/**
 * Contrato para los modelos de absorción acústica en el agua.
 */
public interface AbsorptionModel {

    /**
     * @param frequencyKhz Frecuencia [kHz].
     * @param water        Estado del agua.
     * @return Coeficiente de absorción [dB/km].
     */
    double absorption(double frequencyKhz, SeawaterState water);
}
