package seaecho.physics.model;

import seaecho.domain.water.SeawaterState;

/**
 * Contrato para los modelos que derivan el estado físico del agua
 * a partir de temperatura, profundidad y salinidad.
 */
public interface EnvironmentModel {

    /**
     * Deriva el estado completo del agua.
     *
     * @param temperature Temperatura [°C].
     * @param depth       Profundidad [m].
     * @param salinity    Salinidad [psu].
     * @param ph          pH del agua.
     * @return Instantánea inmutable con todas las propiedades derivadas.
     * @throws IllegalArgumentException si alguna entrada está fuera del rango de validez.
     */
    SeawaterState derive(double temperature, double depth, double salinity, double ph);
}
