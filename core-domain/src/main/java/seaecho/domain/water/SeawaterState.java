package seaecho.domain.water;

import lombok.Builder;

/**
 * Instantánea inmutable del estado físico del agua de mar derivada de (T, z, S).
 * <p>
 * Todos los campos derivados son funciones puras de las tres entradas (y del pH,
 * que se toma como dato). Ningún campo se modifica tras la construcción, por lo que
 * una misma instancia puede compartirse entre hilos sin sincronización.
 *
 * @param temperature        Temperatura [°C].
 * @param depth              Profundidad [m].
 * @param salinity           Salinidad [psu].
 * @param density            Densidad [kg/m³].
 * @param soundSpeed         Velocidad del sonido [m/s].
 * @param dynamicViscosity   Viscosidad dinámica μ [Pa·s].
 * @param kinematicViscosity Viscosidad cinemática ν [m²/s].
 * @param pressure           Presión absoluta a la profundidad z [Pa].
 * @param vaporPressure      Presión de vapor [Pa].
 * @param surfaceTension     Tensión superficial agua/aire [N/m].
 * @param specificHeat       Calor específico a presión constante [J/(kg·K)].
 * @param ph                 pH.
 */
@Builder
public record SeawaterState(
        double temperature,
        double depth,
        double salinity,
        double density,
        double soundSpeed,
        double dynamicViscosity,
        double kinematicViscosity,
        double pressure,
        double vaporPressure,
        double surfaceTension,
        double specificHeat,
        double ph
) {
    /**
     * Temperatura absoluta [K].
     */
    public double absoluteTemperature() {
        return temperature + 273.15;
    }
}
