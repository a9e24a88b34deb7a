package seaecho.domain.scatterer;

/**
 * Constantes físicas de una especie gaseosa.
 * <p>
 * Cualquier gas nuevo se incorpora creando una instancia de este record;
 * la derivación del estado de la burbuja es la misma para todos.
 *
 * @param name                Nombre del gas.
 * @param molarMass           Masa molar [kg/mol].
 * @param heatCapacityRatio   Cociente de calores específicos γ.
 * @param specificHeat        Calor específico a presión constante [kJ/(kg·K)].
 * @param thermalConductivity Conductividad térmica [W/(m·K)].
 */
public record GasProperties(
        String name,
        double molarMass,
        double heatCapacityRatio,
        double specificHeat,
        double thermalConductivity
) {
    /**
     * Aire. Conductividad térmica de Stephan y Laesecke (1985), ec. 7.
     */
    public static final GasProperties AIR = new GasProperties("air", 28.96e-3, 1.4, 1.005, 4.358e-3);

    public static final GasProperties METHANE = new GasProperties("methane", 16.04e-3, 1.31, 2.22, 0.0332);
}
