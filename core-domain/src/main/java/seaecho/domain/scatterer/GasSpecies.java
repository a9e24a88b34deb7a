package seaecho.domain.scatterer;

/**
 * Catálogo de gases seleccionables desde la configuración.
 */
public enum GasSpecies {
    AIR(GasProperties.AIR),
    METHANE(GasProperties.METHANE);

    private final GasProperties properties;

    GasSpecies(GasProperties properties) {
        this.properties = properties;
    }

    public GasProperties properties() {
        return properties;
    }
}
