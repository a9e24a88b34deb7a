package seaecho.domain.result;

/**
 * Variable barrida en un {@link ScatteringResultSet}.
 */
public enum SweepAxis {
    /**
     * Frecuencia variable [kHz], dispersor fijo.
     */
    FREQUENCY,
    /**
     * Diámetro variable [m], frecuencia fija.
     */
    DIAMETER
}
