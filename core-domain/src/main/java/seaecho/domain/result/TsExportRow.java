package seaecho.domain.result;

/**
 * Fila tabular plana (una por par punto-modelo) lista para que un escritor
 * externo la serialice a CSV.
 *
 * @param frequencyKhz      Frecuencia [kHz].
 * @param tsDb              Target strength [dB].
 * @param model             Nombre del modelo.
 * @param scattererDiameter Diámetro del dispersor [m].
 * @param temperature       Temperatura [°C].
 * @param salinity          Salinidad [psu].
 * @param depth             Profundidad [m].
 * @param ph                pH.
 * @param soundSpeed        Velocidad del sonido en el agua [m/s].
 */
public record TsExportRow(
        double frequencyKhz,
        double tsDb,
        String model,
        double scattererDiameter,
        double temperature,
        double salinity,
        double depth,
        double ph,
        double soundSpeed
) {
}
