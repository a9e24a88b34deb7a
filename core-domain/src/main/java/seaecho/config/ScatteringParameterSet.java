package seaecho.config;

import lombok.Builder;
import lombok.With;
import seaecho.domain.scatterer.GasSpecies;
import seaecho.domain.scatterer.ScattererType;
import seaecho.domain.scatterer.SolidMaterial;
import seaecho.utils.FrequencyGrid;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Unidad de trabajo que se entrega al coordinador de barridos.
 * <p>
 * El orden de {@code frequencies} define el orden de salida del resultado.
 *
 * @param frequencies   Frecuencias del barrido en kHz (orden significativo).
 * @param diameter      Diámetro del dispersor en metros (para esferas sólidas, radio = diámetro / 2).
 * @param models        Nombres de los modelos a evaluar. No vacío y resoluble en el registro.
 * @param temperature   Temperatura del agua [°C].
 * @param salinity      Salinidad [psu].
 * @param depth         Profundidad [m].
 * @param ph            pH del agua. Si es nulo se usa 8.0.
 * @param scattererType Tipo de dispersor. Si es nulo, burbuja de gas.
 * @param gasSpecies    Gas de la burbuja. Si es nulo, aire.
 * @param material      Material de la esfera sólida. Si es nulo, carburo de tungsteno.
 */
@Builder
@With
public record ScatteringParameterSet(
        double[] frequencies,
        double diameter,
        List<String> models,
        double temperature,
        double salinity,
        double depth,
        Double ph,
        ScattererType scattererType,
        GasSpecies gasSpecies,
        SolidMaterial material
) {
    public static final double DEFAULT_PH = 8.0;

    // Rangos oceanográficos admitidos por las correlaciones empíricas
    private static final double MIN_TEMPERATURE = -2.0;
    private static final double MAX_TEMPERATURE = 40.0;
    private static final double MAX_SALINITY = 45.0;
    private static final double MAX_DEPTH = 12000.0;

    public ScatteringParameterSet {
        frequencies = (frequencies == null) ? new double[0] : frequencies.clone();
        models = (models == null) ? List.of() : List.copyOf(models);
        ph = (ph == null) ? DEFAULT_PH : ph;
        scattererType = (scattererType == null) ? ScattererType.GAS_BUBBLE : scattererType;
        gasSpecies = (gasSpecies == null) ? GasSpecies.AIR : gasSpecies;
        material = (material == null) ? SolidMaterial.TUNGSTEN_CARBIDE : material;
    }

    @Override
    public double[] frequencies() {
        return frequencies.clone();
    }

    public int frequencyCount() {
        return frequencies.length;
    }

    public double frequencyAt(int index) {
        return frequencies[index];
    }

    /**
     * Radio del dispersor en metros.
     */
    public double radius() {
        return diameter / 2.0;
    }

    /**
     * Valida la estructura del conjunto de parámetros antes de evaluar ningún modelo.
     * La resolución de nombres de modelo es responsabilidad del registro.
     *
     * @throws IllegalArgumentException si alguna entrada es inválida.
     */
    public void validate() {
        if (frequencies.length == 0) {
            throw new IllegalArgumentException("La secuencia de frecuencias no puede estar vacía.");
        }
        for (int i = 0; i < frequencies.length; i++) {
            if (!(frequencies[i] > 0.0) || Double.isInfinite(frequencies[i])) {
                throw new IllegalArgumentException("Frecuencia inválida en la posición " + i + ": " + frequencies[i] + " kHz. Debe ser > 0.");
            }
        }
        validateDiameter(diameter);
        validateModels();
        validateEnvironment();
    }

    /**
     * La lista de modelos no puede estar vacía ni repetir nombres.
     */
    public void validateModels() {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("Debe solicitarse al menos un modelo.");
        }
        if (new HashSet<>(models).size() != models.size()) {
            throw new IllegalArgumentException("La lista de modelos contiene nombres repetidos: " + models);
        }
    }

    /**
     * Valida solo las entradas ambientales (T, S, z, pH).
     */
    public void validateEnvironment() {
        if (!(temperature >= MIN_TEMPERATURE && temperature <= MAX_TEMPERATURE)) {
            throw new IllegalArgumentException("Temperatura fuera de rango [" + MIN_TEMPERATURE + ", " + MAX_TEMPERATURE + "] °C: " + temperature);
        }
        if (!(salinity >= 0.0 && salinity <= MAX_SALINITY)) {
            throw new IllegalArgumentException("Salinidad fuera de rango [0, " + MAX_SALINITY + "] psu: " + salinity);
        }
        if (!(depth >= 0.0 && depth <= MAX_DEPTH)) {
            throw new IllegalArgumentException("Profundidad fuera de rango [0, " + MAX_DEPTH + "] m: " + depth);
        }
        if (!(ph > 0.0 && ph < 14.0)) {
            throw new IllegalArgumentException("pH fuera de rango (0, 14): " + ph);
        }
    }

    public static void validateDiameter(double diameter) {
        if (!(diameter > 0.0) || Double.isInfinite(diameter)) {
            throw new IllegalArgumentException("El diámetro debe ser positivo y finito: " + diameter + " m");
        }
    }

    /**
     * Barrido de referencia: burbuja de aire de 2 mm en agua dulce a 20 °C y 10 m,
     * 2000 frecuencias logarítmicas entre 1 y 1200 kHz, modelo Medwin-Clay.
     */
    public static ScatteringParameterSet getReferenceBubbleSweep() {
        return ScatteringParameterSet.builder()
                .frequencies(FrequencyGrid.logSpace(1.0, 1200.0, 2000))
                .diameter(2e-3)
                .models(List.of("Medwin_Clay"))
                .temperature(20.0)
                .salinity(0.0)
                .depth(10.0)
                .build();
    }

    // equals y hashCode con semántica de valor para el array de frecuencias.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScatteringParameterSet that = (ScatteringParameterSet) o;
        return Arrays.equals(frequencies, that.frequencies)
                && Double.compare(diameter, that.diameter) == 0
                && models.equals(that.models)
                && Double.compare(temperature, that.temperature) == 0
                && Double.compare(salinity, that.salinity) == 0
                && Double.compare(depth, that.depth) == 0
                && ph.equals(that.ph)
                && scattererType == that.scattererType
                && gasSpecies == that.gasSpecies
                && material == that.material;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(frequencies);
        result = 31 * result + Objects.hash(diameter, models, temperature, salinity, depth, ph, scattererType, gasSpecies, material);
        return result;
    }

    @Override
    public String toString() {
        return "ScatteringParameterSet[frequencies=" + frequencies.length + " pts"
                + ", diameter=" + diameter
                + ", models=" + models
                + ", T=" + temperature + ", S=" + salinity + ", z=" + depth + ", pH=" + ph
                + ", scatterer=" + scattererType + "]";
    }
}
