package seaecho.domain.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import seaecho.config.ScatteringParameterSet;
import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.water.SeawaterState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resultado inmutable de un barrido.
 * <p>
 * Todos los arrays están alineados por índice con el eje barrido: la posición i de
 * {@code ka}, de {@code ts[modelo]}, de {@code frequencies} y de {@code scattererDiameters}
 * corresponde al i-ésimo valor de entrada. Los getters devuelven copias.
 */
public final class ScatteringResultSet {

    private final ScatteringParameterSet parameters;
    private final SweepAxis axis;
    private final double[] frequencies;
    private final double[] scattererDiameters;
    private final double[] ka;
    private final Map<String, double[]> ts;
    private final SeawaterState water;
    private final Scatterer scatterer;
    private final long computationTime;

    /**
     * @param parameters         Eco del conjunto de parámetros de entrada.
     * @param axis               Variable barrida.
     * @param frequencies        Frecuencia de cada punto [kHz].
     * @param scattererDiameters Diámetro del dispersor en cada punto [m].
     * @param ka                 Número de onda adimensional por radio en cada punto.
     * @param ts                 TS [dB] por modelo, en el orden de solicitud.
     * @param water              Instantánea del agua usada en el barrido.
     * @param scatterer          Dispersor de referencia (el único en barridos de frecuencia,
     *                           el del primer punto en barridos de diámetro).
     * @param computationTime    Tiempo de cómputo [ms].
     */
    public ScatteringResultSet(ScatteringParameterSet parameters,
                               SweepAxis axis,
                               double[] frequencies,
                               double[] scattererDiameters,
                               double[] ka,
                               Map<String, double[]> ts,
                               SeawaterState water,
                               Scatterer scatterer,
                               long computationTime) {
        this.parameters = Objects.requireNonNull(parameters, "Los parámetros no pueden ser nulos.");
        this.axis = Objects.requireNonNull(axis, "El eje del barrido no puede ser nulo.");
        this.water = Objects.requireNonNull(water, "El estado del agua no puede ser nulo.");
        this.scatterer = Objects.requireNonNull(scatterer, "El dispersor no puede ser nulo.");

        int points = ka.length;
        if (frequencies.length != points || scattererDiameters.length != points) {
            throw new IllegalArgumentException("Los arrays del resultado deben tener la misma longitud.");
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : ts.entrySet()) {
            if (entry.getValue().length != points) {
                throw new IllegalArgumentException("La serie TS del modelo " + entry.getKey() + " no está alineada con el eje.");
            }
            copy.put(entry.getKey(), entry.getValue().clone());
        }

        this.frequencies = frequencies.clone();
        this.scattererDiameters = scattererDiameters.clone();
        this.ka = ka.clone();
        this.ts = Collections.unmodifiableMap(copy);
        this.computationTime = computationTime;
    }

    public ScatteringParameterSet getParameters() {
        return parameters;
    }

    public SweepAxis getAxis() {
        return axis;
    }

    public double[] getFrequencies() {
        return frequencies.clone();
    }

    public double[] getScattererDiameters() {
        return scattererDiameters.clone();
    }

    public double[] getKa() {
        return ka.clone();
    }

    /**
     * Serie TS [dB] de un modelo.
     *
     * @throws IllegalArgumentException si el modelo no formó parte del barrido.
     */
    public double[] getTs(String model) {
        double[] values = ts.get(model);
        if (values == null) {
            throw new IllegalArgumentException("El modelo '" + model + "' no forma parte de este resultado. Modelos: " + ts.keySet());
        }
        return values.clone();
    }

    /**
     * Mapa completo modelo → serie TS (copias).
     */
    public Map<String, double[]> getTs() {
        Map<String, double[]> copy = new LinkedHashMap<>();
        ts.forEach((model, values) -> copy.put(model, values.clone()));
        return copy;
    }

    @JsonIgnore
    public Set<String> getModelNames() {
        return ts.keySet();
    }

    @JsonIgnore
    public int getPointCount() {
        return ka.length;
    }

    public SeawaterState getWater() {
        return water;
    }

    public Scatterer getScatterer() {
        return scatterer;
    }

    public long getComputationTime() {
        return computationTime;
    }

    /**
     * Aplana el resultado a una fila por par (punto, modelo), agrupado por modelo.
     */
    public List<TsExportRow> toExportRows() {
        List<TsExportRow> rows = new ArrayList<>(ts.size() * ka.length);
        for (Map.Entry<String, double[]> entry : ts.entrySet()) {
            double[] values = entry.getValue();
            for (int i = 0; i < values.length; i++) {
                rows.add(new TsExportRow(
                        frequencies[i],
                        values[i],
                        entry.getKey(),
                        scattererDiameters[i],
                        water.temperature(),
                        water.salinity(),
                        water.depth(),
                        water.ph(),
                        water.soundSpeed()
                ));
            }
        }
        return rows;
    }
}
