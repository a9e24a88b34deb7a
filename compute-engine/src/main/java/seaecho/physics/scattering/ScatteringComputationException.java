package seaecho.physics.scattering;

/**
 * Un punto del barrido no produjo un TS finito ni siquiera tras aplicar
 * la política de respaldo de resonancia.
 * <p>
 * Conserva la frecuencia y el modelo para el diagnóstico.
 */
public class ScatteringComputationException extends RuntimeException {

    private final String model;
    private final double frequencyKhz;

    public ScatteringComputationException(String message) {
        super(message);
        this.model = null;
        this.frequencyKhz = Double.NaN;
    }

    public ScatteringComputationException(String message, String model, double frequencyKhz) {
        super(message + " (modelo: " + model + ", f=" + frequencyKhz + " kHz)");
        this.model = model;
        this.frequencyKhz = frequencyKhz;
    }

    public ScatteringComputationException(String message, Throwable cause) {
        super(message, cause);
        this.model = null;
        this.frequencyKhz = Double.NaN;
    }

    /** Modelo que falló, o null si el fallo es previo a cualquier modelo. */
    public String getModel() {
        return model;
    }

    /** Frecuencia del punto fallido [kHz], NaN si no aplica. */
    public double getFrequencyKhz() {
        return frequencyKhz;
    }
}
