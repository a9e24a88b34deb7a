package seaecho.domain.scatterer;

import lombok.Builder;
import seaecho.domain.water.SeawaterState;

import java.util.Objects;

/**
 * Estado inmutable de una burbuja de gas a una profundidad dada.
 * <p>
 * Conserva una referencia al {@link SeawaterState} que la originó. No hay ciclo de
 * propiedad: el agua nunca conoce a la burbuja y ninguno de los dos cambia.
 *
 * @param diameter             Diámetro de la burbuja [m].
 * @param gasPressure          Presión interna del gas Pg [Pa].
 * @param gasDensity           Densidad del gas a la profundidad de la burbuja [kg/m³].
 * @param referenceGasDensity  Densidad del gas a nivel del mar y 20 °C [kg/m³].
 * @param gas                  Constantes del gas.
 * @param water                Estado del agua circundante.
 */
@Builder
public record BubbleState(
        double diameter,
        double gasPressure,
        double gasDensity,
        double referenceGasDensity,
        GasProperties gas,
        SeawaterState water
) implements Scatterer {

    public BubbleState {
        Objects.requireNonNull(gas, "Las propiedades del gas no pueden ser nulas.");
        Objects.requireNonNull(water, "El estado del agua no puede ser nulo.");
    }

    @Override
    public double radius() {
        return diameter / 2.0;
    }

    @Override
    public ScattererType type() {
        return ScattererType.GAS_BUBBLE;
    }

    public double heatCapacityRatio() {
        return gas.heatCapacityRatio();
    }

    public double molarMass() {
        return gas.molarMass();
    }

    public double specificHeat() {
        return gas.specificHeat();
    }

    public double thermalConductivity() {
        return gas.thermalConductivity();
    }

    /**
     * Velocidad del sonido adiabática en el gas de la burbuja [m/s].
     */
    public double gasSoundSpeed() {
        return Math.sqrt(gas.heatCapacityRatio() * gasPressure / gasDensity);
    }
}
