package seaecho.physics.model;

import seaecho.config.ScatteringParameterSet;
import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.scatterer.GasProperties;
import seaecho.domain.water.SeawaterState;

/**
 * Burbuja en equilibrio mecánico con gas ideal en su interior.
 * <p>
 * La presión interna es la presión hidrostática más la sobrepresión de Laplace
 * ({@code 2σ/a}), menos la presión parcial del vapor de agua.
 */
public class IdealGasBubbleModel implements GasBubbleModel {

    public static final double GAS_CONSTANT = 8.31446261815324; // J/(mol·K)

    // Condiciones de referencia: nivel del mar y 20 °C
    private static final double REFERENCE_PRESSURE = EmpiricalSeawaterModel.ATMOSPHERIC_PRESSURE;
    private static final double REFERENCE_TEMPERATURE = 293.15;

    @Override
    public BubbleState derive(double diameter, GasProperties gas, SeawaterState water) {
        ScatteringParameterSet.validateDiameter(diameter);
        double radius = diameter / 2.0;

        double hydrostatic = REFERENCE_PRESSURE + water.density() * EmpiricalSeawaterModel.GRAVITY * water.depth();
        double laplace = 2.0 * water.surfaceTension() / radius;
        double gasPressure = hydrostatic + laplace - water.vaporPressure();

        double gasDensity = gasPressure * gas.molarMass() / (GAS_CONSTANT * water.absoluteTemperature());
        double referenceDensity = REFERENCE_PRESSURE * gas.molarMass() / (GAS_CONSTANT * REFERENCE_TEMPERATURE);

        return BubbleState.builder()
                .diameter(diameter)
                .gasPressure(gasPressure)
                .gasDensity(gasDensity)
                .referenceGasDensity(referenceDensity)
                .gas(gas)
                .water(water)
                .build();
    }
}
