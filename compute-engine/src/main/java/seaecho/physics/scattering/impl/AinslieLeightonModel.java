package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.water.SeawaterState;

/**
 * Ainslie y Leighton (2011): sección eficaz de una burbuja con amortiguamiento
 * viscoso y térmico explícitos y re-radiación dependiente de la frecuencia.
 * <p>
 * La frecuencia natural se desplaza por el acoplamiento entre amortiguamiento y
 * re-radiación: {@code ω0' = ω0 / sqrt(1 + 2β0ε0/ω0)}.
 */
public class AinslieLeightonModel extends AbstractBubbleModel {

    public static final String NAME = "Ainslie_Leighton";

    public AinslieLeightonModel() {
        super(NAME);
    }

    @Override
    protected double backscatteringCrossSection(double frequencyKhz, double soundSpeed,
                                                SeawaterState water, BubbleState bubble) {
        final double a = bubble.radius();
        final double gamma = bubble.heatCapacityRatio();
        final double omega = 2.0 * Math.PI * frequencyKhz * 1000.0;
        final double rho = water.density();

        double omega0 = Math.sqrt(3.0 * gamma * water.pressure() / rho) / a;

        double viscous = 2.0 * water.dynamicViscosity() / (rho * a * a);
        double beta0 = viscous + thermalDamping(bubble, water);

        double epsilon = omega * a / soundSpeed;
        double epsilon0 = omega0 * a / soundSpeed;
        double omega0Shifted = omega0 / Math.sqrt(1.0 + 2.0 * beta0 * epsilon0 / omega0);
        double ratio = omega0Shifted * omega0Shifted / (omega * omega);

        double stiffness = ratio - 1.0 - 2.0 * beta0 * epsilon / omega;
        double loss = 2.0 * beta0 / omega + epsilon * ratio;

        return a * a / (stiffness * stiffness + loss * loss);
    }

    /**
     * Coeficiente de amortiguamiento térmico β_th = 3(γ − 1)D / (2a²) [1/s], con la
     * difusividad D = K / (ρ·cp) formada con la conductividad del gas y la densidad y
     * el calor específico del agua.
     */
    static double thermalDamping(BubbleState bubble, SeawaterState water) {
        double a = bubble.radius();
        double diffusivity = bubble.thermalConductivity() / (water.density() * water.specificHeat());
        return 3.0 * (bubble.heatCapacityRatio() - 1.0) * diffusivity / (2.0 * a * a);
    }
}
